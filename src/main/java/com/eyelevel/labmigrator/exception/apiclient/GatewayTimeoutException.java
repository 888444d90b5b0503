package com.eyelevel.labmigrator.exception.apiclient;

import java.io.Serial;

/**
 * HTTP 504, or the request did not complete within the client timeout.
 */
public class GatewayTimeoutException extends ApiException {

    @Serial
    private static final long serialVersionUID = 8127354210974665121L;

    public GatewayTimeoutException(String message) {
        super(message, 504);
    }
}
