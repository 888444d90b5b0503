package com.eyelevel.labmigrator.exception.apiclient;

import java.io.Serial;

/**
 * HTTP 429: the remote API is rate limiting this client.
 */
public class TooManyRequestsException extends ApiException {

    @Serial
    private static final long serialVersionUID = -904812736650382219L;

    public TooManyRequestsException(String message) {
        super(message, 429);
    }
}
