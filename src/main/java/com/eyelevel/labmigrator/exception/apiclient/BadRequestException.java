package com.eyelevel.labmigrator.exception.apiclient;

import java.io.Serial;

/**
 * HTTP 400: the remote API rejected the request payload.
 */
public class BadRequestException extends ApiException {

    @Serial
    private static final long serialVersionUID = 7152309281830112740L;

    public BadRequestException(String message) {
        super(message, 400);
    }
}
