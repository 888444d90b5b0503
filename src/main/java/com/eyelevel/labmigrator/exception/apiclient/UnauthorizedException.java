package com.eyelevel.labmigrator.exception.apiclient;

import java.io.Serial;

/**
 * HTTP 401: the bearer token or API key was missing, expired or rejected.
 */
public class UnauthorizedException extends ApiException {

    @Serial
    private static final long serialVersionUID = -6346735715117211440L;

    public UnauthorizedException(String message) {
        super(message, 401);
    }
}
