package com.eyelevel.labmigrator.exception.apiclient;

import java.io.Serial;

/**
 * HTTP 503, or the remote host could not be reached at all.
 */
public class ServiceUnavailableException extends ApiException {

    @Serial
    private static final long serialVersionUID = 3260988716612504382L;

    public ServiceUnavailableException(String message) {
        super(message, 503);
    }
}
