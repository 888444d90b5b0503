package com.eyelevel.labmigrator.exception.apiclient;

import java.io.Serial;

/**
 * HTTP 403: the credentials are valid but lack access to the resource.
 */
public class ForbiddenException extends ApiException {

    @Serial
    private static final long serialVersionUID = 1297763829112451130L;

    public ForbiddenException(String message) {
        super(message, 403);
    }
}
