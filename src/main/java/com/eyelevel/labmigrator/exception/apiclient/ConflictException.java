package com.eyelevel.labmigrator.exception.apiclient;

import java.io.Serial;

/**
 * HTTP 409: the remote API reported a conflicting state.
 */
public class ConflictException extends ApiException {

    @Serial
    private static final long serialVersionUID = 5529304812273110461L;

    public ConflictException(String message) {
        super(message, 409);
    }
}
