package com.eyelevel.labmigrator.exception.apiclient;

import java.io.Serial;

/**
 * HTTP 404: the entry, element or experiment does not exist on the remote side.
 */
public class NotFoundException extends ApiException {

    @Serial
    private static final long serialVersionUID = -2019493322846609137L;

    public NotFoundException(String message) {
        super(message, 404);
    }
}
