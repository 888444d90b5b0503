package com.eyelevel.labmigrator.exception.apiclient;

import lombok.Getter;

import java.io.Serial;

/**
 * Base class for errors returned by, or raised while talking to, the Labfolder and eLabFTW APIs.
 *
 * <p>Carries the HTTP status code so callers can tell an authorization problem from a missing
 * resource or a transient outage.
 */
@Getter
public class ApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 4830840555831897529L;
    private final int statusCode;

    /**
     * @param message    A descriptive message about the exception.
     * @param statusCode The HTTP status code associated with the exception.
     */
    public ApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }
}
