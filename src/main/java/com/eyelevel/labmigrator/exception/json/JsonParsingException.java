package com.eyelevel.labmigrator.exception.json;

import java.io.Serial;

/**
 * Thrown when an API payload or a cache record cannot be read from, or written to, JSON.
 */
public class JsonParsingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 2208345137764093911L;

    public JsonParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
