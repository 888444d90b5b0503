package com.eyelevel.labmigrator.exception;

import java.io.Serial;

/**
 * The entry cache file is missing or cannot be parsed.
 */
public class CacheUnavailableException extends MigrationException {
    @Serial
    private static final long serialVersionUID = 6021198463357052019L;

    public CacheUnavailableException(String message) {
        super(message);
    }

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
