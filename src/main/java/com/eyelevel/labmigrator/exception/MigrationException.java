package com.eyelevel.labmigrator.exception;

import java.io.Serial;

/**
 * A base exception for errors that occur in the migration pipeline.
 */
public class MigrationException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 4656352395708234308L;

    public MigrationException(String message) {
        super(message);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
