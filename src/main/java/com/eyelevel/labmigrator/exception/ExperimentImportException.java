package com.eyelevel.labmigrator.exception;

import java.io.Serial;

/**
 * An eLabFTW call for one project group failed in a way that ends that group's import.
 */
public class ExperimentImportException extends MigrationException {
    @Serial
    private static final long serialVersionUID = -8713926675502364821L;

    public ExperimentImportException(String message) {
        super(message);
    }

    public ExperimentImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
