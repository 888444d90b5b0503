package com.eyelevel.labmigrator.exception;

import java.io.Serial;

/**
 * Labfolder could not be logged into or its entries could not be listed. Aborts the run.
 */
public class SourceFetchException extends MigrationException {
    @Serial
    private static final long serialVersionUID = -1733540211867311205L;

    public SourceFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
