package com.eyelevel.labmigrator.exception;

import java.io.Serial;

/**
 * A Labfolder PDF or XHTML export failed, did not finish in time or could not be stored. Never aborts the run.
 */
public class ExportException extends MigrationException {
    @Serial
    private static final long serialVersionUID = 4410928365017723911L;

    public ExportException(String message) {
        super(message);
    }

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
