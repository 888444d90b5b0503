package com.eyelevel.labmigrator.exception;

import java.io.Serial;

/**
 * The export is still queued or running; the poll is retried.
 */
public class ExportPendingException extends MigrationException {
    @Serial
    private static final long serialVersionUID = -6286017438551910243L;

    public ExportPendingException(String message) {
        super(message);
    }
}
