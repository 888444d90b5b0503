package com.eyelevel.labmigrator.exception;

import java.io.Serial;

/**
 * A supported element could not be converted, e.g. a malformed SpreadJS sheet or a failed workbook write.
 */
public class ElementTransformationException extends MigrationException {
    @Serial
    private static final long serialVersionUID = 3317806624201775938L;

    public ElementTransformationException(String message) {
        super(message);
    }

    public ElementTransformationException(String message, Throwable cause) {
        super(message, cause);
    }
}
