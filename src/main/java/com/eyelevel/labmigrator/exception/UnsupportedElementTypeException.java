package com.eyelevel.labmigrator.exception;

import java.io.Serial;

public class UnsupportedElementTypeException extends MigrationException {
    @Serial
    private static final long serialVersionUID = -4146823766536414925L;

    public UnsupportedElementTypeException(String message) {
        super(message);
    }
}
