package com.eyelevel.labmigrator.exception;

import com.eyelevel.labmigrator.model.RunReport;
import lombok.Getter;

import java.io.Serial;

/**
 * Raised by the coordinator when a failure before the import stage stops the run. No eLabFTW writes
 * have happened at that point. The report describes what was done up to the abort.
 */
@Getter
public class MigrationAbortedException extends MigrationException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final transient RunReport report;

    public MigrationAbortedException(String message, RunReport report, Throwable cause) {
        super(message, cause);
        this.report = report;
    }
}
