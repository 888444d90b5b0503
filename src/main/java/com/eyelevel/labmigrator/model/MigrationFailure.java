package com.eyelevel.labmigrator.model;

/**
 * A failure recorded during a run, with enough identifiers to locate it in Labfolder and eLabFTW.
 * Identifiers that do not apply are {@code null}.
 */
public record MigrationFailure(FailureSeverity severity, String projectId, String entryId, String elementId,
                               String experimentId, String message) {

    public static MigrationFailure fatal(String message) {
        return new MigrationFailure(FailureSeverity.FATAL, null, null, null, null, message);
    }

    public static MigrationFailure cache(String message) {
        return new MigrationFailure(FailureSeverity.CACHE, null, null, null, null, message);
    }

    public static MigrationFailure entry(String projectId, String entryId, String elementId, String message) {
        return new MigrationFailure(FailureSeverity.ENTRY, projectId, entryId, elementId, null, message);
    }

    public static MigrationFailure element(String projectId, String entryId, String elementId, String message) {
        return new MigrationFailure(FailureSeverity.ELEMENT, projectId, entryId, elementId, null, message);
    }

    public static MigrationFailure group(String projectId, String experimentId, String message) {
        return new MigrationFailure(FailureSeverity.GROUP, projectId, null, null, experimentId, message);
    }

    public static MigrationFailure attachment(String projectId, String entryId, String elementId,
                                              String experimentId, String message) {
        return new MigrationFailure(FailureSeverity.ATTACHMENT, projectId, entryId, elementId, experimentId, message);
    }

    @Override
    public String toString() {
        return "[%s] project=%s entry=%s element=%s experiment=%s: %s".formatted(severity, projectId, entryId,
                                                                              elementId, experimentId, message);
    }
}
