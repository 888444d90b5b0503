package com.eyelevel.labmigrator.model;

import java.util.List;

/**
 * Outcome of importing one project group.
 *
 * @param experimentId The eLabFTW experiment id, {@code null} when creation failed.
 * @param body         The body that was (or would have been) patched into the experiment.
 * @param uploads      Attachments that were uploaded, in body order.
 * @param failures     Group and attachment failures of this import.
 */
public record GroupImportResult(String projectId, String experimentId, ImportStatus status, String body,
                                List<UploadedAttachment> uploads, List<MigrationFailure> failures) {

    public GroupImportResult {
        uploads = List.copyOf(uploads);
        failures = List.copyOf(failures);
    }

    public static GroupImportResult skipped(String projectId, String experimentId) {
        return new GroupImportResult(projectId, experimentId, ImportStatus.SKIPPED, null, List.of(), List.of());
    }
}
