package com.eyelevel.labmigrator.service.export;

import com.eyelevel.labmigrator.model.Attachment;

/**
 * A file from a Labfolder export that is uploaded to a project's experiment.
 *
 * @param key Identifies the artifact within its project across runs, e.g. {@code export/pdf}.
 */
public record ExportArtifact(String key, Attachment attachment) {
}
