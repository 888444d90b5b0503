package com.eyelevel.labmigrator.dto.labfolder.export;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Set;

/**
 * One item of {@code GET exports/pdf} or {@code GET exports/xhtml}.
 *
 * @param status       NEW, QUEUED, RUNNING, FINISHED or one of the {@link #FAILED_STATUSES}.
 * @param creationDate ISO-8601 timestamp; sorts chronologically as a string.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExportResponse(String id,
                             String status,
                             @JsonProperty("download_filename") String downloadFilename,
                             @JsonProperty("creation_date") String creationDate) {

    public static final String FINISHED = "FINISHED";
    public static final String ACTIVE_STATUSES = "NEW,RUNNING,QUEUED,FINISHED";
    public static final Set<String> FAILED_STATUSES = Set.of("ERROR", "REMOVED", "ABORT_PARALLEL");

    public boolean isFinished() {
        return FINISHED.equals(normalizedStatus());
    }

    public boolean isFailed() {
        return FAILED_STATUSES.contains(normalizedStatus());
    }

    private String normalizedStatus() {
        return status == null ? "" : status.strip().toUpperCase(Locale.ROOT);
    }
}
