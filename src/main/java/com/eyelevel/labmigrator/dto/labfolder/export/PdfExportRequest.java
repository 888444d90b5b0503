package com.eyelevel.labmigrator.dto.labfolder.export;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of {@code POST exports/pdf} for one project, with the entry layout preserved and hidden items left out.
 */
public record PdfExportRequest(@JsonProperty("download_filename") String downloadFilename,
                               Settings settings,
                               Content content,
                               @JsonProperty("include_hidden_items") boolean includeHiddenItems) {

    public static PdfExportRequest forProject(String projectId, String downloadFilename) {
        return new PdfExportRequest(downloadFilename, new Settings(true),
                                    new Content(List.of(projectId), List.of(), List.of(), List.of()), false);
    }

    public record Settings(@JsonProperty("preserve_entry_layout") boolean preserveEntryLayout) {
    }

    public record Content(@JsonProperty("project_ids") List<String> projectIds,
                          @JsonProperty("entry_ids") List<String> entryIds,
                          @JsonProperty("template_ids") List<String> templateIds,
                          @JsonProperty("group_ids") List<String> groupIds) {
    }
}
