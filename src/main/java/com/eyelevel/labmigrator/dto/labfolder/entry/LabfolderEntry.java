package com.eyelevel.labmigrator.dto.labfolder.entry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One item of {@code GET entries}, requested with {@code expand=author,project,last_editor}.
 *
 * @param elements References to the entry's elements in display order; their content is fetched separately.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LabfolderEntry(String id,
                             @JsonProperty("entry_number") Integer entryNumber,
                             String title,
                             List<String> tags,
                             @JsonProperty("project_id") String projectId,
                             LabfolderProject project,
                             LabfolderUser author,
                             @JsonProperty("last_editor") LabfolderUser lastEditor,
                             @JsonProperty("creation_date") String creationDate,
                             @JsonProperty("version_date") String versionDate,
                             List<ElementReference> elements) {

    public LabfolderEntry {
        tags = tags == null ? List.of() : tags;
        elements = elements == null ? List.of() : elements;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LabfolderProject(String id,
                                   String title,
                                   @JsonProperty("creation_date") String creationDate,
                                   @JsonProperty("number_of_entries") Integer numberOfEntries) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LabfolderUser(String id,
                                @JsonProperty("first_name") String firstName,
                                @JsonProperty("last_name") String lastName) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ElementReference(String id, String type) {
    }
}
