package com.eyelevel.labmigrator.model;

import com.eyelevel.labmigrator.model.element.Element;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One Labfolder notebook page with its resolved elements, in display order.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Entry {

    private String id;
    private Integer entryNumber;
    private String title;
    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private String projectId;
    private String projectTitle;
    private String projectCreationDate;
    private Integer projectEntryCount;

    private Author author;
    private Author lastEditor;
    private String creationDate;
    private String versionDate;

    @Builder.Default
    private List<Element> elements = new ArrayList<>();

    @Builder.Default
    private List<ElementFetchFailure> fetchFailures = new ArrayList<>();

    @JsonIgnore
    public String getAuthorName() {
        return author == null ? "" : author.fullName();
    }

    /**
     * @return a copy of this entry without elements, used as the per-row entry column of the CSV cache.
     */
    public Entry withoutElements() {
        return toBuilder().elements(new ArrayList<>()).build();
    }
}
