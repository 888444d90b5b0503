package com.eyelevel.labmigrator.support;

import com.eyelevel.labmigrator.common.json.jackson.JacksonJsonParser;
import com.eyelevel.labmigrator.common.json.jackson.JacksonJsonSerializer;
import com.eyelevel.labmigrator.model.Author;
import com.eyelevel.labmigrator.model.Entry;
import com.eyelevel.labmigrator.model.element.Element;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixtures shared by the service tests.
 */
public final class TestEntries {

    public static final ObjectMapper OBJECT_MAPPER = Jackson2ObjectMapperBuilder.json().build();

    private TestEntries() {
    }

    public static JacksonJsonParser jsonParser() {
        return new JacksonJsonParser(OBJECT_MAPPER);
    }

    public static JacksonJsonSerializer jsonSerializer() {
        return new JacksonJsonSerializer(OBJECT_MAPPER);
    }

    public static Entry entry(String id, String projectId, String firstName, String lastName, Element... elements) {
        return Entry.builder()
                .id(id)
                .entryNumber(1)
                .title("Entry " + id)
                .tags(new ArrayList<>(List.of("tag-" + id)))
                .projectId(projectId)
                .projectTitle(projectId == null ? null : "Project " + projectId)
                .projectCreationDate("2020-01-15T09:00:00.000+0100")
                .author(new Author(firstName, lastName))
                .lastEditor(new Author(firstName, lastName))
                .creationDate("2021-03-04T10:15:30.123+0100")
                .versionDate("2021-03-05T11:00:00.000+0100")
                .elements(new ArrayList<>(List.of(elements)))
                .build();
    }
}
