package com.eyelevel.labmigrator.dto.labfolder.element;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response of {@code GET elements/data/{id}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DataElementResponse(String id, @JsonProperty("data_elements") List<DataElementNode> dataElements) {

    public DataElementResponse {
        dataElements = dataElements == null ? List.of() : dataElements;
    }

    /**
     * A node of the data tree. Numeric values arrive as JSON numbers and are read as text.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DataElementNode(String type, String title, String value, String unit, String description,
                                  List<DataElementNode> children) {
    }
}
