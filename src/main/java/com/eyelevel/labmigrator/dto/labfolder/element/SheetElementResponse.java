package com.eyelevel.labmigrator.dto.labfolder.element;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Response of {@code GET elements/table/{id}} and {@code GET elements/well-plate/{id}}.
 *
 * @param content A SpreadJS document for tables. Well plates carry either a SpreadJS document or a text node
 *                holding delimiter-separated values.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SheetElementResponse(String id, String title, JsonNode content) {
}
