package com.eyelevel.labmigrator.dto.labfolder.element;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response of {@code GET elements/text/{id}}; {@code content} is HTML.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TextElementResponse(String id, String content) {
}
