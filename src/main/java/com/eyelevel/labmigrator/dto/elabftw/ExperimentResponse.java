package com.eyelevel.labmigrator.dto.elabftw;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The parts of {@code GET experiments/{id}} the importer reads.
 *
 * @param metadata Either a JSON string or an object, depending on the eLabFTW version; {@code null} when unset.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExperimentResponse(String id, String title, JsonNode metadata) {
}
