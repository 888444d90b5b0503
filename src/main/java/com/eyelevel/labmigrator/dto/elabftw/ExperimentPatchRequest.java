package com.eyelevel.labmigrator.dto.elabftw;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body of {@code PATCH experiments/{id}}.
 *
 * @param metadata The experiment metadata serialized to a JSON string, as eLabFTW stores it.
 * @param userid   New owner of the experiment; omitted to keep the API key's user.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExperimentPatchRequest(String body, Integer category, String metadata, Integer userid) {
}
