package com.eyelevel.labmigrator.dto.elabftw;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One item of {@code GET experiments/{id}/uploads}.
 *
 * @param realName The name the file was uploaded with.
 * @param longName The storage path eLabFTW generated for the file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UploadResponse(String id,
                             @JsonProperty("real_name") String realName,
                             @JsonProperty("long_name") String longName,
                             String storage) {
}
