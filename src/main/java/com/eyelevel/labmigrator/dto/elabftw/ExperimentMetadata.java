package com.eyelevel.labmigrator.dto.elabftw;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * The experiment metadata document holding the extra fields.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ExperimentMetadata(ElabftwSection elabftw,
                                 @JsonProperty("extra_fields") Map<String, ExtraField> extraFields) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ElabftwSection(@JsonProperty("display_main_text") Boolean displayMainText,
                                 @JsonProperty("extra_fields_groups") List<Integer> extraFieldsGroups) {
    }

    /**
     * One extra field. {@code type} is {@code text} for plain values and {@code items} for a link to a resource.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record ExtraField(String type, String value, @JsonProperty("group_id") Integer groupId,
                             String description) {

        public static ExtraField text(String value) {
            return new ExtraField("text", value == null ? "" : value, 0, "");
        }

        public static ExtraField items(String value) {
            return new ExtraField("items", value, 0, "");
        }
    }
}
