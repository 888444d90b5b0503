package com.eyelevel.labmigrator.model.element;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * The closed set of Labfolder element kinds the migrator understands, plus {@link #UNSUPPORTED}
 * for anything else the API returns.
 */
@Getter
@RequiredArgsConstructor
public enum ElementType {
    TABLE("TABLE", "table"),
    WELL_PLATE("WELL_PLATE", "well-plate"),
    TEXT("TEXT", "text"),
    FILE("FILE", "file"),
    IMAGE("IMAGE", "image"),
    DATA("DATA", "data"),
    UNSUPPORTED(null, null);

    /**
     * The {@code type} label used in Labfolder entry listings.
     */
    private final String label;

    /**
     * The path segment of the element endpoint, {@code elements/<segment>/{id}}.
     */
    private final String endpointSegment;

    public static ElementType fromLabel(String label) {
        if (label == null) {
            return UNSUPPORTED;
        }
        String normalized = label.strip().toUpperCase();
        return Arrays.stream(values())
                .filter(type -> type.label != null && type.label.equals(normalized))
                .findFirst()
                .orElse(UNSUPPORTED);
    }
}
