package com.eyelevel.labmigrator.model.element;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * A well plate layout. {@code content} is either a SpreadJS document (same shape as a table) or a text node
 * holding delimiter-separated rows.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class WellPlateElement extends Element {

    private String title;

    private JsonNode content;

    public WellPlateElement() {
        super(ElementType.WELL_PLATE, null);
    }

    public WellPlateElement(String id, String title, JsonNode content) {
        super(ElementType.WELL_PLATE, id);
        this.title = title;
        this.content = content;
    }
}
