package com.eyelevel.labmigrator.model.element;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * A spreadsheet element. {@code content} is the SpreadJS document, an object with a {@code sheets} map.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class TableElement extends Element {

    private String title;

    private JsonNode content;

    public TableElement() {
        super(ElementType.TABLE, null);
    }

    public TableElement(String id, String title, JsonNode content) {
        super(ElementType.TABLE, id);
        this.title = title;
        this.content = content;
    }
}
