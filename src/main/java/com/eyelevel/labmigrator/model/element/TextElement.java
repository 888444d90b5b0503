package com.eyelevel.labmigrator.model.element;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Rich text; {@code content} is the HTML markup as stored in Labfolder.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class TextElement extends Element {

    private String content;

    public TextElement() {
        super(ElementType.TEXT, null);
    }

    public TextElement(String id, String content) {
        super(ElementType.TEXT, id);
        this.content = content;
    }
}
