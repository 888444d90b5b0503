package com.eyelevel.labmigrator.model.element;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Common payload of file and image elements: the downloaded bytes with their name and MIME type.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true, exclude = "content")
public abstract class BinaryElement extends Element {

    private String fileName;

    private String mimeType;

    private byte[] content;

    protected BinaryElement(ElementType elementType, String id, String fileName, String mimeType, byte[] content) {
        super(elementType, id);
        this.fileName = fileName;
        this.mimeType = mimeType;
        this.content = content;
    }
}
