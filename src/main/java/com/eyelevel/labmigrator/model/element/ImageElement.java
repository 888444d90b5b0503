package com.eyelevel.labmigrator.model.element;

import lombok.EqualsAndHashCode;
import lombok.ToString;

@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ImageElement extends BinaryElement {

    public ImageElement() {
        super(ElementType.IMAGE, null, null, null, null);
    }

    public ImageElement(String id, String fileName, String mimeType, byte[] content) {
        super(ElementType.IMAGE, id, fileName, mimeType, content);
    }
}
