package com.eyelevel.labmigrator.model.element;

import lombok.EqualsAndHashCode;
import lombok.ToString;

@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class FileElement extends BinaryElement {

    public FileElement() {
        super(ElementType.FILE, null, null, null, null);
    }

    public FileElement(String id, String fileName, String mimeType, byte[] content) {
        super(ElementType.FILE, id, fileName, mimeType, content);
    }
}
