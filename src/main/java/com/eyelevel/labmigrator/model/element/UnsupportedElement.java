package com.eyelevel.labmigrator.model.element;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * An element whose Labfolder type the migrator has no handler for (sketches, chemical structures, ...).
 * Only the id and the raw type label are kept.
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class UnsupportedElement extends Element {

    public UnsupportedElement() {
        super();
    }

    public UnsupportedElement(String id, String rawType) {
        super();
        setId(id);
        setType(rawType);
    }
}
