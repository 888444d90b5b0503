package com.eyelevel.labmigrator.model.element;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Generic structured data: a tree of titled values with units.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class DataElement extends Element {

    private List<DataItem> items = new ArrayList<>();

    public DataElement() {
        super(ElementType.DATA, null);
    }

    public DataElement(String id, List<DataItem> items) {
        super(ElementType.DATA, id);
        this.items = new ArrayList<>(items);
    }
}
