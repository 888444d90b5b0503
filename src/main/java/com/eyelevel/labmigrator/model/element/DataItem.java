package com.eyelevel.labmigrator.model.element;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * One node of a Labfolder data element tree. Groups have children and no value; leaves have a value and
 * an optional unit.
 *
 * @param type     The Labfolder data element type, e.g. {@code SINGLE_DATA_ELEMENT} or {@code DATA_ELEMENT_GROUP}.
 * @param title    The label shown in Labfolder.
 * @param value    The value rendered as text, or the description of a descriptive element.
 * @param unit     The unit of a numeric value, if any.
 * @param children Nested items of a group; empty for leaves.
 */
public record DataItem(String type, String title, String value, String unit, List<DataItem> children) {

    public DataItem {
        children = children == null ? List.of() : List.copyOf(children);
    }

    @JsonIgnore
    public boolean isGroup() {
        return !children.isEmpty();
    }
}
