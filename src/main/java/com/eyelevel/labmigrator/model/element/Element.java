package com.eyelevel.labmigrator.model.element;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One typed content unit of a Labfolder entry.
 *
 * <p>The {@code type} property holds the Labfolder label and doubles as the Jackson type id, so cached
 * entries come back as the same subclass. Labels outside {@link ElementType} deserialize into
 * {@link UnsupportedElement}, which keeps the raw label for reporting.
 */
@Data
@NoArgsConstructor
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type",
              visible = true, defaultImpl = UnsupportedElement.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = TableElement.class, name = "TABLE"),
        @JsonSubTypes.Type(value = WellPlateElement.class, name = "WELL_PLATE"),
        @JsonSubTypes.Type(value = TextElement.class, name = "TEXT"),
        @JsonSubTypes.Type(value = FileElement.class, name = "FILE"),
        @JsonSubTypes.Type(value = ImageElement.class, name = "IMAGE"),
        @JsonSubTypes.Type(value = DataElement.class, name = "DATA")
})
public abstract class Element {

    private String id;

    private String type;

    protected Element(ElementType elementType, String id) {
        this.type = elementType.getLabel();
        this.id = id;
    }

    @JsonIgnore
    public ElementType getElementType() {
        return ElementType.fromLabel(type);
    }
}
