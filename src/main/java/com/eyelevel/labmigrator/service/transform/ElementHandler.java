package com.eyelevel.labmigrator.service.transform;

import com.eyelevel.labmigrator.model.Entry;
import com.eyelevel.labmigrator.model.TransformedUnit;
import com.eyelevel.labmigrator.model.element.Element;
import com.eyelevel.labmigrator.model.element.ElementType;

/**
 * Converts one kind of Labfolder element into its eLabFTW representation.
 */
public interface ElementHandler {

    /**
     * Determines if this handler can convert elements of the given type.
     */
    boolean supports(ElementType type);

    /**
     * Converts the element. Must not call any remote service and must return the same fragment and attachment
     * name, type and content for the same element.
     *
     * @param entry   The entry the element belongs to; its id is used to name attachments.
     * @param element An element of a type this handler {@link #supports(ElementType) supports}.
     * @throws com.eyelevel.labmigrator.exception.ElementTransformationException if the payload cannot be converted.
     */
    TransformedUnit handle(Entry entry, Element element);
}
