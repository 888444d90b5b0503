package com.eyelevel.labmigrator.model;

import com.eyelevel.labmigrator.model.element.ElementType;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * The canonical form of one element: an HTML fragment for the experiment body and at most one attachment.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class TransformedUnit {

    private final String entryId;
    private final String elementId;
    private final ElementType elementType;
    private final String htmlFragment;
    private final Attachment attachment;

    public Optional<Attachment> attachment() {
        return Optional.ofNullable(attachment);
    }
}
