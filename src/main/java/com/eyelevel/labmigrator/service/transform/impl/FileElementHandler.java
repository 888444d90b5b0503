package com.eyelevel.labmigrator.service.transform.impl;

import com.eyelevel.labmigrator.model.Attachment;
import com.eyelevel.labmigrator.model.Entry;
import com.eyelevel.labmigrator.model.TransformedUnit;
import com.eyelevel.labmigrator.model.element.BinaryElement;
import com.eyelevel.labmigrator.model.element.Element;
import com.eyelevel.labmigrator.model.element.ElementType;
import com.eyelevel.labmigrator.service.transform.ElementHandler;
import org.apache.commons.io.FilenameUtils;
import org.jsoup.nodes.Entities;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

/**
 * Passes file and image bytes through as the attachment. Files are linked, images shown inline.
 */
@Component
public class FileElementHandler implements ElementHandler {

    @Override
    public boolean supports(ElementType type) {
        return type == ElementType.FILE || type == ElementType.IMAGE;
    }

    @Override
    public TransformedUnit handle(Entry entry, Element element) {
        BinaryElement binary = (BinaryElement) element;
        ElementType type = element.getElementType();
        Attachment attachment = Attachment.builder()
                .fileName(fileName(binary))
                .mimeType(binary.getMimeType() == null ? MediaType.APPLICATION_OCTET_STREAM_VALUE
                                                       : binary.getMimeType())
                .content(binary.getContent() == null ? new byte[0] : binary.getContent())
                .build();

        String fragment = type == ElementType.IMAGE
                ? "<p><img src=\"%s\" alt=\"%s\"></p>".formatted(
                        attachment.placeholderAttribute(), Attachment.attributeValue(attachment.getFileName()))
                : "<p>Attached file: <a href=\"%s\">%s</a></p>".formatted(
                        attachment.placeholderAttribute(), Entities.escape(attachment.getFileName()));
        return TransformedUnit.builder()
                .entryId(entry.getId())
                .elementId(element.getId())
                .elementType(type)
                .htmlFragment(fragment)
                .attachment(attachment)
                .build();
    }

    private static String fileName(BinaryElement element) {
        String name = element.getFileName() == null ? null : FilenameUtils.getName(element.getFileName());
        return name == null || name.isBlank() ? element.getId() + ".bin" : name;
    }
}
