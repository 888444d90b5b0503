package com.eyelevel.labmigrator.service.transform;

import com.eyelevel.labmigrator.exception.ElementTransformationException;
import com.eyelevel.labmigrator.exception.UnsupportedElementTypeException;
import com.eyelevel.labmigrator.model.Entry;
import com.eyelevel.labmigrator.model.EntryTransformation;
import com.eyelevel.labmigrator.model.MigrationFailure;
import com.eyelevel.labmigrator.model.TransformedUnit;
import com.eyelevel.labmigrator.model.element.Element;
import com.eyelevel.labmigrator.service.transform.factory.ElementHandlerFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts entry elements into HTML fragments and attachments through the matching {@link ElementHandler}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ElementTransformerService {

    private final ElementHandlerFactory handlerFactory;

    /**
     * @throws UnsupportedElementTypeException if no handler supports the element's type.
     * @throws ElementTransformationException  if the handler fails on the payload.
     */
    public TransformedUnit transform(Entry entry, Element element) {
        ElementHandler handler = handlerFactory.getHandler(element.getElementType())
                .orElseThrow(() -> new UnsupportedElementTypeException(
                        "Unsupported element type '" + element.getType() + "' of element " + element.getId()));
        try {
            return handler.handle(entry, element);
        } catch (ElementTransformationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ElementTransformationException(
                    "Transforming " + element.getElementType() + " element " + element.getId() + " failed: "
                    + e.getMessage(), e);
        }
    }

    /**
     * Transforms every element of the entry. A failing element is left out and reported as an ELEMENT failure;
     * the other elements keep their relative order.
     */
    public EntryTransformation transformEntry(Entry entry) {
        List<TransformedUnit> units = new ArrayList<>();
        List<MigrationFailure> failures = new ArrayList<>();
        for (Element element : entry.getElements()) {
            try {
                units.add(transform(entry, element));
            } catch (UnsupportedElementTypeException | ElementTransformationException e) {
                log.warn("Entry {}: element {} skipped: {}", entry.getId(), element.getId(), e.getMessage());
                failures.add(MigrationFailure.element(entry.getProjectId(), entry.getId(), element.getId(),
                                                      e.getMessage()));
            }
        }
        log.debug("Entry {}: {} element(s) transformed, {} failed.", entry.getId(), units.size(), failures.size());
        return new EntryTransformation(entry, units, failures);
    }
}
