package com.eyelevel.labmigrator.service.transform.factory;

import com.eyelevel.labmigrator.model.element.ElementType;
import com.eyelevel.labmigrator.service.transform.ElementHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * A factory for retrieving the {@link ElementHandler} of an element type. The first handler that supports the
 * type wins.
 */
@Service
@Slf4j
public class ElementHandlerFactory {

    private final List<ElementHandler> handlers;

    public ElementHandlerFactory(List<ElementHandler> handlers) {
        this.handlers = handlers;
        log.info("ElementHandlerFactory initialized with {} available handlers.", handlers.size());
    }

    public Optional<ElementHandler> getHandler(ElementType type) {
        Optional<ElementHandler> handler = handlers.stream()
                .filter(h -> h.supports(type))
                .findFirst();
        log.trace("Searching for handler for element type '{}'. Found: {}", type,
                  handler.map(h -> h.getClass().getSimpleName()).orElse("None"));
        return handler;
    }
}
