package com.eyelevel.labmigrator.service.transform.impl;

import com.eyelevel.labmigrator.model.Entry;
import com.eyelevel.labmigrator.model.TransformedUnit;
import com.eyelevel.labmigrator.model.element.Element;
import com.eyelevel.labmigrator.model.element.ElementType;
import com.eyelevel.labmigrator.model.element.TextElement;
import com.eyelevel.labmigrator.service.transform.ElementHandler;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

/**
 * Copies text element markup into the body unchanged. Markup with neither text nor images becomes a notice.
 */
@Slf4j
@Component
public class TextElementHandler implements ElementHandler {

    static final String EMPTY_NOTICE = "<p>[Empty text element]</p>";

    @Override
    public boolean supports(ElementType type) {
        return type == ElementType.TEXT;
    }

    @Override
    public TransformedUnit handle(Entry entry, Element element) {
        String content = ((TextElement) element).getContent();
        String fragment = isBlank(content) ? EMPTY_NOTICE : content;
        log.trace("Entry {}: text element {} -> {} chars.", entry.getId(), element.getId(), fragment.length());
        return TransformedUnit.builder()
                .entryId(entry.getId())
                .elementId(element.getId())
                .elementType(ElementType.TEXT)
                .htmlFragment(fragment)
                .build();
    }

    private static boolean isBlank(String content) {
        if (content == null || content.isBlank()) {
            return true;
        }
        org.jsoup.nodes.Element body = Jsoup.parseBodyFragment(content).body();
        return body.text().isBlank() && body.select("img, table").isEmpty();
    }
}
