package com.eyelevel.labmigrator.service.transform.impl;

import com.eyelevel.labmigrator.model.Entry;
import com.eyelevel.labmigrator.model.TransformedUnit;
import com.eyelevel.labmigrator.model.element.DataElement;
import com.eyelevel.labmigrator.model.element.DataItem;
import com.eyelevel.labmigrator.model.element.Element;
import com.eyelevel.labmigrator.model.element.ElementType;
import com.eyelevel.labmigrator.service.transform.ElementHandler;
import org.jsoup.nodes.Entities;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders a data element as a Title / Value / Unit table. Groups are flattened; a nested item's title is the
 * path of group titles joined by {@code /}.
 */
@Component
public class DataElementHandler implements ElementHandler {

    @Override
    public boolean supports(ElementType type) {
        return type == ElementType.DATA;
    }

    @Override
    public TransformedUnit handle(Entry entry, Element element) {
        StringBuilder html = new StringBuilder("<table><tr><th>Title</th><th>Value</th><th>Unit</th></tr>");
        appendRows(html, ((DataElement) element).getItems(), "");
        html.append("</table>");
        return TransformedUnit.builder()
                .entryId(entry.getId())
                .elementId(element.getId())
                .elementType(ElementType.DATA)
                .htmlFragment(html.toString())
                .build();
    }

    private static void appendRows(StringBuilder html, List<DataItem> items, String prefix) {
        if (items == null) {
            return;
        }
        for (DataItem item : items) {
            String title = prefix + (item.title() == null ? "" : item.title());
            if (item.isGroup()) {
                appendRows(html, item.children(), title + "/");
                continue;
            }
            html.append("<tr><td>").append(escape(title))
                .append("</td><td>").append(escape(item.value()))
                .append("</td><td>").append(escape(item.unit()))
                .append("</td></tr>");
        }
    }

    private static String escape(String value) {
        return value == null ? "" : Entities.escape(value);
    }
}
