package com.eyelevel.labmigrator.service.transform.impl;

import com.eyelevel.labmigrator.config.MigrationConfig;
import com.eyelevel.labmigrator.model.Attachment;
import com.eyelevel.labmigrator.model.Entry;
import com.eyelevel.labmigrator.model.TransformedUnit;
import com.eyelevel.labmigrator.model.element.Element;
import com.eyelevel.labmigrator.service.transform.ElementHandler;
import com.eyelevel.labmigrator.service.transform.spreadsheet.HtmlTableRenderer;
import com.eyelevel.labmigrator.service.transform.spreadsheet.SheetGrid;
import com.eyelevel.labmigrator.service.transform.spreadsheet.XlsxWorkbookWriter;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Entities;

import java.util.List;

/**
 * Turns spreadsheet-like elements into one xlsx attachment plus a body fragment that links it and previews the
 * first rows of the first sheet.
 */
@Slf4j
public abstract class AbstractSheetElementHandler implements ElementHandler {

    private final XlsxWorkbookWriter workbookWriter;
    private final HtmlTableRenderer tableRenderer;
    private final MigrationConfig migrationConfig;

    protected AbstractSheetElementHandler(XlsxWorkbookWriter workbookWriter, HtmlTableRenderer tableRenderer,
                                          MigrationConfig migrationConfig) {
        this.workbookWriter = workbookWriter;
        this.tableRenderer = tableRenderer;
        this.migrationConfig = migrationConfig;
    }

    /**
     * Extracts the sheets of the element; an empty list means there is nothing to attach.
     */
    protected abstract List<SheetGrid> readSheets(Element element);

    /**
     * Suffix of the attachment name, {@code <entryId>_<elementId>_<suffix>.xlsx}.
     */
    protected abstract String fileSuffix();

    protected abstract String emptyNotice();

    protected abstract String title(Element element);

    @Override
    public TransformedUnit handle(Entry entry, Element element) {
        List<SheetGrid> sheets = readSheets(element).stream().filter(sheet -> !sheet.isEmpty()).toList();
        TransformedUnit.TransformedUnitBuilder unit = TransformedUnit.builder()
                .entryId(entry.getId())
                .elementId(element.getId())
                .elementType(element.getElementType());
        if (sheets.isEmpty()) {
            log.info("Entry {}: {} element {} has no data.", entry.getId(), element.getElementType(), element.getId());
            return unit.htmlFragment(emptyNotice()).build();
        }

        Attachment attachment = Attachment.builder()
                .fileName("%s_%s_%s.xlsx".formatted(entry.getId(), element.getId(), fileSuffix()))
                .mimeType(XlsxWorkbookWriter.MIME_TYPE)
                .content(workbookWriter.write(sheets))
                .build();

        StringBuilder fragment = new StringBuilder();
        String title = title(element);
        if (title != null && !title.isBlank()) {
            fragment.append("<p><strong>").append(Entities.escape(title)).append("</strong></p>");
        }
        fragment.append("<p>Attached spreadsheet: <a href=\"").append(attachment.placeholderAttribute()).append("\">")
                .append(Entities.escape(attachment.getFileName())).append("</a>");
        if (sheets.size() > 1) {
            fragment.append(" (").append(sheets.size()).append(" sheets)");
        }
        fragment.append("</p>");
        fragment.append(tableRenderer.renderPreview(sheets.get(0), migrationConfig.getTransform().getPreviewRows()));

        return unit.htmlFragment(fragment.toString()).attachment(attachment).build();
    }
}
