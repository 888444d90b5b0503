package com.eyelevel.labmigrator.service.transform.impl;

import com.eyelevel.labmigrator.config.MigrationConfig;
import com.eyelevel.labmigrator.model.element.Element;
import com.eyelevel.labmigrator.model.element.ElementType;
import com.eyelevel.labmigrator.model.element.WellPlateElement;
import com.eyelevel.labmigrator.service.transform.spreadsheet.DelimitedTextReader;
import com.eyelevel.labmigrator.service.transform.spreadsheet.HtmlTableRenderer;
import com.eyelevel.labmigrator.service.transform.spreadsheet.SheetGrid;
import com.eyelevel.labmigrator.service.transform.spreadsheet.SpreadJsSheetReader;
import com.eyelevel.labmigrator.service.transform.spreadsheet.XlsxWorkbookWriter;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Well plates come either as a SpreadJS document, handled like a table, or as delimited text written to a
 * single {@code well_plate} sheet.
 */
@Component
public class WellPlateElementHandler extends AbstractSheetElementHandler {

    static final String SHEET_NAME = "well_plate";

    private final SpreadJsSheetReader spreadJsReader;
    private final DelimitedTextReader delimitedTextReader;

    public WellPlateElementHandler(XlsxWorkbookWriter workbookWriter, HtmlTableRenderer tableRenderer,
                                   MigrationConfig migrationConfig, SpreadJsSheetReader spreadJsReader,
                                   DelimitedTextReader delimitedTextReader) {
        super(workbookWriter, tableRenderer, migrationConfig);
        this.spreadJsReader = spreadJsReader;
        this.delimitedTextReader = delimitedTextReader;
    }

    @Override
    public boolean supports(ElementType type) {
        return type == ElementType.WELL_PLATE;
    }

    @Override
    protected List<SheetGrid> readSheets(Element element) {
        JsonNode content = ((WellPlateElement) element).getContent();
        if (spreadJsReader.isSpreadJs(content)) {
            return spreadJsReader.read(content);
        }
        if (content != null && content.isTextual() && !content.asText().isBlank()) {
            return List.of(delimitedTextReader.read(SHEET_NAME, content.asText()));
        }
        return List.of();
    }

    @Override
    protected String fileSuffix() {
        return "well_plate";
    }

    @Override
    protected String emptyNotice() {
        return "<p>[No data to convert for well plate]</p>";
    }

    @Override
    protected String title(Element element) {
        return ((WellPlateElement) element).getTitle();
    }
}
