package com.eyelevel.labmigrator.service.transform.impl;

import com.eyelevel.labmigrator.config.MigrationConfig;
import com.eyelevel.labmigrator.model.element.Element;
import com.eyelevel.labmigrator.model.element.ElementType;
import com.eyelevel.labmigrator.model.element.TableElement;
import com.eyelevel.labmigrator.service.transform.spreadsheet.HtmlTableRenderer;
import com.eyelevel.labmigrator.service.transform.spreadsheet.SheetGrid;
import com.eyelevel.labmigrator.service.transform.spreadsheet.SpreadJsSheetReader;
import com.eyelevel.labmigrator.service.transform.spreadsheet.XlsxWorkbookWriter;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class TableElementHandler extends AbstractSheetElementHandler {

    private final SpreadJsSheetReader spreadJsReader;

    public TableElementHandler(XlsxWorkbookWriter workbookWriter, HtmlTableRenderer tableRenderer,
                               MigrationConfig migrationConfig, SpreadJsSheetReader spreadJsReader) {
        super(workbookWriter, tableRenderer, migrationConfig);
        this.spreadJsReader = spreadJsReader;
    }

    @Override
    public boolean supports(ElementType type) {
        return type == ElementType.TABLE;
    }

    @Override
    protected List<SheetGrid> readSheets(Element element) {
        return spreadJsReader.read(((TableElement) element).getContent());
    }

    @Override
    protected String fileSuffix() {
        return "table";
    }

    @Override
    protected String emptyNotice() {
        return "<p>[Empty or invalid table]</p>";
    }

    @Override
    protected String title(Element element) {
        return ((TableElement) element).getTitle();
    }
}
