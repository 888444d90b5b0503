package com.eyelevel.labmigrator.service.transform.spreadsheet;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the sheets of a SpreadJS document:
 * {@code {"sheets": {"<name>": {"rowCount": n, "columnCount": m, "data": {"dataTable": {"<row>": {"<col>":
 * {"value": ...}}}}}}}}. The data table is sparse; absent cells become empty strings.
 * Only values that are JSON numbers are marked numeric; numeric-looking strings stay text.
 */
@Slf4j
@Component
public class SpreadJsSheetReader {

    public boolean isSpreadJs(JsonNode content) {
        return content != null && content.isObject() && content.path("sheets").isObject();
    }

    public List<SheetGrid> read(JsonNode content) {
        List<SheetGrid> grids = new ArrayList<>();
        if (!isSpreadJs(content)) {
            return grids;
        }
        Iterator<Map.Entry<String, JsonNode>> sheets = content.get("sheets").fields();
        while (sheets.hasNext()) {
            Map.Entry<String, JsonNode> sheet = sheets.next();
            if (!sheet.getValue().isObject()) {
                log.warn("Skipping sheet '{}': not a SpreadJS sheet object.", sheet.getKey());
                continue;
            }
            grids.add(readSheet(sheet.getKey(), sheet.getValue()));
        }
        return grids;
    }

    private SheetGrid readSheet(String name, JsonNode sheet) {
        JsonNode dataTable = sheet.path("data").path("dataTable");
        int rowCount = Math.max(sheet.path("rowCount").asInt(0), maxIndex(dataTable) + 1);
        int columnCount = sheet.path("columnCount").asInt(0);
        if (columnCount == 0) {
            for (JsonNode row : dataTable) {
                columnCount = Math.max(columnCount, maxIndex(row) + 1);
            }
        }

        List<List<String>> rows = new ArrayList<>(rowCount);
        Set<SheetGrid.Position> numericCells = new HashSet<>();
        for (int i = 0; i < rowCount; i++) {
            JsonNode row = dataTable.path(String.valueOf(i));
            List<String> cells = new ArrayList<>(columnCount);
            for (int j = 0; j < columnCount; j++) {
                JsonNode cell = row.path(String.valueOf(j));
                if (cellValue(cell).isNumber()) {
                    numericCells.add(new SheetGrid.Position(i, j));
                }
                cells.add(cellText(cell));
            }
            rows.add(cells);
        }
        return new SheetGrid(name, trimTrailingEmptyRows(rows), numericCells);
    }

    private static JsonNode cellValue(JsonNode cell) {
        return cell.isObject() ? cell.path("value") : cell;
    }

    private static String cellText(JsonNode cell) {
        JsonNode value = cellValue(cell);
        if (value.isMissingNode() || value.isNull()) {
            return "";
        }
        if (value.isContainerNode()) {
            return value.toString();
        }
        return value.asText();
    }

    private static int maxIndex(JsonNode node) {
        int max = -1;
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            try {
                max = Math.max(max, Integer.parseInt(names.next()));
            } catch (NumberFormatException e) {
                // not a row or column index
            }
        }
        return max;
    }

    private static List<List<String>> trimTrailingEmptyRows(List<List<String>> rows) {
        int end = rows.size();
        while (end > 0 && rows.get(end - 1).stream().allMatch(String::isEmpty)) {
            end--;
        }
        return rows.subList(0, end);
    }
}
