package com.eyelevel.labmigrator.service.transform.spreadsheet;

import com.eyelevel.labmigrator.support.SampleElements;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SpreadJsSheetReaderTest {

    private final SpreadJsSheetReader reader = new SpreadJsSheetReader();

    @Test
    void readsSheetsInDocumentOrder() {
        List<SheetGrid> grids = reader.read(SampleElements.json(SampleElements.SPREADJS_TWO_SHEETS));

        assertThat(grids).extracting(SheetGrid::name).containsExactly("Results", "Notes");
        assertThat(grids.get(0).rows()).containsExactly(List.of("Sample", "OD"), List.of("A1", "0.42"),
                                                        List.of("A2", "1.5"));
    }

    @Test
    void fillsGapsOfSparseTableAndTrimsTrailingEmptyRows() {
        SheetGrid grid = reader.read(SampleElements.json("""
                {"sheets": {"S": {"rowCount": 6, "columnCount": 3, "data": {"dataTable": {
                  "0": {"2": {"value": "c"}},
                  "2": {"0": {"value": {"formula": "SUM(A1)"}}, "1": {"value": null}}}}}}}""")).get(0);

        assertThat(grid.rows()).containsExactly(List.of("", "", "c"), List.of("", "", ""),
                                                List.of("{\"formula\":\"SUM(A1)\"}", "", ""));
        assertThat(grid.columnCount()).isEqualTo(3);
    }

    @Test
    void onlyJsonNumbersAreMarkedNumeric() {
        SheetGrid grid = reader.read(SampleElements.json("""
                {"sheets": {"S": {"data": {"dataTable": {
                  "0": {"0": {"value": "007"}, "1": {"value": 7}, "2": {"value": "1.0"}, "3": 2.5}}}}}}""")).get(0);

        assertThat(grid.rows()).containsExactly(List.of("007", "7", "1.0", "2.5"));
        assertThat(grid.isNumeric(0, 0)).isFalse();
        assertThat(grid.isNumeric(0, 1)).isTrue();
        assertThat(grid.isNumeric(0, 2)).isFalse();
        assertThat(grid.isNumeric(0, 3)).isTrue();
    }

    @Test
    void nonSpreadJsContentGivesNoSheets() {
        assertThat(reader.isSpreadJs(new TextNode("a,b"))).isFalse();
        assertThat(reader.read(null)).isEmpty();
        assertThat(reader.read(SampleElements.json("{\"sheets\": [1, 2]}"))).isEmpty();
    }
}
