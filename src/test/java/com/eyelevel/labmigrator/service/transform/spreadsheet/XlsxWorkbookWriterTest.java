package com.eyelevel.labmigrator.service.transform.spreadsheet;

import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class XlsxWorkbookWriterTest {

    private final XlsxWorkbookWriter writer = new XlsxWorkbookWriter();

    @Test
    void sheetNamesAreTruncatedAndMadeUnique() {
        Set<String> used = new HashSet<>();
        String longName = "Absorbance measurements of the second run";

        String first = XlsxWorkbookWriter.uniqueSheetName(longName, used);
        String second = XlsxWorkbookWriter.uniqueSheetName(longName, used);

        assertThat(first).hasSize(31).isEqualTo(longName.substring(0, 31));
        assertThat(second).hasSize(31).endsWith("_2");
        assertThat(XlsxWorkbookWriter.uniqueSheetName("RESULTS", new HashSet<>(Set.of("results")))).isEqualTo("RESULTS_2");
        assertThat(XlsxWorkbookWriter.uniqueSheetName(null, new HashSet<>())).isEqualTo("sheet1");
    }

    @Test
    void onlyCellsMarkedNumericAreStoredAsNumbers() throws IOException {
        SheetGrid grid = new SheetGrid("S", List.of(List.of("1.25", "-3", "007", "1.0", "")),
                                       Set.of(new SheetGrid.Position(0, 0), new SheetGrid.Position(0, 1)));

        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(writer.write(List.of(grid))))) {
            Row row = workbook.getSheetAt(0).getRow(0);
            DataFormatter formatter = new DataFormatter();
            assertThat(row.getCell(0).getCellType()).isEqualTo(CellType.NUMERIC);
            assertThat(row.getCell(1).getNumericCellValue()).isEqualTo(-3.0);
            assertThat(row.getCell(2).getCellType()).isEqualTo(CellType.STRING);
            assertThat(formatter.formatCellValue(row.getCell(2))).isEqualTo("007");
            assertThat(formatter.formatCellValue(row.getCell(3))).isEqualTo("1.0");
            assertThat(row.getCell(4)).isNull();
        }
    }

    @Test
    void sameGridsGiveIdenticalBytesAcrossCalls() throws Exception {
        List<SheetGrid> grids = List.of(new SheetGrid("Results", List.of(List.of("Sample", "OD"), List.of("A1", "0.42")),
                                                      Set.of(new SheetGrid.Position(1, 1))));

        byte[] first = writer.write(grids);
        Thread.sleep(2100);
        byte[] second = writer.write(grids);

        assertThat(second).isEqualTo(first);
        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(second))) {
            assertThat(workbook.getSheetAt(0).getRow(1).getCell(1).getNumericCellValue()).isEqualTo(0.42);
        }
    }

    @Test
    void noGridsStillGiveAValidWorkbook() throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(writer.write(List.of())))) {
            assertThat(workbook.getSheetName(0)).isEqualTo("sheet1");
        }
    }
}
