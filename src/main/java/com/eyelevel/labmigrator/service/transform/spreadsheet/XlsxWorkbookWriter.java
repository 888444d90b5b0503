package com.eyelevel.labmigrator.service.transform.spreadsheet;

import com.eyelevel.labmigrator.exception.ElementTransformationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * Writes grids as the worksheets of one {@code .xlsx} workbook. Sheet names are made Excel-safe and cut to
 * 31 characters; duplicates after cutting get a numeric suffix. Cells the grid marks numeric are stored as
 * numbers, everything else as text.
 *
 * <p>The same grids always give the same bytes: the creation date is pinned and the package is re-zipped with
 * fixed entry times.
 */
@Slf4j
@Component
public class XlsxWorkbookWriter {

    public static final String MIME_TYPE = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

    private static final int MAX_SHEET_NAME = 31;
    private static final String FIXED_CREATED = "2000-01-01T00:00:00Z";
    private static final long FIXED_ENTRY_TIME = LocalDateTime.of(2000, 1, 1, 0, 0)
            .toInstant(ZoneOffset.UTC).toEpochMilli();

    public byte[] write(List<SheetGrid> grids) {
        try (XSSFWorkbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Set<String> usedNames = new HashSet<>();
            for (SheetGrid grid : grids) {
                Sheet sheet = workbook.createSheet(uniqueSheetName(grid.name(), usedNames));
                fill(sheet, grid);
            }
            if (grids.isEmpty()) {
                workbook.createSheet("sheet1");
            }
            workbook.getProperties().getCoreProperties().setCreated(FIXED_CREATED);
            workbook.write(out);
            return normalizeEntryTimes(out.toByteArray());
        } catch (IOException e) {
            throw new ElementTransformationException("Could not write xlsx workbook: " + e.getMessage(), e);
        }
    }

    private static void fill(Sheet sheet, SheetGrid grid) {
        List<List<String>> rows = grid.rows();
        for (int i = 0; i < rows.size(); i++) {
            Row row = sheet.createRow(i);
            List<String> cells = rows.get(i);
            for (int j = 0; j < cells.size(); j++) {
                String value = cells.get(j);
                if (value == null || value.isEmpty()) {
                    continue;
                }
                Cell cell = row.createCell(j);
                Double number = grid.isNumeric(i, j) ? parseNumber(value) : null;
                if (number != null) {
                    cell.setCellValue(number);
                } else {
                    cell.setCellValue(value);
                }
            }
        }
    }

    private static Double parseNumber(String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Rewrites the zip with every entry stamped {@link #FIXED_ENTRY_TIME}; the entry order is kept.
     */
    static byte[] normalizeEntryTimes(byte[] zip) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(zip.length);
        try (ZipInputStream in = new ZipInputStream(new ByteArrayInputStream(zip));
             ZipOutputStream normalized = new ZipOutputStream(out)) {
            ZipEntry entry;
            while ((entry = in.getNextEntry()) != null) {
                ZipEntry copy = new ZipEntry(entry.getName());
                copy.setTime(FIXED_ENTRY_TIME);
                normalized.putNextEntry(copy);
                in.transferTo(normalized);
                normalized.closeEntry();
            }
        }
        return out.toByteArray();
    }

    static String uniqueSheetName(String requested, Set<String> usedNames) {
        String base = WorkbookUtil.createSafeSheetName(requested == null || requested.isBlank() ? "sheet1" : requested);
        base = base.length() > MAX_SHEET_NAME ? base.substring(0, MAX_SHEET_NAME) : base;
        String candidate = base;
        int suffix = 2;
        while (!usedNames.add(candidate.toLowerCase())) {
            String tail = "_" + suffix++;
            candidate = base.substring(0, Math.min(base.length(), MAX_SHEET_NAME - tail.length())) + tail;
        }
        if (!candidate.equals(requested)) {
            log.debug("Sheet '{}' written as '{}'.", requested, candidate);
        }
        return candidate;
    }
}
