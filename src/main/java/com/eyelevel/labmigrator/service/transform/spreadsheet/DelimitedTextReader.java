package com.eyelevel.labmigrator.service.transform.spreadsheet;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses delimiter-separated text (well plate exports) into a {@link SheetGrid}. The delimiter is the one of
 * comma, semicolon and tab that occurs most often in the first line; ties and no match fall back to comma.
 * Text carries no types, so only cells that are plain decimal numbers are marked numeric.
 */
@Component
public class DelimitedTextReader {

    private static final char[] CANDIDATES = {',', ';', '\t'};
    /**
     * Numbers that read back unchanged from a numeric cell: no leading zeros, no trailing fraction zeros.
     */
    private static final Pattern PLAIN_NUMBER = Pattern.compile("-?(0|[1-9]\\d{0,14})(\\.\\d*[1-9])?");

    public SheetGrid read(String sheetName, String text) {
        String trimmed = text == null ? "" : text.strip();
        if (trimmed.isEmpty()) {
            return new SheetGrid(sheetName, List.of());
        }
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(sniffDelimiter(trimmed))
                .setTrim(true)
                .build();
        List<List<String>> rows = new ArrayList<>();
        Set<SheetGrid.Position> numericCells = new HashSet<>();
        try (CSVParser parser = CSVParser.parse(trimmed, format)) {
            for (CSVRecord record : parser) {
                List<String> cells = record.stream().map(cell -> cell == null ? "" : cell).toList();
                for (int j = 0; j < cells.size(); j++) {
                    if (PLAIN_NUMBER.matcher(cells.get(j)).matches()) {
                        numericCells.add(new SheetGrid.Position(rows.size(), j));
                    }
                }
                rows.add(cells);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unparseable delimited text for sheet " + sheetName, e);
        }
        return new SheetGrid(sheetName, rows, numericCells);
    }

    static char sniffDelimiter(String text) {
        int newline = text.indexOf('\n');
        String firstLine = newline < 0 ? text : text.substring(0, newline);
        char best = ',';
        long bestCount = 0;
        for (char candidate : CANDIDATES) {
            long count = firstLine.chars().filter(c -> c == candidate).count();
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return best;
    }
}
