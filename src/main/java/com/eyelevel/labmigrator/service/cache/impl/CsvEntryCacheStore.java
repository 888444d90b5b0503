package com.eyelevel.labmigrator.service.cache.impl;

import com.eyelevel.labmigrator.common.json.JsonParser;
import com.eyelevel.labmigrator.common.json.JsonSerializer;
import com.eyelevel.labmigrator.config.MigrationConfig.CacheFormat;
import com.eyelevel.labmigrator.model.Entry;
import com.eyelevel.labmigrator.model.element.Element;
import com.eyelevel.labmigrator.service.cache.AbstractEntryCacheStore;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Columnar layout: one row per element. The identifying columns are plain values; {@code entry} holds the
 * entry without its elements and {@code element} the element, both as JSON (binary content base64-encoded).
 * An entry without elements is written as a single row with an empty {@code element} column.
 */
@Component
public class CsvEntryCacheStore extends AbstractEntryCacheStore {

    private static final String[] COLUMNS = {"entry_id", "project_id", "author", "element_index", "element_type",
            "element_id", "entry", "element"};
    private static final CSVFormat WRITE_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(COLUMNS)
            .setRecordSeparator('\n')
            .build();
    private static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .build();

    private final JsonSerializer jsonSerializer;
    private final JsonParser jsonParser;

    public CsvEntryCacheStore(@Qualifier("jacksonJsonSerializer") JsonSerializer jsonSerializer,
                              @Qualifier("jacksonJsonParser") JsonParser jsonParser) {
        this.jsonSerializer = jsonSerializer;
        this.jsonParser = jsonParser;
    }

    @Override
    public boolean supports(CacheFormat format) {
        return format == CacheFormat.CSV;
    }

    @Override
    protected void write(Writer writer, List<Entry> entries) throws IOException {
        try (CSVPrinter rows = new CSVPrinter(writer, WRITE_FORMAT)) {
            for (Entry entry : entries) {
                String entryJson = jsonSerializer.serialize(entry.withoutElements());
                String author = entry.getAuthorName();
                if (entry.getElements().isEmpty()) {
                    rows.printRecord(entry.getId(), entry.getProjectId(), author, "", "", "", entryJson, "");
                    continue;
                }
                for (int i = 0; i < entry.getElements().size(); i++) {
                    Element element = entry.getElements().get(i);
                    rows.printRecord(entry.getId(), entry.getProjectId(), author, i, element.getType(),
                                     element.getId(), entryJson, jsonSerializer.serialize(element));
                }
            }
        }
    }

    @Override
    protected List<Entry> read(Reader reader) throws IOException {
        Map<String, List<CacheRow>> rowsByEntry = new LinkedHashMap<>();
        try (CSVParser parser = READ_FORMAT.parse(reader)) {
            for (CSVRecord record : parser) {
                CacheRow row = new CacheRow(record.get("entry_id"), record.get("element_index"), record.get("entry"),
                                            record.get("element"));
                rowsByEntry.computeIfAbsent(row.entryId(), id -> new ArrayList<>()).add(row);
            }
        }

        List<Entry> entries = new ArrayList<>(rowsByEntry.size());
        for (List<CacheRow> rows : rowsByEntry.values()) {
            Entry entry = jsonParser.parseObject(rows.get(0).entry(), Entry.class);
            List<Element> elements = rows.stream()
                    .filter(row -> row.element() != null && !row.element().isEmpty())
                    .sorted(Comparator.comparingInt(row -> Integer.parseInt(row.elementIndex())))
                    .map(row -> jsonParser.parseObject(row.element(), Element.class))
                    .toList();
            entry.setElements(new ArrayList<>(elements));
            entries.add(entry);
        }
        return entries;
    }

    private record CacheRow(String entryId, String elementIndex, String entry, String element) {
    }
}
