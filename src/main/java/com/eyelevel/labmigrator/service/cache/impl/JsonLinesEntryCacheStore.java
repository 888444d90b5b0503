package com.eyelevel.labmigrator.service.cache.impl;

import com.eyelevel.labmigrator.common.json.JsonParser;
import com.eyelevel.labmigrator.common.json.JsonSerializer;
import com.eyelevel.labmigrator.config.MigrationConfig.CacheFormat;
import com.eyelevel.labmigrator.model.Entry;
import com.eyelevel.labmigrator.service.cache.AbstractEntryCacheStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * Document layout: one compact JSON entry, elements included, per line.
 */
@Component
public class JsonLinesEntryCacheStore extends AbstractEntryCacheStore {

    private final JsonSerializer jsonSerializer;
    private final JsonParser jsonParser;

    public JsonLinesEntryCacheStore(@Qualifier("jacksonJsonSerializer") JsonSerializer jsonSerializer,
                                    @Qualifier("jacksonJsonParser") JsonParser jsonParser) {
        this.jsonSerializer = jsonSerializer;
        this.jsonParser = jsonParser;
    }

    @Override
    public boolean supports(CacheFormat format) {
        return format == CacheFormat.JSONL;
    }

    @Override
    protected void write(Writer writer, List<Entry> entries) throws IOException {
        for (Entry entry : entries) {
            writer.write(jsonSerializer.serialize(entry));
            writer.write('\n');
        }
    }

    @Override
    protected List<Entry> read(Reader reader) throws IOException {
        BufferedReader lines = reader instanceof BufferedReader buffered ? buffered : new BufferedReader(reader);
        List<Entry> entries = new ArrayList<>();
        String line;
        while ((line = lines.readLine()) != null) {
            if (!line.isBlank()) {
                entries.add(jsonParser.parseObject(line, Entry.class));
            }
        }
        return entries;
    }
}
