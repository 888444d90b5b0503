package com.eyelevel.labmigrator.service.cache.factory;

import com.eyelevel.labmigrator.config.MigrationConfig.CacheFormat;
import com.eyelevel.labmigrator.service.cache.EntryCacheStore;
import com.eyelevel.labmigrator.service.cache.impl.CsvEntryCacheStore;
import com.eyelevel.labmigrator.service.cache.impl.JsonLinesEntryCacheStore;
import com.eyelevel.labmigrator.support.TestEntries;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EntryCacheStoreFactoryTest {

    private final EntryCacheStoreFactory factory = new EntryCacheStoreFactory(List.of(
            new JsonLinesEntryCacheStore(TestEntries.jsonSerializer(), TestEntries.jsonParser()),
            new CsvEntryCacheStore(TestEntries.jsonSerializer(), TestEntries.jsonParser())));

    @Test
    void autoPicksFormatFromFileName() {
        assertThat(EntryCacheStoreFactory.resolve(CacheFormat.AUTO, Path.of("cache/entries.csv")))
                .isEqualTo(CacheFormat.CSV);
        assertThat(EntryCacheStoreFactory.resolve(CacheFormat.AUTO, Path.of("cache/entries.CSV.gz")))
                .isEqualTo(CacheFormat.CSV);
        assertThat(EntryCacheStoreFactory.resolve(CacheFormat.AUTO, Path.of("cache/entries.jsonl.gz")))
                .isEqualTo(CacheFormat.JSONL);
        assertThat(EntryCacheStoreFactory.resolve(null, Path.of("entries")))
                .isEqualTo(CacheFormat.JSONL);
    }

    @Test
    void explicitFormatWinsOverFileName() {
        assertThat(factory.getStore(CacheFormat.JSONL, Path.of("entries.csv")))
                .get().isInstanceOf(JsonLinesEntryCacheStore.class);
    }

    @Test
    void returnsStoreForResolvedFormat() {
        EntryCacheStore store = factory.getStore(CacheFormat.AUTO, Path.of("entries.csv.gz")).orElseThrow();
        assertThat(store).isInstanceOf(CsvEntryCacheStore.class);
    }
}
