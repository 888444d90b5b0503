package com.eyelevel.labmigrator.service.cache.factory;

import com.eyelevel.labmigrator.config.MigrationConfig.CacheFormat;
import com.eyelevel.labmigrator.service.cache.EntryCacheStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Picks the {@link EntryCacheStore} for a configured format. {@link CacheFormat#AUTO} is resolved from the
 * file name: {@code .csv} (optionally followed by {@code .gz}) selects CSV, anything else JSON lines.
 */
@Slf4j
@Service
public class EntryCacheStoreFactory {

    private final List<EntryCacheStore> stores;

    public EntryCacheStoreFactory(List<EntryCacheStore> stores) {
        this.stores = stores;
        log.info("EntryCacheStoreFactory initialized with {} cache formats.", stores.size());
    }

    public Optional<EntryCacheStore> getStore(CacheFormat format, Path path) {
        CacheFormat resolved = resolve(format, path);
        Optional<EntryCacheStore> store = stores.stream().filter(s -> s.supports(resolved)).findFirst();
        log.debug("Cache format {} for {} resolved to {}. Found: {}", format, path, resolved,
                  store.map(s -> s.getClass().getSimpleName()).orElse("None"));
        return store;
    }

    static CacheFormat resolve(CacheFormat format, Path path) {
        if (format != null && format != CacheFormat.AUTO) {
            return format;
        }
        String name = path.getFileName().toString();
        if ("gz".equalsIgnoreCase(FilenameUtils.getExtension(name))) {
            name = FilenameUtils.removeExtension(name);
        }
        return "csv".equalsIgnoreCase(FilenameUtils.getExtension(name)) ? CacheFormat.CSV : CacheFormat.JSONL;
    }
}
