package com.eyelevel.labmigrator.service.cache;

import com.eyelevel.labmigrator.config.MigrationConfig.CacheFormat;
import com.eyelevel.labmigrator.exception.CacheUnavailableException;
import com.eyelevel.labmigrator.model.Entry;

import java.nio.file.Path;
import java.util.List;

/**
 * Persists a full fetch snapshot of entries so later runs can skip Labfolder.
 * Each implementation handles one on-disk format.
 */
public interface EntryCacheStore {

    /**
     * @param format A concrete format, never {@link CacheFormat#AUTO}.
     */
    boolean supports(CacheFormat format);

    /**
     * Replaces the snapshot at {@code path} with the given entries. The file is written next to the target and
     * moved over it, so a crash never leaves a half-written cache behind.
     *
     * @throws CacheUnavailableException if the file cannot be written.
     */
    void save(Path path, List<Entry> entries);

    /**
     * Reads the snapshot at {@code path}, preserving entry and element order.
     *
     * @throws CacheUnavailableException if the file is missing or cannot be parsed.
     */
    List<Entry> load(Path path);
}
