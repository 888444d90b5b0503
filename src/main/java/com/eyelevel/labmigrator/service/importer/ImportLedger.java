package com.eyelevel.labmigrator.service.importer;

import com.eyelevel.labmigrator.common.json.JsonParser;
import com.eyelevel.labmigrator.common.json.JsonSerializer;
import com.eyelevel.labmigrator.config.MigrationConfig;
import com.eyelevel.labmigrator.exception.ExperimentImportException;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Remembers which Labfolder projects already have an eLabFTW experiment, so a re-run neither duplicates
 * finished experiments nor starts a second experiment for one that failed half-way. Stored as a JSON file that
 * is rewritten after every change; without a configured path the ledger only lives for the current run.
 */
@Slf4j
@Component
public class ImportLedger {

    private final Path ledgerPath;
    private final JsonSerializer jsonSerializer;
    private final LedgerFile ledger;

    public ImportLedger(MigrationConfig migrationConfig,
                        @Qualifier("jacksonJsonSerializer") JsonSerializer jsonSerializer,
                        @Qualifier("jacksonJsonParser") JsonParser jsonParser) {
        this.ledgerPath = migrationConfig.getImport().getLedgerPath();
        this.jsonSerializer = jsonSerializer;
        this.ledger = load(ledgerPath, jsonParser);
    }

    public synchronized Optional<LedgerRecord> find(String projectKey) {
        return Optional.ofNullable(ledger.getProjects().get(projectKey));
    }

    public synchronized void recordStarted(String projectKey, String experimentId) {
        put(projectKey, experimentId, false, uploadsOf(projectKey, experimentId));
    }

    public synchronized void recordCompleted(String projectKey, String experimentId) {
        put(projectKey, experimentId, true, uploadsOf(projectKey, experimentId));
    }

    /**
     * Remembers the eLabFTW upload created for one source element, so a resumed import reuses exactly that
     * upload. Same-named files of different elements never share an upload.
     */
    public synchronized void recordUpload(String projectKey, String experimentId, String elementKey,
                                          String uploadId) {
        Map<String, String> uploads = new LinkedHashMap<>(uploadsOf(projectKey, experimentId));
        uploads.put(elementKey, uploadId);
        LedgerRecord current = ledger.getProjects().get(projectKey);
        put(projectKey, experimentId, current != null && current.completed(), uploads);
    }

    public synchronized Optional<String> uploadIdFor(String projectKey, String elementKey) {
        return find(projectKey).map(record -> record.uploads().get(elementKey));
    }

    /**
     * The ledger key of one source element within its project.
     */
    public static String elementKey(String entryId, String elementId) {
        return entryId + "/" + elementId;
    }

    private Map<String, String> uploadsOf(String projectKey, String experimentId) {
        LedgerRecord current = ledger.getProjects().get(projectKey);
        if (current == null || !Objects.equals(current.experimentId(), experimentId)) {
            return Map.of();
        }
        return current.uploads();
    }

    private void put(String projectKey, String experimentId, boolean completed, Map<String, String> uploads) {
        ledger.getProjects().put(projectKey,
                                 new LedgerRecord(experimentId, completed, Instant.now().toString(), uploads));
        persist();
    }

    private void persist() {
        if (ledgerPath == null) {
            return;
        }
        Path target = ledgerPath.toAbsolutePath();
        try {
            Files.createDirectories(target.getParent());
            Path tempFile = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            Files.writeString(tempFile, jsonSerializer.serialize(ledger, true), StandardCharsets.UTF_8);
            try {
                Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new ExperimentImportException("Could not write import ledger " + target + ": " + e.getMessage(), e);
        }
    }

    private static LedgerFile load(Path path, JsonParser jsonParser) {
        if (path == null) {
            log.info("No import ledger configured; completed projects are not remembered between runs.");
            return new LedgerFile();
        }
        if (!Files.isRegularFile(path)) {
            log.info("Import ledger {} does not exist yet.", path);
            return new LedgerFile();
        }
        try {
            LedgerFile file = jsonParser.parseObject(Files.readAllBytes(path), LedgerFile.class);
            if (file.getProjects() == null) {
                file.setProjects(new LinkedHashMap<>());
            }
            log.info("Loaded import ledger {} with {} project(s).", path, file.getProjects().size());
            return file;
        } catch (IOException e) {
            throw new ExperimentImportException("Could not read import ledger " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * @param updatedAt ISO-8601 instant of the last change.
     * @param uploads   Upload id per {@link #elementKey(String, String) element key}; empty in ledgers written
     *                  before uploads were recorded.
     */
    public record LedgerRecord(String experimentId, boolean completed, String updatedAt,
                               Map<String, String> uploads) {

        public LedgerRecord {
            uploads = uploads == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(uploads));
        }
    }

    @Data
    @NoArgsConstructor
    static class LedgerFile {
        private Map<String, LedgerRecord> projects = new LinkedHashMap<>();
    }
}
