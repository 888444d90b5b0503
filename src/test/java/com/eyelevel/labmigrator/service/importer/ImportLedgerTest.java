package com.eyelevel.labmigrator.service.importer;

import com.eyelevel.labmigrator.config.MigrationConfig;
import com.eyelevel.labmigrator.exception.ExperimentImportException;
import com.eyelevel.labmigrator.service.importer.ImportLedger.LedgerRecord;
import com.eyelevel.labmigrator.support.TestEntries;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImportLedgerTest {

    @TempDir
    Path tempDir;

    @Test
    void progressSurvivesARestart() {
        MigrationConfig config = new MigrationConfig();
        config.getImport().setLedgerPath(tempDir.resolve("state/ledger.json"));

        ImportLedger ledger = new ImportLedger(config, TestEntries.jsonSerializer(), TestEntries.jsonParser());
        ledger.recordStarted("p1", "42");
        ledger.recordStarted("p2", "43");
        ledger.recordCompleted("p2", "43");

        assertThat(Files.exists(config.getImport().getLedgerPath())).isTrue();
        ImportLedger reloaded = new ImportLedger(config, TestEntries.jsonSerializer(), TestEntries.jsonParser());
        assertThat(reloaded.find("p1")).map(LedgerRecord::completed).contains(false);
        assertThat(reloaded.find("p1")).map(LedgerRecord::experimentId).contains("42");
        assertThat(reloaded.find("p2")).map(LedgerRecord::completed).contains(true);
        assertThat(reloaded.find("p3")).isEmpty();
    }

    @Test
    void withoutPathTheLedgerIsInMemoryOnly() {
        ImportLedger ledger = new ImportLedger(new MigrationConfig(), TestEntries.jsonSerializer(),
                                               TestEntries.jsonParser());
        ledger.recordCompleted("p1", "42");

        assertThat(ledger.find("p1")).isPresent();
        assertThat(tempDir.toFile().list()).isEmpty();
    }

    @Test
    void uploadsAreRememberedPerElement() {
        MigrationConfig config = new MigrationConfig();
        config.getImport().setLedgerPath(tempDir.resolve("ledger.json"));

        ImportLedger ledger = new ImportLedger(config, TestEntries.jsonSerializer(), TestEntries.jsonParser());
        ledger.recordStarted("p1", "42");
        ledger.recordUpload("p1", "42", ImportLedger.elementKey("e1", "f1"), "7");
        ledger.recordUpload("p1", "42", ImportLedger.elementKey("e2", "f1"), "8");

        ImportLedger reloaded = new ImportLedger(config, TestEntries.jsonSerializer(), TestEntries.jsonParser());
        assertThat(reloaded.uploadIdFor("p1", "e1/f1")).contains("7");
        assertThat(reloaded.uploadIdFor("p1", "e2/f1")).contains("8");
        assertThat(reloaded.uploadIdFor("p1", "e3/f1")).isEmpty();
        assertThat(reloaded.find("p1")).map(LedgerRecord::completed).contains(false);

        reloaded.recordCompleted("p1", "42");
        assertThat(reloaded.uploadIdFor("p1", "e1/f1")).contains("7");
    }

    @Test
    void aNewExperimentForgetsTheOldUploads() {
        ImportLedger ledger = new ImportLedger(new MigrationConfig(), TestEntries.jsonSerializer(),
                                               TestEntries.jsonParser());
        ledger.recordStarted("p1", "42");
        ledger.recordUpload("p1", "42", "e1/f1", "7");

        ledger.recordStarted("p1", "99");

        assertThat(ledger.uploadIdFor("p1", "e1/f1")).isEmpty();
    }

    @Test
    void ledgerWithoutUploadsStillLoads() throws Exception {
        Path path = tempDir.resolve("ledger.json");
        Files.writeString(path, """
                {"projects": {"p1": {"experimentId": "42", "completed": false, "updatedAt": "2024-01-01T00:00:00Z"}}}
                """);
        MigrationConfig config = new MigrationConfig();
        config.getImport().setLedgerPath(path);

        ImportLedger ledger = new ImportLedger(config, TestEntries.jsonSerializer(), TestEntries.jsonParser());

        assertThat(ledger.find("p1")).map(LedgerRecord::experimentId).contains("42");
        assertThat(ledger.find("p1")).map(LedgerRecord::uploads).contains(Map.of());
    }

    @Test
    void unwritableLedgerFailsTheWrite() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("not-a-directory"), "x");
        MigrationConfig config = new MigrationConfig();
        config.getImport().setLedgerPath(blocker.resolve("ledger.json"));

        ImportLedger ledger = new ImportLedger(config, TestEntries.jsonSerializer(), TestEntries.jsonParser());

        assertThatThrownBy(() -> ledger.recordStarted("p1", "42"))
                .isInstanceOf(ExperimentImportException.class)
                .hasMessageContaining("Could not write import ledger");
    }
}
