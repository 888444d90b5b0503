package com.eyelevel.labmigrator.runner;

import com.eyelevel.labmigrator.exception.MigrationAbortedException;
import com.eyelevel.labmigrator.model.RunReport;
import com.eyelevel.labmigrator.service.coordinator.MigrationCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Starts the migration once the context is up. Exit code 0 means the run reached the end, possibly with
 * non-fatal failures in the report; 1 means it was aborted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MigrationCommandLineRunner implements CommandLineRunner, ExitCodeGenerator {

    private final MigrationCoordinator migrationCoordinator;

    private volatile int exitCode = 1;

    @Override
    public void run(String... args) {
        try {
            RunReport report = migrationCoordinator.run();
            exitCode = report.isCompleted() ? 0 : 1;
        } catch (MigrationAbortedException e) {
            log.error("Migration aborted: {}", e.getMessage());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
