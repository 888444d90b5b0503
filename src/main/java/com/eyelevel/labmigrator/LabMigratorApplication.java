package com.eyelevel.labmigrator;

import com.eyelevel.labmigrator.config.MigrationConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Command-line entry point. The migration runs from
 * {@link com.eyelevel.labmigrator.runner.MigrationCommandLineRunner}; the JVM exits with its exit code.
 * Every {@code app.*} setting can be passed as {@code --key=value}.
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(value = MigrationConfig.class)
public class LabMigratorApplication {

    public static void main(final String[] args) {
        log.info("Starting LabMigratorApplication...");
        System.exit(SpringApplication.exit(SpringApplication.run(LabMigratorApplication.class, args)));
    }
}
