package com.eyelevel.labmigrator.config;

import com.eyelevel.labmigrator.exception.ExportPendingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

/**
 * Polls a Labfolder export until it leaves the pending states. Only {@link ExportPendingException} is retried,
 * every {@code poll-interval-ms} until {@code timeout-ms} has passed.
 */
@Slf4j
@Configuration
public class ExportPollingConfig {

    @Bean("exportPollTemplate")
    public RetryTemplate exportPollTemplate(MigrationConfig migrationConfig) {
        MigrationConfig.Export export = migrationConfig.getExport();
        long intervalMs = Math.max(1, export.getPollIntervalMs());
        long timeoutMs = Math.max(intervalMs, export.getTimeoutMs());
        int maxAttempts = (int) Math.min(Integer.MAX_VALUE, timeoutMs / intervalMs + 1);
        log.debug("Export polling: every {} ms, at most {} checks.", intervalMs, maxAttempts);
        return RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .fixedBackoff(intervalMs)
                .retryOn(ExportPendingException.class)
                .build();
    }
}
