package com.eyelevel.labmigrator.config;

import com.eyelevel.labmigrator.exception.apiclient.ApiException;
import com.eyelevel.labmigrator.service.importer.AttachmentUploadRetryListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

/**
 * Retry policy for eLabFTW attachment uploads. The configured attempts are retries on top of the first try,
 * as for the other retryable operations.
 */
@Slf4j
@Configuration
public class UploadRetryConfig {

    @Bean("uploadRetryTemplate")
    public RetryTemplate uploadRetryTemplate(MigrationConfig migrationConfig,
                                             AttachmentUploadRetryListener retryListener) {
        MigrationConfig.RetryConfig retry = migrationConfig.getImport().getUploadRetry();
        int maxAttempts = Math.max(0, retry.getAttempts()) + 1;
        long delayMs = Math.max(0, retry.getDelayMs());
        log.info("Attachment uploads: up to {} attempt(s), {} ms apart.", maxAttempts, delayMs);
        return RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .fixedBackoff(Math.max(1, delayMs))
                .retryOn(ApiException.class)
                .traversingCauses()
                .withListener(retryListener)
                .build();
    }
}
