package com.eyelevel.labmigrator.config;

import com.eyelevel.labmigrator.exception.apiclient.ApiException;
import com.eyelevel.labmigrator.exception.apiclient.ServiceUnavailableException;
import com.eyelevel.labmigrator.service.importer.AttachmentUploadRetryListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.retry.support.RetryTemplate;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UploadRetryConfigTest {

    private MigrationConfig migrationConfig;

    @BeforeEach
    void setUp() {
        migrationConfig = new MigrationConfig();
        migrationConfig.getImport().getUploadRetry().setAttempts(2);
        migrationConfig.getImport().getUploadRetry().setDelayMs(0);
    }

    @Test
    void apiErrorsAreRetriedOnTopOfTheFirstAttempt() {
        RetryTemplate template = new UploadRetryConfig().uploadRetryTemplate(migrationConfig,
                                                                             new AttachmentUploadRetryListener());
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> template.execute(context -> {
            calls.incrementAndGet();
            throw new ServiceUnavailableException("eLabFTW down");
        })).isInstanceOf(ApiException.class);

        assertThat(calls).hasValue(3);
    }

    @Test
    void otherErrorsAreNotRetried() {
        RetryTemplate template = new UploadRetryConfig().uploadRetryTemplate(migrationConfig,
                                                                             new AttachmentUploadRetryListener());
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> template.execute(context -> {
            calls.incrementAndGet();
            throw new IllegalArgumentException("bad attachment");
        })).isInstanceOf(IllegalArgumentException.class);

        assertThat(calls).hasValue(1);
    }
}
