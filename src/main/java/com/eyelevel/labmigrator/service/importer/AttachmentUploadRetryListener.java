package com.eyelevel.labmigrator.service.importer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class AttachmentUploadRetryListener implements RetryListener {

    public static final String ATTACHMENT_NAME = "attachment.name";

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        log.warn("Upload of '{}' failed on attempt {}: {}", context.getAttribute(ATTACHMENT_NAME),
                 context.getRetryCount(), throwable.getMessage());
    }
}
