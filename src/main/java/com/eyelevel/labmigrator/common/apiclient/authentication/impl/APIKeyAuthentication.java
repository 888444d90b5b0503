package com.eyelevel.labmigrator.common.apiclient.authentication.impl;

import com.eyelevel.labmigrator.common.apiclient.authentication.Authentication;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Injects a static API key into request headers. eLabFTW expects the raw key in the
 * {@code Authorization} header, without a scheme prefix.
 */
@Slf4j
public record APIKeyAuthentication(String headerName, String apiKey) implements Authentication {

    @Override
    public void applyAuthentication(Map<String, String> authorization) {
        if (authorization == null) {
            log.error("Authorization map cannot be null when applying API key authentication.");
            return;
        }
        authorization.put(headerName, apiKey);
        log.trace("Applied API key to header '{}'.", headerName);
    }
}
