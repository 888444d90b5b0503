package com.eyelevel.labmigrator.common.apiclient.authentication.impl;

import com.eyelevel.labmigrator.common.apiclient.authentication.Authentication;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current Labfolder bearer token and applies it to outgoing requests.
 *
 * <p>The token is the only piece of state shared by every Labfolder call of a run. It is swapped
 * atomically on (re-)login, so every request issued after {@link #updateToken(String)} returns
 * sees the new value.
 */
@Slf4j
public class BearerTokenAuthentication implements Authentication {

    private static final String BEARER_PREFIX = "Bearer ";

    private final AtomicReference<String> token = new AtomicReference<>();

    @Override
    public void applyAuthentication(Map<String, String> authorization) {
        if (authorization == null) {
            log.error("Authorization map cannot be null when applying bearer token authentication.");
            return;
        }
        String current = token.get();
        if (current == null) {
            // login request itself, or nothing obtained yet
            authorization.remove(HttpHeaders.AUTHORIZATION);
            return;
        }
        authorization.put(HttpHeaders.AUTHORIZATION, BEARER_PREFIX + current);
    }

    /**
     * Replaces the current token.
     *
     * @param newToken the token returned by the login endpoint, or {@code null} to clear it.
     */
    public void updateToken(String newToken) {
        token.set(newToken == null ? null : newToken.strip());
        log.debug("Labfolder bearer token {}.", newToken == null ? "cleared" : "updated");
    }

    public boolean hasToken() {
        return token.get() != null;
    }

    String currentToken() {
        return token.get();
    }
}
