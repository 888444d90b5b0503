package com.eyelevel.labmigrator.common.apiclient.authentication;

import java.util.Map;

/**
 * Defines the contract for applying authentication to an API request.
 *
 * <p>Labfolder uses a refreshable bearer token, eLabFTW a static API key; both are applied through
 * this interface so {@link com.eyelevel.labmigrator.common.apiclient.ApiClient} stays scheme-agnostic.
 */
public interface Authentication {

    /**
     * Applies the authentication to the provided header map.
     *
     * @param authorization A mutable map of request headers. Implementations add or overwrite their entries.
     */
    void applyAuthentication(Map<String, String> authorization);
}
