package com.eyelevel.labmigrator.common.apiclient.model;

import lombok.Builder;
import lombok.Data;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Represents a request to the Labfolder or eLabFTW API.
 *
 * <p>Encapsulates the HTTP method, path, query parameters, headers and body needed to build the call.
 */
@Builder
@Data
public class ApiRequest {

    private final HttpMethod method;

    /**
     * Path relative to the client's base URL. May contain {@code {placeholders}} resolved from
     * {@link #pathVariables}.
     */
    private final String path;

    @Nullable
    private final Map<String, Object> queryParams;

    @Nullable
    private final Map<String, Object> pathVariables;

    /**
     * Mutable so that {@link com.eyelevel.labmigrator.common.apiclient.authentication.Authentication}
     * can add its header right before the call is sent.
     */
    private final Map<String, String> headers = new HashMap<>();

    /**
     * JSON-serializable object, or a {@code MultiValueMap} for multipart uploads.
     */
    @Nullable
    private final Object body;

    @Nullable
    private final MediaType acceptMediaType;

    @Nullable
    private final MediaType contentType;
}
