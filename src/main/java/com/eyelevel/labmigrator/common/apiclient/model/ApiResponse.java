package com.eyelevel.labmigrator.common.apiclient.model;

import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Optional;

/**
 * Represents the response from an external API call: raw body bytes plus status and headers.
 */
@Builder
@Getter
public class ApiResponse {

    /**
     * The response body; an empty array when the server sent none.
     */
    private final byte[] data;

    @Nullable
    private final MediaType acceptType;

    @Nullable
    private final HttpHeaders headers;

    private final int statusCode;

    private final Instant timestamp;

    /**
     * @return the value of the given header, if the response carried it.
     */
    public Optional<String> header(String name) {
        return Optional.ofNullable(headers).map(h -> h.getFirst(name));
    }

    public boolean hasBody() {
        return data != null && data.length > 0;
    }
}
