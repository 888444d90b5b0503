package com.eyelevel.labmigrator.common.apiclient.elabftw.config;

import com.eyelevel.labmigrator.common.apiclient.authentication.Authentication;
import com.eyelevel.labmigrator.common.apiclient.authentication.impl.APIKeyAuthentication;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Configures the necessary beans for the eLabFTW API client, including the {@link WebClient} for
 * communication and the {@link Authentication} mechanism.
 */
@Slf4j
@Configuration
public class ElabftwApiClientConfiguration {

    @Value("${app.elabftw-client.baseurl}")
    private String baseUrl;

    @Value("${app.elabftw-client.auth-header-name:Authorization}")
    private String headerName;

    @Value("${app.elabftw-client.api-key}")
    private String apiKey;

    @Value("${app.elabftw-client.max-in-memory-size:16MB}")
    private DataSize maxInMemorySize;

    @Bean("elabftwWebClient")
    public WebClient elabftwWebClient() {
        log.info("Initializing eLabFTW WebClient with base URL: {}", baseUrl);
        return WebClient.builder()
                .baseUrl(baseUrl)
                .exchangeStrategies(ExchangeStrategies.builder()
                                            .codecs(codecs -> codecs.defaultCodecs()
                                                    .maxInMemorySize((int) maxInMemorySize.toBytes()))
                                            .build())
                .build();
    }

    /**
     * eLabFTW expects the raw API key in the {@code Authorization} header, without a scheme.
     */
    @Bean("elabftwAuthentication")
    public Authentication elabftwAuthentication() {
        log.info("Initializing eLabFTW authentication with header name: '{}'", headerName);
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("eLabFTW API key is not configured. API calls may fail authentication.");
        }
        return new APIKeyAuthentication(headerName, apiKey);
    }
}
