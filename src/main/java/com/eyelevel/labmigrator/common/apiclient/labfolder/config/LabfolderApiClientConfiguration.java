package com.eyelevel.labmigrator.common.apiclient.labfolder.config;

import com.eyelevel.labmigrator.common.apiclient.authentication.impl.BearerTokenAuthentication;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Configures the {@link WebClient} and the token holder used by the Labfolder API client.
 */
@Slf4j
@Configuration
public class LabfolderApiClientConfiguration {

    @Value("${app.labfolder-client.baseurl}")
    private String baseUrl;

    @Value("${app.labfolder-client.max-in-memory-size:256MB}")
    private DataSize maxInMemorySize;

    /**
     * File and image downloads are buffered whole, so the codec limit is raised to the configured size.
     */
    @Bean("labfolderWebClient")
    public WebClient labfolderWebClient() {
        log.info("Initializing Labfolder WebClient with base URL: {}", baseUrl);
        return WebClient.builder()
                .baseUrl(baseUrl)
                .exchangeStrategies(ExchangeStrategies.builder()
                                            .codecs(codecs -> codecs.defaultCodecs()
                                                    .maxInMemorySize((int) maxInMemorySize.toBytes()))
                                            .build())
                .build();
    }

    @Bean("labfolderAuthentication")
    public BearerTokenAuthentication labfolderAuthentication() {
        return new BearerTokenAuthentication();
    }
}
