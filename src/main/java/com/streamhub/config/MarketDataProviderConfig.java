package com.streamhub.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP client for the REST market data provider, only created when
 * {@code streamhub.provider.type=polygon}.
 */
@Configuration
@ConditionalOnProperty(name = "streamhub.provider.type", havingValue = "polygon")
public class MarketDataProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(MarketDataProviderConfig.class);

    @Bean
    public RestClient marketDataRestClient(StreamHubProperties properties) {
        StreamHubProperties.Provider provider = properties.getProvider();
        if (provider.getApiKey() == null || provider.getApiKey().isBlank()) {
            log.warn("streamhub.provider.api-key is not set; provider calls will be rejected upstream");
        }

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(provider.getConnectTimeout());
        requestFactory.setReadTimeout(provider.getReadTimeout());
        log.info("Creating market data client for {}", provider.getBaseUrl());
        return RestClient.builder()
                .baseUrl(provider.getBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }
}
