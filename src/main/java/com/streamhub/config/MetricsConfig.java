package com.streamhub.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Tags every meter with the application, the market data provider and the store, so
 * dashboards can tell a mock-backed dev instance from a Polygon-backed one sharing Redis.
 * The stream and cache meters themselves live in
 * {@link com.streamhub.observability.StreamMetricsService}.
 */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final StreamHubProperties properties;
    private final String storeType;

    public MetricsConfig(
            MeterRegistry meterRegistry,
            StreamHubProperties properties,
            @Value("${streamhub.store.type:memory}") String storeType) {
        this.meterRegistry = meterRegistry;
        this.properties = properties;
        this.storeType = storeType;
    }

    @PostConstruct
    void configureCommonTags() {
        meterRegistry.config()
                .commonTags(
                        "application", "streamhub",
                        "provider", properties.getProvider().getType(),
                        "store", storeType);
    }
}
