package com.streamhub.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Tunables for rooms, the stock cache, the market summary cycle and the price feed.
 *
 * <p>Binds to the {@code streamhub.*} prefix in application.properties. Defaults match the
 * values the service has always run with, so an empty configuration is a working one.
 */
@Configuration
@ConfigurationProperties(prefix = "streamhub")
@Getter
@Setter
public class StreamHubProperties {

    private Sse sse = new Sse();
    private Cache cache = new Cache();
    private Stock stock = new Stock();
    private Summary summary = new Summary();
    private PriceHistory priceHistory = new PriceHistory();
    private PriceFeed priceFeed = new PriceFeed();
    private Provider provider = new Provider();

    @Getter
    @Setter
    public static class Sse {

        /** Admission limit per room. The connection that would exceed it is rejected. */
        private int maxConnectionsPerRoom = 100;

        /** Default event buffer size for rooms created on demand. */
        private int maxBufferSizePerRoom = 1000;

        /** Idle time after which a connection is swept, and an empty room deleted. */
        private Duration connectionTimeout = Duration.ofMinutes(5);

        /** Buffered events older than this are dropped by the sweep. */
        private Duration maxEventAge = Duration.ofMinutes(10);

        private long cleanupIntervalMs = 60_000;

        /** Value of the {@code retry:} hint written at the start of every stream. */
        private long retryHintMs = 3000;

        /** Comment frame written to every open stream; a successful write refreshes the connection. */
        private long keepaliveIntervalMs = 30_000;

        /** How long the servlet container keeps an idle stream open. */
        private Duration emitterTimeout = Duration.ofMinutes(30);

        /** Rooms whose id starts with one of these admit callers without a token. */
        private List<String> anonymousRoomPrefixes = new ArrayList<>(List.of("stock_", "market_"));
    }

    @Getter
    @Setter
    public static class Cache {

        private Duration duration = Duration.ofMinutes(45);

        private Duration rateLimitInterval = Duration.ofSeconds(30);

        private int maxAccessCountPerPeriod = 100;
    }

    @Getter
    @Setter
    public static class Stock {

        /** Stock rooms are named {@code <prefix>_<SYMBOL>}. */
        private String roomPrefix = "stock";

        private int roomBufferSize = 100;
    }

    @Getter
    @Setter
    public static class Summary {

        private Duration ttl = Duration.ofMinutes(45);

        private Duration refreshInterval = Duration.ofMinutes(30);

        /** The refresh cycle stops itself once no reader showed up for this long. */
        private Duration activityWindow = Duration.ofHours(6);

        private String roomId = "market_global";

        private List<String> trackedSymbols = new ArrayList<>(
                List.of("AAPL", "GOOGL", "MSFT", "AMZN", "TSLA", "NVDA", "META", "NFLX", "AMD", "INTC"));
    }

    @Getter
    @Setter
    public static class PriceHistory {

        /** 24 hours of 10-minute snapshots. */
        private int capacity = 144;

        private long snapshotIntervalMs = 600_000;
    }

    @Getter
    @Setter
    public static class PriceFeed {

        /** The only peer allowed to submit prices. */
        private String oraclePeerId = "price-oracle";
    }

    @Getter
    @Setter
    public static class Provider {

        /** {@code mock} or {@code polygon}. */
        private String type = "mock";

        private String baseUrl = "https://api.polygon.io";

        private String apiKey;

        private int historyDays = 7;

        /** HTTP connect timeout in milliseconds. */
        private int connectTimeout = 5000;

        /** HTTP read timeout in milliseconds. */
        private int readTimeout = 15000;
    }
}
