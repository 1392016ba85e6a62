package com.streamhub.unit.market;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.streamhub.config.StreamHubProperties;
import com.streamhub.domain.enums.SseEventType;
import com.streamhub.domain.model.MarketSummary;
import com.streamhub.domain.model.SseEvent;
import com.streamhub.domain.model.Stock;
import com.streamhub.event.EventPublisherHelper;
import com.streamhub.exception.MarketDataException;
import com.streamhub.market.MarketPayloads;
import com.streamhub.market.MarketSummaryService;
import com.streamhub.market.provider.StockDataProvider;
import com.streamhub.pricefeed.PriceFeedService;
import com.streamhub.repository.memory.InMemoryConnectionRepository;
import com.streamhub.repository.memory.InMemoryRoomRepository;
import com.streamhub.sse.BroadcastEngine;
import com.streamhub.sse.EventLog;
import com.streamhub.sse.ReplayService;
import com.streamhub.sse.RoomRegistry;
import com.streamhub.support.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tools.jackson.databind.json.JsonMapper;

@ExtendWith(MockitoExtension.class)
class MarketSummaryServiceTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private StockDataProvider stockDataProvider;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private MutableClock clock;
    private RoomRegistry roomRegistry;
    private PriceFeedService priceFeedService;
    private MarketSummaryService marketSummaryService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        StreamHubProperties properties = new StreamHubProperties();
        properties.getSummary().setTrackedSymbols(List.of("AAPL", "MSFT"));
        roomRegistry = new RoomRegistry(
                new InMemoryRoomRepository(), new InMemoryConnectionRepository(), properties, eventPublisherHelper, clock);
        BroadcastEngine broadcastEngine = new BroadcastEngine(new EventLog(), roomRegistry, eventPublisherHelper, clock);
        priceFeedService = new PriceFeedService(properties, clock);
        marketSummaryService = new MarketSummaryService(
                stockDataProvider,
                roomRegistry,
                broadcastEngine,
                new ReplayService(roomRegistry),
                new MarketPayloads(JsonMapper.builder().build(), clock),
                priceFeedService,
                eventPublisherHelper,
                properties,
                clock);
    }

    private static Stock stock(String symbol, String price) {
        return Stock.builder()
                .symbol(symbol)
                .currentPrice(new BigDecimal(price))
                .priceHistory(List.of())
                .news(List.of())
                .build();
    }

    @Nested
    @DisplayName("getSummary")
    class GetSummary {

        @Test
        @DisplayName("empty before any refresh, but still records reader activity")
        void emptyButRecordsActivity() {
            assertThat(marketSummaryService.getSummary()).isEmpty();

            assertThat(marketSummaryService.getLastActivity()).contains(T0);
            verify(eventPublisherHelper).publishSummaryActivity(any(), eq(true));
        }

        @Test
        @DisplayName("returns the cached summary while younger than the TTL, never calling the provider")
        void servesCachedWithinTtl() {
            when(stockDataProvider.fetch("AAPL")).thenReturn(stock("AAPL", "190.10"));
            when(stockDataProvider.fetch("MSFT")).thenReturn(stock("MSFT", "410.50"));
            marketSummaryService.refreshSummaryViaProvider();
            clock.advance(Duration.ofMinutes(44));

            assertThat(marketSummaryService.getSummary()).isPresent();
            verify(stockDataProvider, times(1)).fetch("AAPL");

            clock.advance(Duration.ofMinutes(2));
            assertThat(marketSummaryService.getSummary()).isEmpty();
            assertThat(marketSummaryService.peekCachedSummary()).isPresent();
        }
    }

    @Nested
    @DisplayName("refreshSummaryViaProvider")
    class Refresh {

        @Test
        @DisplayName("keeps the symbols that succeeded and feeds their prices")
        void partialFailure() {
            when(stockDataProvider.fetch("AAPL")).thenReturn(stock("AAPL", "190.10"));
            when(stockDataProvider.fetch("MSFT")).thenThrow(new MarketDataException("timeout"));

            MarketSummary summary = marketSummaryService.refreshSummaryViaProvider();

            assertThat(summary.getStocks()).containsOnlyKeys("AAPL");
            assertThat(summary.getCachedAt()).isEqualTo(T0);
            assertThat(priceFeedService.getPrice("AAPL")).hasValueSatisfying(quote -> {
                assertThat(quote.getPrice()).isEqualByComparingTo("190.10");
                assertThat(quote.getSource()).isEqualTo("market-summary");
            });
        }

        @Test
        @DisplayName("fails when every symbol fails and keeps the previous summary")
        void allFail() {
            when(stockDataProvider.fetch("AAPL"))
                    .thenReturn(stock("AAPL", "190.10"))
                    .thenThrow(new MarketDataException("down"));
            when(stockDataProvider.fetch("MSFT"))
                    .thenReturn(stock("MSFT", "410.50"))
                    .thenThrow(new MarketDataException("down"));
            marketSummaryService.refreshSummaryViaProvider();
            clock.advance(Duration.ofMinutes(5));

            assertThatThrownBy(() -> marketSummaryService.refreshSummaryViaProvider())
                    .isInstanceOf(MarketDataException.class);

            MarketSummary kept = marketSummaryService.peekCachedSummary().orElseThrow();
            assertThat(kept.getCachedAt()).isEqualTo(T0);
            assertThat(kept.getStocks()).containsOnlyKeys("AAPL", "MSFT");
        }

        @Test
        @DisplayName("an older fetch finishing after a newer refresh neither overwrites prices nor republishes")
        void olderFetchLosesToNewerRefresh() {
            marketSummaryService.subscribe("c1", "anon-1", null);
            when(stockDataProvider.fetch("AAPL")).thenReturn(stock("AAPL", "190.10"), stock("AAPL", "191.00"));
            when(stockDataProvider.fetch("MSFT"))
                    .thenAnswer(invocation -> {
                        clock.set(T0.plusSeconds(60));
                        marketSummaryService.refreshSummaryViaProvider();
                        clock.set(T0);
                        return stock("MSFT", "410.50");
                    })
                    .thenReturn(stock("MSFT", "411.00"));

            MarketSummary result = marketSummaryService.refreshSummaryViaProvider();

            assertThat(result.getCachedAt()).isEqualTo(T0.plusSeconds(60));
            assertThat(result.getStocks().get("MSFT").getCurrentPrice()).isEqualByComparingTo("411.00");
            assertThat(priceFeedService.getPrice("AAPL"))
                    .hasValueSatisfying(quote -> assertThat(quote.getPrice()).isEqualByComparingTo("191.00"));
            assertThat(roomRegistry.findRoom("market_global").orElseThrow().getEventBuffer()).hasSize(1);
        }

        @Test
        @DisplayName("pushes the summary to the global room once someone subscribed")
        void broadcastsToSubscribers() {
            marketSummaryService.subscribe("c1", "anon-1", null);
            when(stockDataProvider.fetch("AAPL")).thenReturn(stock("AAPL", "190.10"));
            when(stockDataProvider.fetch("MSFT")).thenReturn(stock("MSFT", "410.50"));

            marketSummaryService.refreshSummaryViaProvider();

            List<SseEvent> buffer = roomRegistry.findRoom("market_global").orElseThrow().getEventBuffer();
            assertThat(buffer).singleElement().satisfies(event -> {
                assertThat(event.getType()).isEqualTo(SseEventType.MARKET_SUMMARY);
                assertThat(event.getData()).contains("\"type\":\"market_summary\"").contains("\"AAPL\"");
            });
        }

        @Test
        @DisplayName("does not create the global room when nobody subscribed")
        void noRoomWithoutSubscribers() {
            when(stockDataProvider.fetch("AAPL")).thenReturn(stock("AAPL", "190.10"));
            when(stockDataProvider.fetch("MSFT")).thenReturn(stock("MSFT", "410.50"));

            marketSummaryService.refreshSummaryViaProvider();

            assertThat(roomRegistry.findRoom("market_global")).isEmpty();
            verify(eventPublisherHelper).publishSummaryActivity(any(), eq(false));
        }
    }

    @Test
    @DisplayName("getSummaryOrRefresh fetches when the cache is empty")
    void getSummaryOrRefresh() {
        when(stockDataProvider.fetch("AAPL")).thenReturn(stock("AAPL", "190.10"));
        when(stockDataProvider.fetch("MSFT")).thenReturn(stock("MSFT", "410.50"));

        MarketSummary summary = marketSummaryService.getSummaryOrRefresh();
        MarketSummary again = marketSummaryService.getSummaryOrRefresh();

        assertThat(again).isSameAs(summary);
        verify(stockDataProvider, times(1)).fetch("MSFT");
    }

    @Test
    @DisplayName("activity counts as recent only within the activity window")
    void activityWindow() {
        assertThat(marketSummaryService.hasRecentActivity(T0)).isFalse();

        marketSummaryService.recordActivity();

        assertThat(marketSummaryService.hasRecentActivity(T0.plus(Duration.ofHours(5)))).isTrue();
        assertThat(marketSummaryService.hasRecentActivity(T0.plus(Duration.ofHours(6)))).isFalse();
    }
}
