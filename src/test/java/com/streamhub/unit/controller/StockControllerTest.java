package com.streamhub.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.streamhub.api.controller.StockController;
import com.streamhub.api.stream.SseStreamRegistry;
import com.streamhub.auth.PeerIdentityService;
import com.streamhub.config.ApiResponseAdvice;
import com.streamhub.domain.model.SseEvent;
import com.streamhub.domain.model.Stock;
import com.streamhub.exception.GlobalExceptionHandler;
import com.streamhub.exception.MarketDataException;
import com.streamhub.exception.ResourceNotFoundException;
import com.streamhub.market.StockDataService;
import com.streamhub.market.StockSubscriptionService;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

@ExtendWith(MockitoExtension.class)
class StockControllerTest {

    private MockMvc mockMvc;

    @Mock
    private StockDataService stockDataService;

    @Mock
    private StockSubscriptionService stockSubscriptionService;

    @Mock
    private SseStreamRegistry sseStreamRegistry;

    @Mock
    private PeerIdentityService peerIdentityService;

    @BeforeEach
    void setUp() {
        StockController controller =
                new StockController(stockDataService, stockSubscriptionService, sseStreamRegistry, peerIdentityService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    private static Stock stock(String symbol) {
        return Stock.builder()
                .symbol(symbol)
                .name(symbol + " Inc")
                .currentPrice(new BigDecimal("187.25"))
                .priceHistory(List.of())
                .news(List.of())
                .build();
    }

    // ==== Snapshots ====

    @Nested
    @DisplayName("GET /api/stocks/{symbol}")
    class GetStock {

        @Test
        @DisplayName("returns the snapshot wrapped in the success envelope")
        void returnsSnapshot() throws Exception {
            when(stockDataService.getOrFetch("aapl")).thenReturn(stock("AAPL"));

            mockMvc.perform(get("/api/stocks/aapl"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.symbol").value("AAPL"))
                    .andExpect(jsonPath("$.data.currentPrice").value(187.25));
        }

        @Test
        @DisplayName("maps provider failures to 502")
        void providerFailure() throws Exception {
            when(stockDataService.getOrFetch("AAPL")).thenThrow(new MarketDataException("Provider timed out"));

            mockMvc.perform(get("/api/stocks/AAPL"))
                    .andExpect(status().isBadGateway())
                    .andExpect(jsonPath("$.error.code").value("PROVIDER_ERROR"));
        }

        @Test
        @DisplayName("maps unknown symbols to 404")
        void unknownSymbol() throws Exception {
            when(stockDataService.getOrFetch("ZZZZ")).thenThrow(new ResourceNotFoundException("Stock", "ZZZZ"));

            mockMvc.perform(get("/api/stocks/ZZZZ"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error.path").value("/api/stocks/ZZZZ"));
        }
    }

    @Test
    @DisplayName("GET /cached returns 404 when nothing fresh is cached")
    void cachedMiss() throws Exception {
        when(stockDataService.findCached("MSFT")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/stocks/MSFT/cached"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("GET /cached returns the cached snapshot")
    void cachedHit() throws Exception {
        when(stockDataService.findCached("MSFT")).thenReturn(Optional.of(stock("MSFT")));

        mockMvc.perform(get("/api/stocks/MSFT/cached"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.name").value("MSFT Inc"));
    }

    // ==== Streams ====

    @Test
    @DisplayName("GET /stream subscribes the connection to the symbol room")
    @SuppressWarnings("unchecked")
    void stream() throws Exception {
        when(stockDataService.stockRoomId("tsla")).thenReturn("stock_TSLA");
        when(peerIdentityService.resolvePeerId("stock_TSLA", null)).thenReturn("anon-1");
        when(sseStreamRegistry.open(eq("c7"), any())).thenReturn(new ResponseBodyEmitter());

        mockMvc.perform(get("/api/stocks/tsla/stream").param("connectionId", "c7").param("lastEventId", "12"))
                .andExpect(request().asyncStarted())
                .andExpect(header().string("X-Connection-Id", "c7"));

        ArgumentCaptor<Supplier<List<SseEvent>>> admission = ArgumentCaptor.forClass(Supplier.class);
        verify(sseStreamRegistry).open(eq("c7"), admission.capture());
        admission.getValue().get();
        verify(stockSubscriptionService).subscribe("c7", "tsla", "anon-1", 12L);
    }

    @Test
    void subscribers() throws Exception {
        when(stockSubscriptionService.getSubscribers("aapl")).thenReturn(List.of("c1", "c2"));
        when(stockDataService.normalizeSymbol("aapl")).thenReturn("AAPL");

        mockMvc.perform(get("/api/stocks/aapl/subscribers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.symbol").value("AAPL"))
                .andExpect(jsonPath("$.data.subscribers.length()").value(2));
    }
}
