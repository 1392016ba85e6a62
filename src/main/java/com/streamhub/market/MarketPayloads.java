package com.streamhub.market;

import com.streamhub.domain.model.Stock;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/**
 * JSON payloads of the market events. Field names are snake_case and every payload carries
 * its {@code type} and an epoch-millis {@code timestamp}.
 */
@Component
public class MarketPayloads {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MarketPayloads(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public String priceUpdate(Stock stock) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "price_update");
        payload.put("stock_id", stock.getSymbol());
        payload.put("current_price", stock.getCurrentPrice());
        payload.put("price_history", stock.getPriceHistory());
        payload.put("metrics", stock.getMetrics());
        payload.put("timestamp", clock.millis());
        return objectMapper.writeValueAsString(payload);
    }

    public String newsUpdate(Stock stock) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "news_update");
        payload.put("stock_id", stock.getSymbol());
        payload.put("news", stock.getNews());
        payload.put("timestamp", clock.millis());
        return objectMapper.writeValueAsString(payload);
    }

    public String marketSummary(Map<String, Stock> stocks) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "market_summary");
        payload.put("stocks", stocks);
        payload.put("timestamp", clock.millis());
        return objectMapper.writeValueAsString(payload);
    }
}
