package com.streamhub.market.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code GET /v3/reference/tickers/{symbol}}.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PolygonTickerDetailsResponse {

    private String status;
    private Details results;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Details {
        private String ticker;
        private String name;

        @JsonProperty("market_cap")
        private Double marketCap;

        @JsonProperty("share_class_shares_outstanding")
        private Long sharesOutstanding;
    }
}
