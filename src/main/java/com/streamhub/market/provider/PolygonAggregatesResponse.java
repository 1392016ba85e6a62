package com.streamhub.market.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code GET /v2/aggs/ticker/{symbol}/range/1/day/{from}/{to}}.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PolygonAggregatesResponse {

    private String ticker;
    private String status;
    private int resultsCount;
    private List<Bar> results;

    /** Single-letter field names are the provider's. */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Bar {
        /** Bar start, epoch millis. */
        private long t;

        private double o;
        private double h;
        private double l;
        private double c;
        private double v;
    }
}
