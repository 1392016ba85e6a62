package com.streamhub.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Latest known price of a symbol in the price feed. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceQuote {

    private String symbol;
    private BigDecimal price;
    private Instant updatedAt;
    private String source;
}
