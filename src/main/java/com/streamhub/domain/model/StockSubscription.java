package com.streamhub.domain.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Links a connection to the dedicated room of one stock symbol. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockSubscription {

    private String connectionId;
    private String symbol;
    private Instant subscribedAt;
    private Long lastEventId;
}
