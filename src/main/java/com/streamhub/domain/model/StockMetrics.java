package com.streamhub.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fundamentals attached to a stock snapshot.
 *
 * <p>Fields the provider cannot supply are left null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockMetrics {

    private BigDecimal marketCap;
    private BigDecimal peRatio;
    private BigDecimal eps;
    private BigDecimal debtEquityRatio;

    /** Growth in percent. */
    private BigDecimal businessGrowth;

    private BigDecimal industryAvgPe;
    private long outstandingShares;

    /** Annualised volatility as a fraction (0.25 = 25%). */
    private BigDecimal volatility;
}
