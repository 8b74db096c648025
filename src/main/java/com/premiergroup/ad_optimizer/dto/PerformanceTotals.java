package com.premiergroup.ad_optimizer.dto;

import java.math.BigDecimal;

/**
 * Telemetry sums of one entity over a date window.
 */
public record PerformanceTotals(
        long impressions,
        long clicks,
        long conversions,
        BigDecimal spend,
        BigDecimal revenue,
        long reach
) {

    public static final PerformanceTotals EMPTY =
            new PerformanceTotals(0, 0, 0, BigDecimal.ZERO, BigDecimal.ZERO, 0);

    public PerformanceTotals {
        if (impressions < 0 || clicks < 0 || conversions < 0 || reach < 0) {
            throw new IllegalArgumentException("Telemetry counts must be non-negative");
        }
        spend = spend == null ? BigDecimal.ZERO : spend;
        revenue = revenue == null ? BigDecimal.ZERO : revenue;
    }

    public double ctr() {
        return impressions > 0 ? (double) clicks / impressions * 100 : 0;
    }

    public double cpc() {
        return clicks > 0 ? spend.doubleValue() / clicks : 0;
    }
}
