package com.premiergroup.ad_optimizer.dto;

import lombok.Builder;

/**
 * Derived ratios are 0 when their denominator is 0; ctr is in percent.
 */
@Builder(toBuilder = true)
public record PerformanceMetrics(
        long impressions,
        long clicks,
        long conversions,
        double spend,
        double revenue,
        double ctr,
        double cpa,
        double roas,
        double cpc,
        double frequency,
        int ageDays,
        long optimizationEvents,
        double dailyBudget,
        double targetCPA,
        double targetROAS
) {

    public PerformanceMetrics {
        if (impressions < 0 || clicks < 0 || conversions < 0) {
            throw new IllegalArgumentException("impressions, clicks and conversions must be non-negative");
        }
        if (ageDays < 0) {
            throw new IllegalArgumentException("ageDays must be non-negative");
        }
        ctr = finiteOrZero(ctr);
        cpa = finiteOrZero(cpa);
        roas = finiteOrZero(roas);
        cpc = finiteOrZero(cpc);
        frequency = finiteOrZero(frequency);
    }

    /**
     * Builds a snapshot from window totals, deriving ctr/cpa/roas/cpc/frequency.
     */
    public static PerformanceMetrics from(PerformanceTotals totals,
                                          int ageDays,
                                          long optimizationEvents,
                                          double dailyBudget,
                                          OptimizationConfig config) {
        double spend = totals.spend().doubleValue();
        double revenue = totals.revenue().doubleValue();
        return PerformanceMetrics.builder()
                .impressions(totals.impressions())
                .clicks(totals.clicks())
                .conversions(totals.conversions())
                .spend(spend)
                .revenue(revenue)
                .ctr(totals.ctr())
                .cpa(totals.conversions() > 0 ? spend / totals.conversions() : 0)
                .roas(spend > 0 ? revenue / spend : 0)
                .cpc(totals.cpc())
                .frequency(totals.reach() > 0 ? (double) totals.impressions() / totals.reach() : 0)
                .ageDays(Math.max(ageDays, 0))
                .optimizationEvents(optimizationEvents)
                .dailyBudget(dailyBudget)
                .targetCPA(config.getTargetCPA())
                .targetROAS(config.getTargetROAS())
                .build();
    }

    private static double finiteOrZero(double value) {
        return Double.isFinite(value) ? value : 0;
    }
}
