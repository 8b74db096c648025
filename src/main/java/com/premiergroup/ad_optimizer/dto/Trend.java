package com.premiergroup.ad_optimizer.dto;

import com.premiergroup.ad_optimizer.enums.TrendDirection;

/**
 * Direction and percent change of a metric between a reference window and the current one.
 */
public record Trend(TrendDirection direction, double pctChange) {

    public static final Trend FLAT = new Trend(TrendDirection.FLAT, 0);

    public static Trend between(double previous, double current) {
        if (previous <= 0) {
            return FLAT;
        }
        double pct = (current - previous) / previous * 100;
        if (pct > 0) {
            return new Trend(TrendDirection.UP, pct);
        }
        if (pct < 0) {
            return new Trend(TrendDirection.DOWN, pct);
        }
        return FLAT;
    }
}
