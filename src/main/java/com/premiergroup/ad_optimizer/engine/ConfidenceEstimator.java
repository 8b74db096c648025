package com.premiergroup.ad_optimizer.engine;

import com.premiergroup.ad_optimizer.dto.ConfidenceInterval;
import com.premiergroup.ad_optimizer.enums.ConfidenceLevel;

/**
 * Wilson score interval for a conversion rate.
 */
public final class ConfidenceEstimator {

    private ConfidenceEstimator() {}

    public static ConfidenceInterval interval(long conversions, long clicks) {
        return interval(conversions, clicks, ConfidenceLevel.NINETY_FIVE);
    }

    /**
     * @return rate, bounds and margin of error in percent; all zero when there are no clicks. The rate is
     * capped at 100%.
     */
    public static ConfidenceInterval interval(long conversions, long clicks, ConfidenceLevel level) {
        if (conversions < 0 || clicks < 0) {
            throw new IllegalArgumentException("conversions and clicks must be non-negative");
        }
        if (clicks == 0) {
            return ConfidenceInterval.ZERO;
        }

        double z = level.getZ();
        double n = clicks;
        // view-through conversions can outnumber clicks
        double rate = Math.min(conversions / n, 1);
        double denominator = 1 + (z * z) / n;
        double center = rate + (z * z) / (2 * n);
        double margin = z * Math.sqrt((rate * (1 - rate)) / n + (z * z) / (4 * n * n));

        // rounding can push the bounds a hair outside [0, 1]
        double lower = clamp((center - margin) / denominator);
        double upper = clamp((center + margin) / denominator);

        return new ConfidenceInterval(
                rate * 100,
                lower * 100,
                upper * 100,
                (upper - lower) / 2 * 100);
    }

    private static double clamp(double value) {
        return Math.max(0, Math.min(1, value));
    }
}
