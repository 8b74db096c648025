package com.premiergroup.ad_optimizer.enums;

public enum ConfidenceLevel {
    NINETY_FIVE(0.95, 1.96),
    NINETY(0.90, 1.645);

    private final double level;
    private final double z;

    ConfidenceLevel(double level, double z) {
        this.level = level;
        this.z = z;
    }

    public double getLevel() {
        return level;
    }

    public double getZ() {
        return z;
    }

    public static ConfidenceLevel of(double level) {
        for (ConfidenceLevel candidate : values()) {
            if (Double.compare(candidate.level, level) == 0) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unsupported confidence level: " + level + " (expected 0.95 or 0.90)");
    }
}
