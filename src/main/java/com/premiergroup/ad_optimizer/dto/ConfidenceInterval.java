package com.premiergroup.ad_optimizer.dto;

/**
 * Conversion-rate interval, every field in percent (0-100).
 */
public record ConfidenceInterval(double rate, double lower, double upper, double marginOfError) {

    public static final ConfidenceInterval ZERO = new ConfidenceInterval(0, 0, 0, 0);
}
