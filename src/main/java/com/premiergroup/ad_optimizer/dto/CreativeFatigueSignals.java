package com.premiergroup.ad_optimizer.dto;

public record CreativeFatigueSignals(double frequency, Trend ctrTrend, Trend cpcTrend, int ageDays) {

    public CreativeFatigueSignals {
        ctrTrend = ctrTrend == null ? Trend.FLAT : ctrTrend;
        cpcTrend = cpcTrend == null ? Trend.FLAT : cpcTrend;
    }
}
