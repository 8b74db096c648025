package com.premiergroup.ad_optimizer.enums;

public enum TrendDirection {
    UP,
    DOWN,
    FLAT
}
