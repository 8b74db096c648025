package com.premiergroup.ad_optimizer.enums;

public enum Priority {
    HIGH,
    MEDIUM,
    LOW
}
