package com.premiergroup.ad_optimizer.enums;

public enum EntityStatus {
    ACTIVE,
    PAUSED,
    ARCHIVED,
    DRAFT
}
