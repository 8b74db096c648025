package com.premiergroup.ad_optimizer.enums;

public enum AdEffectiveStatus {
    ACTIVE,
    PAUSED,
    DISAPPROVED,
    PENDING_REVIEW,
    ARCHIVED,
    DELETED,
    ADSET_PAUSED,
    CAMPAIGN_PAUSED
}
