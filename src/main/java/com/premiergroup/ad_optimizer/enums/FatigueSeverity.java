package com.premiergroup.ad_optimizer.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FatigueSeverity {
    INFO,
    WARNING,
    CRITICAL;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
