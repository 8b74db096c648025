package com.premiergroup.ad_optimizer.dto;

import com.premiergroup.ad_optimizer.enums.FatigueSeverity;

public record FatigueSignal(String type, FatigueSeverity severity, double value, String explanation) {
}
