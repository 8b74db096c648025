package com.premiergroup.ad_optimizer.dto;

public record ExecuteActionResponse(boolean success, Decision decision, String message) {
}
