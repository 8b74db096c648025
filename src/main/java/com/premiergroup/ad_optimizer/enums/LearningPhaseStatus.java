package com.premiergroup.ad_optimizer.enums;

public enum LearningPhaseStatus {
    LEARNING,
    ACTIVE,
    LEARNING_LIMITED,
    NOT_STARTED
}
