package com.premiergroup.ad_optimizer.enums;

public enum OptimizationAction {
    PAUSE,
    SCALE,
    REDUCE_BUDGET,
    ACTIVATE,
    MONITOR,
    REFRESH_CREATIVE;

    /**
     * MONITOR and REFRESH_CREATIVE only flag an entity, they never carry a status or budget change.
     */
    public boolean isMutating() {
        return switch (this) {
            case PAUSE, SCALE, REDUCE_BUDGET, ACTIVATE -> true;
            case MONITOR, REFRESH_CREATIVE -> false;
        };
    }
}
