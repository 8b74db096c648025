package com.premiergroup.ad_optimizer.config;

import java.time.Duration;

/**
 * Execution limits of an optimization cycle.
 *
 * @param parallelism   entities analyzed at the same time
 * @param entityTimeout longest wait for one entity before it is recorded as failed
 */
public record CycleSettings(int parallelism, Duration entityTimeout) {

    public CycleSettings {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
        if (entityTimeout == null || entityTimeout.isNegative() || entityTimeout.isZero()) {
            throw new IllegalArgumentException("entityTimeout must be positive, got " + entityTimeout);
        }
    }
}
