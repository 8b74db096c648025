package com.premiergroup.ad_optimizer.exception;

/**
 * Raised before a cycle starts when its configuration cannot be used; no entity is touched.
 */
public class InvalidOptimizationConfigException extends IllegalArgumentException {

    public InvalidOptimizationConfigException(String message) {
        super(message);
    }
}
