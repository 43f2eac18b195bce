package com.taskgraph.core.model.automation;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Tunables for rule execution.
 *
 * @param zone          zone whose calendar day bounds maxExecutionsPerDay
 * @param maxChainDepth how deep run_automation actions may nest
 * @param chainLockTimeout how long a run_automation action waits for the chained rule's lock
 */
public record AutomationPolicy(ZoneId zone, int maxChainDepth, Duration chainLockTimeout) {

    public static final Duration DEFAULT_CHAIN_LOCK_TIMEOUT = Duration.ofSeconds(5);

    public AutomationPolicy {
        if (zone == null) {
            throw new IllegalArgumentException("zone must not be null");
        }
        if (maxChainDepth < 1) {
            throw new IllegalArgumentException("maxChainDepth must be >= 1");
        }
        if (chainLockTimeout == null || chainLockTimeout.isNegative() || chainLockTimeout.isZero()) {
            throw new IllegalArgumentException("chainLockTimeout must be positive");
        }
    }

    public static AutomationPolicy defaults() {
        return new AutomationPolicy(ZoneId.of("UTC"), 5, DEFAULT_CHAIN_LOCK_TIMEOUT);
    }
}
