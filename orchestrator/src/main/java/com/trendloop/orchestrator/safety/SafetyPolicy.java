package com.trendloop.orchestrator.safety;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Read-only limits applied to every run.
 *
 * @param maxConsecutiveFailures failures in a row that stop the run (default 3)
 * @param maxRuntime             wall-clock budget for a whole run (default 600 s)
 */
public record SafetyPolicy(int maxConsecutiveFailures, Duration maxRuntime) {

    public static final int      DEFAULT_MAX_CONSECUTIVE_FAILURES = 3;
    public static final Duration DEFAULT_MAX_RUNTIME              = Duration.ofSeconds(600);

    public SafetyPolicy {
        if (maxConsecutiveFailures < 1) {
            throw new IllegalArgumentException("maxConsecutiveFailures must be >= 1, got " + maxConsecutiveFailures);
        }
        if (maxRuntime == null || maxRuntime.isZero() || maxRuntime.isNegative()) {
            throw new IllegalArgumentException("maxRuntime must be positive, got " + maxRuntime);
        }
    }

    public static SafetyPolicy defaults() {
        return new SafetyPolicy(DEFAULT_MAX_CONSECUTIVE_FAILURES, DEFAULT_MAX_RUNTIME);
    }

    /** Fresh guard for one run, starting its clock now. */
    public SafetyGuard newGuard(Clock clock) {
        return new SafetyGuard(this, clock, Instant.now(clock));
    }
}
