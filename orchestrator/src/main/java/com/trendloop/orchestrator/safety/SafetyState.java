package com.trendloop.orchestrator.safety;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of a guard, for logs and the run report.
 */
public record SafetyState(
        int      consecutiveFailureCount,
        Instant  runStartTime,
        int      maxConsecutiveFailures,
        Duration maxRuntime) {}
