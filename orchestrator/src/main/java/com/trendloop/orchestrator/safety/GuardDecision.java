package com.trendloop.orchestrator.safety;

/**
 * What the safety guard tells the orchestrator to do next.
 *
 * {@link #recordOutcome} answers CONTINUE or ABORT_CONSECUTIVE_FAILURES;
 * {@link #checkDeadline} answers CONTINUE or ABORT_TIMEOUT.
 *
 * @see SafetyGuard#recordOutcome
 * @see SafetyGuard#checkDeadline
 */
public enum GuardDecision {
    CONTINUE,
    ABORT_CONSECUTIVE_FAILURES,
    ABORT_TIMEOUT
}
