package com.trendloop.orchestrator.safety;

import com.trendloop.orchestrator.stage.StageOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-run counter/clock state machine with two independent abort triggers.
 *
 * <ul>
 *   <li>Failure streak: every {@code Failure} increments the counter, every
 *       {@code Success} resets it to zero, {@code Skipped} leaves it alone. Reaching
 *       {@code maxConsecutiveFailures} aborts the run. Failure kinds are not weighed
 *       differently.</li>
 *   <li>Wall clock: once {@code now - runStartTime > maxRuntime}, the deadline check
 *       aborts regardless of the streak. Checked before every stage so a stage that
 *       hangs without ever failing still bounds the run, at the next stage boundary.</li>
 * </ul>
 *
 * One instance per run; nothing survives into the next run.
 */
public class SafetyGuard {

    private static final Logger log = LoggerFactory.getLogger(SafetyGuard.class);

    private final SafetyPolicy  policy;
    private final Clock         clock;
    private final Instant       runStartTime;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    public SafetyGuard(SafetyPolicy policy, Clock clock, Instant runStartTime) {
        this.policy       = policy;
        this.clock        = clock;
        this.runStartTime = runStartTime;
    }

    /**
     * Fold one stage outcome into the failure streak.
     *
     * @return ABORT_CONSECUTIVE_FAILURES once the streak reaches the limit, else CONTINUE
     */
    public GuardDecision recordOutcome(StageOutcome outcome) {
        switch (outcome.status()) {
            case SUCCESS -> {
                consecutiveFailures.set(0);
                return GuardDecision.CONTINUE;
            }
            case FAILURE -> {
                int streak = consecutiveFailures.incrementAndGet();
                if (streak >= policy.maxConsecutiveFailures()) {
                    log.error("Failure streak reached {}/{}; aborting run",
                            streak, policy.maxConsecutiveFailures());
                    return GuardDecision.ABORT_CONSECUTIVE_FAILURES;
                }
                log.warn("Failure streak {}/{}", streak, policy.maxConsecutiveFailures());
                return GuardDecision.CONTINUE;
            }
            default -> {
                return GuardDecision.CONTINUE;
            }
        }
    }

    /**
     * @return ABORT_TIMEOUT if the run has used more than its wall-clock budget
     */
    public GuardDecision checkDeadline() {
        Duration elapsed = elapsed();
        if (elapsed.compareTo(policy.maxRuntime()) > 0) {
            log.error("Runtime budget exceeded: {}s elapsed, limit {}s",
                    elapsed.toSeconds(), policy.maxRuntime().toSeconds());
            return GuardDecision.ABORT_TIMEOUT;
        }
        return GuardDecision.CONTINUE;
    }

    public Duration elapsed() {
        return Duration.between(runStartTime, Instant.now(clock));
    }

    public int consecutiveFailureCount() {
        return consecutiveFailures.get();
    }

    public SafetyState state() {
        return new SafetyState(consecutiveFailures.get(), runStartTime,
                policy.maxConsecutiveFailures(), policy.maxRuntime());
    }
}
