package com.trendloop.orchestrator.safety;

import com.trendloop.orchestrator.MutableClock;
import com.trendloop.orchestrator.stage.StageOutcome;
import com.trendloop.orchestrator.stage.StageOutcome.Failure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the failure-streak and wall-clock triggers.
 * No Spring context; time is driven by a MutableClock.
 */
class SafetyGuardTest {

    MutableClock clock;
    SafetyGuard  guard;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T06:00:00Z");
        guard = new SafetyPolicy(3, Duration.ofSeconds(600)).newGuard(clock);
    }

    // ------------------------------------------------------------------
    // Failure streak
    // ------------------------------------------------------------------

    @Test
    void threeConsecutiveFailures_abortOnTheThird() {
        assertThat(guard.recordOutcome(failure())).isEqualTo(GuardDecision.CONTINUE);
        assertThat(guard.recordOutcome(failure())).isEqualTo(GuardDecision.CONTINUE);
        assertThat(guard.recordOutcome(failure())).isEqualTo(GuardDecision.ABORT_CONSECUTIVE_FAILURES);
        assertThat(guard.consecutiveFailureCount()).isEqualTo(3);
    }

    @Test
    void interleavedSuccess_resetsStreak() {
        // Failure, Success, Failure, Failure with limit 3 must not abort
        assertThat(guard.recordOutcome(failure())).isEqualTo(GuardDecision.CONTINUE);
        assertThat(guard.recordOutcome(StageOutcome.success())).isEqualTo(GuardDecision.CONTINUE);
        assertThat(guard.consecutiveFailureCount()).isZero();
        assertThat(guard.recordOutcome(failure())).isEqualTo(GuardDecision.CONTINUE);
        assertThat(guard.recordOutcome(failure())).isEqualTo(GuardDecision.CONTINUE);
        assertThat(guard.consecutiveFailureCount()).isEqualTo(2);
    }

    @Test
    void skipped_leavesStreakUntouched() {
        guard.recordOutcome(failure());
        guard.recordOutcome(failure());

        assertThat(guard.recordOutcome(StageOutcome.skipped("no new trends"))).isEqualTo(GuardDecision.CONTINUE);
        assertThat(guard.consecutiveFailureCount()).isEqualTo(2);

        // Skipped does not break the streak either
        assertThat(guard.recordOutcome(failure())).isEqualTo(GuardDecision.ABORT_CONSECUTIVE_FAILURES);
    }

    @Test
    void everyFailureKind_countsTheSame() {
        guard.recordOutcome(StageOutcome.failure(Failure.Kind.TIMEOUT, "slow"));
        guard.recordOutcome(StageOutcome.failure(Failure.Kind.INVALID_OUTPUT, "empty article"));

        assertThat(guard.recordOutcome(StageOutcome.failure(Failure.Kind.UNHANDLED_EXCEPTION, "npe")))
                .isEqualTo(GuardDecision.ABORT_CONSECUTIVE_FAILURES);
    }

    @Test
    void limitOfOne_abortsOnFirstFailure() {
        SafetyGuard strict = new SafetyPolicy(1, Duration.ofSeconds(60)).newGuard(clock);
        assertThat(strict.recordOutcome(failure())).isEqualTo(GuardDecision.ABORT_CONSECUTIVE_FAILURES);
    }

    // ------------------------------------------------------------------
    // Deadline
    // ------------------------------------------------------------------

    @Test
    void deadline_exactlyAtLimit_continues() {
        clock.advance(Duration.ofSeconds(600));
        assertThat(guard.checkDeadline()).isEqualTo(GuardDecision.CONTINUE);
    }

    @Test
    void deadline_pastLimit_abortsRegardlessOfStreak() {
        guard.recordOutcome(StageOutcome.success());
        clock.advance(Duration.ofSeconds(601));

        assertThat(guard.checkDeadline()).isEqualTo(GuardDecision.ABORT_TIMEOUT);
        assertThat(guard.consecutiveFailureCount()).isZero();
    }

    @Test
    void state_reflectsCounterAndLimits() {
        guard.recordOutcome(failure());

        SafetyState state = guard.state();
        assertThat(state.consecutiveFailureCount()).isEqualTo(1);
        assertThat(state.maxConsecutiveFailures()).isEqualTo(3);
        assertThat(state.maxRuntime()).isEqualTo(Duration.ofSeconds(600));
        assertThat(state.runStartTime()).isEqualTo(clock.instant());
    }

    // ------------------------------------------------------------------
    // Policy validation
    // ------------------------------------------------------------------

    @Test
    void policy_defaults() {
        SafetyPolicy policy = SafetyPolicy.defaults();
        assertThat(policy.maxConsecutiveFailures()).isEqualTo(3);
        assertThat(policy.maxRuntime()).isEqualTo(Duration.ofSeconds(600));
    }

    @Test
    void policy_rejectsNonPositiveLimits() {
        assertThatThrownBy(() -> new SafetyPolicy(0, Duration.ofSeconds(10)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SafetyPolicy(3, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static StageOutcome failure() {
        return StageOutcome.failure(Failure.Kind.EXTERNAL_SERVICE, "service down");
    }
}
