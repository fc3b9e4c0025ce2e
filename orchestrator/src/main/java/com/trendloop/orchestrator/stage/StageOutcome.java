package com.trendloop.orchestrator.stage;

import com.trendloop.orchestrator.model.StageStatus;

import java.util.Map;
import java.util.Objects;

/**
 * The single result a stage hands back to the orchestrator.
 *
 * Exactly one of:
 * <ul>
 *   <li>{@link Success}: the stage did its work; optional metadata for the report.</li>
 *   <li>{@link Failure}: the stage could not do its work. Counts toward the
 *       consecutive-failure streak.</li>
 *   <li>{@link Skipped}: the stage chose not to run (or was never started because
 *       the run was aborted). Neutral for the failure streak.</li>
 * </ul>
 *
 * Outcomes are never retried by the orchestrator.
 */
public sealed interface StageOutcome
        permits StageOutcome.Success, StageOutcome.Failure, StageOutcome.Skipped {

    /**
     * Success metadata key for the third-party calls a stage made: a map of service
     * name to call count. Summed per run by {@code RunReport#apiCalls}.
     */
    String API_CALLS = "api_calls";

    StageStatus status();

    /** Human-readable one-liner for logs and the persisted report. */
    String message();

    static Success success() {
        return new Success(Map.of());
    }

    static Success success(Map<String, Object> metadata) {
        return new Success(metadata);
    }

    static Failure failure(Failure.Kind kind, String message) {
        return new Failure(kind, message);
    }

    static Skipped skipped(String reason) {
        return new Skipped(reason);
    }

    record Success(Map<String, Object> metadata) implements StageOutcome {

        public Success {
            metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        }

        @Override public StageStatus status() { return StageStatus.SUCCESS; }
        @Override public String message()     { return metadata.isEmpty() ? "ok" : "ok " + metadata; }
    }

    /**
     * @param kind    coarse classification, informational only: every kind counts the
     *                same toward the failure streak
     * @param message what went wrong, in words an operator can act on
     */
    record Failure(Kind kind, String message) implements StageOutcome {

        public enum Kind {
            EXTERNAL_SERVICE,      // the agents service or a third-party API was unreachable or refused
            INVALID_OUTPUT,        // the stage ran but produced nothing usable
            TIMEOUT,               // the stage's own call timed out
            CONTRACT_VIOLATION,    // the stage broke the capability contract (null outcome, bad context write)
            UNHANDLED_EXCEPTION    // an exception escaped the stage
        }

        public Failure {
            Objects.requireNonNull(kind, "kind");
            message = message == null || message.isBlank() ? kind.name() : message;
        }

        @Override public StageStatus status() { return StageStatus.FAILURE; }
    }

    record Skipped(String reason) implements StageOutcome {

        public Skipped {
            reason = reason == null || reason.isBlank() ? "skipped" : reason;
        }

        @Override public StageStatus status() { return StageStatus.SKIPPED; }
        @Override public String message()     { return reason; }
    }
}
