package com.trendloop.orchestrator.stage;

import java.util.Set;

/**
 * One step of the daily content pipeline (trend analysis, writing, image generation, ...).
 *
 * Stages are registered once at startup in a {@link StageRegistry} and are immutable
 * for the lifetime of the process. The orchestrator calls {@link #execute} at most once
 * per run, strictly after the previous stage's outcome has been recorded.
 *
 * <p>Capability contract:
 * <ul>
 *   <li>Return exactly one {@link StageOutcome}; never {@code null}.</li>
 *   <li>Do not let an exception escape. Convert internal faults into
 *       {@link StageOutcome.Failure} with a readable message. The orchestrator still
 *       guards against violations, but records them as contract failures.</li>
 *   <li>Read any key of the {@link RunContext}, add new keys, but never replace a key
 *       written by an earlier stage.</li>
 *   <li>A stage that judges a condition non-fatal may report {@link StageOutcome.Skipped}
 *       instead of a failure; that keeps the failure streak untouched.</li>
 * </ul>
 */
public interface Stage {

    /** Unique name, e.g. "trend-analysis". Used in logs, metrics and the report. */
    String name();

    /** Position in the pipeline. Unique and strictly increasing across the registry. */
    int ordinal();

    /** Context keys that must be present before this stage can run. */
    default Set<String> requiredInputs() {
        return Set.of();
    }

    /** Context keys this stage writes on success. */
    default Set<String> producedOutputs() {
        return Set.of();
    }

    StageOutcome execute(RunContext context);
}
