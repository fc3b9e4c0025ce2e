package com.trendloop.orchestrator.service;

import com.trendloop.orchestrator.model.RunState;
import com.trendloop.orchestrator.model.RunVerdict;
import com.trendloop.orchestrator.report.RunReport;
import com.trendloop.orchestrator.report.RunReportSink;
import com.trendloop.orchestrator.report.StageReport;
import com.trendloop.orchestrator.safety.GuardDecision;
import com.trendloop.orchestrator.safety.SafetyGuard;
import com.trendloop.orchestrator.safety.SafetyPolicy;
import com.trendloop.orchestrator.snapshot.SnapshotException;
import com.trendloop.orchestrator.snapshot.SnapshotHandle;
import com.trendloop.orchestrator.snapshot.SnapshotManager;
import com.trendloop.orchestrator.stage.RunContext;
import com.trendloop.orchestrator.stage.Stage;
import com.trendloop.orchestrator.stage.StageOutcome;
import com.trendloop.orchestrator.stage.StageRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Drives one pipeline run from snapshot to verdict.
 *
 * <pre>
 *   IDLE ──snapshot──▶ SNAPSHOT_TAKEN ──▶ RUNNING(0) ──▶ ... ──▶ RUNNING(n-1) ──▶ COMPLETED
 *     │                                      │
 *     └─ snapshot failed ─▶ ABORTED_SNAPSHOT  ├─ deadline passed before stage i ─▶ ABORTED_TIMEOUT
 *                                            └─ failure streak hit the limit   ─▶ ABORTED_SAFETY
 * </pre>
 *
 * For each stage, in registry order:
 * <ol>
 *   <li>Check the wall-clock deadline. If exhausted, stage i and everything after it
 *       is recorded as Skipped.</li>
 *   <li>Invoke the stage with the shared context. Whether missing inputs mean Skipped
 *       or Failure is the stage's call. Exceptions, errors and null outcomes are
 *       converted into Failures.</li>
 *   <li>Append the outcome to the report, then feed it to the safety guard. On abort the
 *       remaining stages are recorded as Skipped.</li>
 * </ol>
 *
 * Stages run strictly one after another on the calling thread. At most one run is
 * active per process ({@link RunLock}); a concurrent call fails fast with
 * {@link ConcurrentRunException}. Nothing else escapes {@link #run()}: every other
 * error, {@link Error}s from a stage included, ends up as a report entry or a verdict.
 * Only a {@link VirtualMachineError} is rethrown.
 *
 * <p>A stage that hangs is not interrupted. The deadline only stops the next stage from
 * starting, so a single slow stage can overrun the budget; that is logged at WARN when
 * it returns.
 */
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final StageRegistry       registry;
    private final SnapshotManager     snapshots;
    private final SafetyPolicy        policy;
    private final Path                outputTree;
    private final List<RunReportSink> sinks;
    private final RunLock             runLock;
    private final MeterRegistry       meterRegistry;
    private final Clock               clock;

    // Observability only; written by the thread that holds the run lock.
    private volatile RunState state = RunState.IDLE;

    public PipelineOrchestrator(StageRegistry registry,
                                SnapshotManager snapshots,
                                SafetyPolicy policy,
                                Path outputTree,
                                List<RunReportSink> sinks,
                                RunLock runLock,
                                MeterRegistry meterRegistry,
                                Clock clock) {
        this.registry      = registry;
        this.snapshots     = snapshots;
        this.policy        = policy;
        this.outputTree    = outputTree;
        this.sinks         = List.copyOf(sinks);
        this.runLock       = runLock;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    /**
     * Execute one full run and return its finalized report.
     *
     * @throws ConcurrentRunException if another run is active; nothing is started
     */
    public RunReport run() {
        UUID runId = UUID.randomUUID();
        runLock.acquire(runId);
        MDC.put("runId", runId.toString());
        try {
            RunReport report = execute(runId);
            publish(report);
            meterRegistry.counter("trendloop.run.verdicts", "verdict", report.verdict().name()).increment();
            return report;
        } finally {
            MDC.remove("runId");
            runLock.release(runId);
        }
    }

    /**
     * Roll the output tree back to a named snapshot.
     *
     * Takes the run lock for the duration so a restore never overlaps a run.
     *
     * @throws ConcurrentRunException if a run is active
     * @throws SnapshotException      if no such snapshot exists or the restore fails
     */
    public SnapshotHandle restoreSnapshot(String snapshotName) {
        UUID lockId = UUID.randomUUID();
        runLock.acquire(lockId);
        try {
            SnapshotHandle handle = snapshots.listSnapshots(outputTree).stream()
                    .filter(h -> h.name().equals(snapshotName))
                    .findFirst()
                    .orElseThrow(() -> new SnapshotException(SnapshotException.Kind.STALE_HANDLE,
                            "No snapshot named " + snapshotName + " under " + snapshots.backupRoot()));
            snapshots.restore(handle);
            return handle;
        } finally {
            runLock.release(lockId);
        }
    }

    public RunState currentState() {
        return state;
    }

    public Optional<UUID> activeRunId() {
        return runLock.activeRunId();
    }

    // ------------------------------------------------------------------
    // State machine
    // ------------------------------------------------------------------

    private RunReport execute(UUID runId) {
        state = RunState.IDLE;
        Instant startedAt = clock.instant();
        RunReport report  = new RunReport(runId, startedAt);
        SafetyGuard guard = new SafetyGuard(policy, clock, startedAt);
        List<Stage> stages = registry.orderedStages();

        log.info("Run {} starting: {} stages, maxConsecutiveFailures={}, maxRuntime={}s",
                runId, stages.size(), policy.maxConsecutiveFailures(), policy.maxRuntime().toSeconds());

        // IDLE → SNAPSHOT_TAKEN, or straight to ABORTED_SNAPSHOT
        try {
            SnapshotHandle snapshot = snapshots.createSnapshot(outputTree);
            report.setSnapshotName(snapshot.name());
        } catch (SnapshotException e) {
            log.error("Run {} not started: could not snapshot {}: {}", runId, outputTree, e.getMessage(), e);
            return finish(report, guard, RunState.ABORTED_SNAPSHOT, "Snapshot failed: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Run {} not started: unexpected error while snapshotting {}", runId, outputTree, e);
            return finish(report, guard, RunState.ABORTED_SNAPSHOT, "Snapshot failed: " + e);
        }
        state = RunState.SNAPSHOT_TAKEN;

        RunContext context = new RunContext(runId);
        state = RunState.RUNNING;

        for (int i = 0; i < stages.size(); i++) {
            Stage stage = stages.get(i);

            if (guard.checkDeadline() == GuardDecision.ABORT_TIMEOUT) {
                String reason = "Runtime budget of " + policy.maxRuntime().toSeconds()
                        + "s exceeded before stage '" + stage.name() + "'";
                skipRemaining(report, stages, i, reason);
                return finish(report, guard, RunState.ABORTED_TIMEOUT, reason);
            }

            Instant stageStart = clock.instant();
            log.info("Stage #{} '{}' starting", stage.ordinal(), stage.name());
            StageOutcome outcome = invoke(stage, context);
            Duration took = Duration.between(stageStart, clock.instant());
            record(report, stage, outcome, stageStart, took);
            logOutcome(stage, outcome, took);

            if (guard.elapsed().compareTo(policy.maxRuntime()) > 0) {
                log.warn("Stage '{}' returned after the runtime budget was used up ({}s elapsed, limit {}s); "
                                + "running stages are not interrupted",
                        stage.name(), guard.elapsed().toSeconds(), policy.maxRuntime().toSeconds());
            }

            if (guard.recordOutcome(outcome) == GuardDecision.ABORT_CONSECUTIVE_FAILURES) {
                String reason = guard.consecutiveFailureCount() + " consecutive stage failures (limit "
                        + policy.maxConsecutiveFailures() + "), last: '" + stage.name() + "'";
                skipRemaining(report, stages, i + 1, reason);
                return finish(report, guard, RunState.ABORTED_SAFETY, reason);
            }
        }

        return finish(report, guard, RunState.COMPLETED, null);
    }

    /**
     * Call the stage, enforcing the capability contract from this side of the boundary.
     */
    private StageOutcome invoke(Stage stage, RunContext context) {
        context.enterStage(stage.name());
        try {
            StageOutcome outcome = stage.execute(context);
            if (outcome == null) {
                return StageOutcome.failure(StageOutcome.Failure.Kind.CONTRACT_VIOLATION,
                        "Stage returned no outcome");
            }
            return outcome;
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            log.error("Stage '{}' threw instead of reporting a failure", stage.name(), e);
            return StageOutcome.failure(StageOutcome.Failure.Kind.UNHANDLED_EXCEPTION,
                    "Unhandled exception: " + e);
        } finally {
            context.leaveStage();
        }
    }

    private void skipRemaining(RunReport report, List<Stage> stages, int from, String reason) {
        Instant now = clock.instant();
        for (int j = from; j < stages.size(); j++) {
            record(report, stages.get(j), StageOutcome.skipped("run aborted: " + reason), now, Duration.ZERO);
        }
    }

    private void record(RunReport report, Stage stage, StageOutcome outcome, Instant startedAt, Duration took) {
        report.append(new StageReport(stage.name(), stage.ordinal(), outcome, startedAt, took));
        String status = outcome.status().name().toLowerCase();
        meterRegistry.timer("trendloop.stage.duration", "stage", stage.name(), "status", status)
                .record(took.toNanos(), TimeUnit.NANOSECONDS);
        meterRegistry.counter("trendloop.stage.outcomes", "stage", stage.name(), "status", status)
                .increment();
    }

    private static void logOutcome(Stage stage, StageOutcome outcome, Duration took) {
        switch (outcome.status()) {
            case SUCCESS -> log.info("Stage #{} '{}' succeeded in {}ms",
                    stage.ordinal(), stage.name(), took.toMillis());
            case FAILURE -> log.warn("Stage #{} '{}' failed in {}ms: {}",
                    stage.ordinal(), stage.name(), took.toMillis(), outcome.message());
            case SKIPPED -> log.info("Stage #{} '{}' skipped itself: {}",
                    stage.ordinal(), stage.name(), outcome.message());
        }
    }

    private RunReport finish(RunReport report, SafetyGuard guard, RunState terminal, String reason) {
        state = terminal;
        report.setSafetyState(guard.state());
        report.finish(terminal.toVerdict(), clock.instant(), reason);
        if (terminal.toVerdict() == RunVerdict.COMPLETED) {
            log.info("Run {} COMPLETED in {}ms ({} failed, {} skipped)",
                    report.runId(), report.duration().toMillis(), report.failureCount(), report.skippedCount());
        } else {
            log.error("Run {} {}: {}", report.runId(), terminal, reason);
        }
        return report;
    }

    private void publish(RunReport report) {
        for (RunReportSink sink : sinks) {
            try {
                sink.publish(report);
            } catch (Exception e) {
                log.error("Report sink {} failed for run {}: {}",
                        sink.getClass().getSimpleName(), report.runId(), e.getMessage(), e);
            }
        }
    }
}
