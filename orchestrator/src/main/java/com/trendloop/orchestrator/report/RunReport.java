package com.trendloop.orchestrator.report;

import com.trendloop.orchestrator.model.RunVerdict;
import com.trendloop.orchestrator.model.StageStatus;
import com.trendloop.orchestrator.safety.SafetyState;
import com.trendloop.orchestrator.stage.StageOutcome;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Structured record of one run, handed to every {@link RunReportSink} once finished.
 *
 * Entries are appended in stage execution order and never reordered or removed.
 * {@link #finish} may be called exactly once; after that the report is read-only and
 * any further {@link #append} or {@link #finish} throws {@link IllegalStateException}.
 */
public class RunReport {

    private final UUID    runId;
    private final Instant startedAt;
    private final List<StageReport> entries = new ArrayList<>();

    private String      snapshotName;
    private SafetyState safetyState;
    private RunVerdict verdict;
    private Instant    finishedAt;
    private String     abortReason;

    public RunReport(UUID runId, Instant startedAt) {
        this.runId     = runId;
        this.startedAt = startedAt;
    }

    // ------------------------------------------------------------------
    // Mutation (orchestrator only, before finish)
    // ------------------------------------------------------------------

    public synchronized void append(StageReport entry) {
        requireOpen();
        entries.add(entry);
    }

    public synchronized void setSnapshotName(String snapshotName) {
        requireOpen();
        this.snapshotName = snapshotName;
    }

    /** Final state of the run's safety guard; set just before {@link #finish}. */
    public synchronized void setSafetyState(SafetyState safetyState) {
        requireOpen();
        this.safetyState = safetyState;
    }

    /**
     * Seal the report with its verdict.
     *
     * @param abortReason why the run stopped early; null for a completed run
     */
    public synchronized void finish(RunVerdict verdict, Instant finishedAt, String abortReason) {
        requireOpen();
        this.verdict     = verdict;
        this.finishedAt  = finishedAt;
        this.abortReason = abortReason;
    }

    private void requireOpen() {
        if (verdict != null) {
            throw new IllegalStateException("Run report " + runId + " is already finalized as " + verdict);
        }
    }

    // ------------------------------------------------------------------
    // Read access
    // ------------------------------------------------------------------

    public UUID    runId()     { return runId; }
    public Instant startedAt() { return startedAt; }

    public synchronized List<StageReport> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public synchronized Optional<String> snapshotName() { return Optional.ofNullable(snapshotName); }
    public synchronized Optional<SafetyState> safetyState() { return Optional.ofNullable(safetyState); }
    public synchronized RunVerdict verdict()            { return verdict; }
    public synchronized Instant finishedAt()            { return finishedAt; }
    public synchronized Optional<String> abortReason()  { return Optional.ofNullable(abortReason); }
    public synchronized boolean isFinished()            { return verdict != null; }

    public synchronized Duration duration() {
        return finishedAt == null ? Duration.ZERO : Duration.between(startedAt, finishedAt);
    }

    public long successCount() { return count(StageStatus.SUCCESS); }
    public long failureCount() { return count(StageStatus.FAILURE); }
    public long skippedCount() { return count(StageStatus.SKIPPED); }

    /** Third-party calls per service, summed over the successful stages. */
    public synchronized Map<String, Long> apiCalls() {
        Map<String, Long> totals = new TreeMap<>();
        for (StageReport e : entries) {
            if (e.outcome() instanceof StageOutcome.Success s
                    && s.metadata().get(StageOutcome.API_CALLS) instanceof Map<?, ?> calls) {
                calls.forEach((service, n) -> {
                    if (n instanceof Number count) {
                        totals.merge(String.valueOf(service), count.longValue(), Long::sum);
                    }
                });
            }
        }
        return totals;
    }

    private synchronized long count(StageStatus status) {
        return entries.stream().filter(e -> e.status() == status).count();
    }

    @Override
    public synchronized String toString() {
        return "RunReport{runId=" + runId + ", verdict=" + verdict + ", entries=" + entries.size()
                + ", success=" + successCount() + ", failure=" + failureCount()
                + ", skipped=" + skippedCount() + "}";
    }
}
