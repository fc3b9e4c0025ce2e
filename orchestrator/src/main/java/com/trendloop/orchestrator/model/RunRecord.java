package com.trendloop.orchestrator.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Persisted summary of one finished pipeline run.
 *
 * Written once by the JPA report sink after the run report is finalized,
 * never updated afterwards. The id is assigned from the run report, so the entity
 * reports itself new until persisted or loaded; save() then inserts directly instead
 * of merging.
 *
 * DB table: runs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "runs")
public class RunRecord implements Persistable<UUID> {

    // Same UUID as the in-memory run report, so logs (MDC runId) and rows line up.
    @Id
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunVerdict verdict;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "finished_at", nullable = false)
    private Instant finishedAt;

    @Column(name = "snapshot_name")
    private String snapshotName;

    @Column(name = "abort_reason", columnDefinition = "TEXT")
    private String abortReason;

    @Column(name = "success_count", nullable = false)
    private int successCount;

    @Column(name = "failure_count", nullable = false)
    private int failureCount;

    @Column(name = "skipped_count", nullable = false)
    private int skippedCount;

    @OneToMany(mappedBy = "run", cascade = CascadeType.ALL, fetch = FetchType.LAZY)
    @OrderBy("position ASC")
    private List<StageRecord> stages = new ArrayList<>();

    @Transient
    private boolean fresh = true;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected RunRecord() {}   // required by JPA

    public RunRecord(UUID id, RunVerdict verdict, Instant startedAt, Instant finishedAt) {
        this.id         = id;
        this.verdict    = verdict;
        this.startedAt  = startedAt;
        this.finishedAt = finishedAt;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    @Override
    public UUID       getId()           { return id; }
    public RunVerdict getVerdict()      { return verdict; }
    public Instant    getStartedAt()    { return startedAt; }
    public Instant    getFinishedAt()   { return finishedAt; }
    public String     getSnapshotName() { return snapshotName; }
    public String     getAbortReason()  { return abortReason; }
    public int        getSuccessCount() { return successCount; }
    public int        getFailureCount() { return failureCount; }
    public int        getSkippedCount() { return skippedCount; }
    public List<StageRecord> getStages() { return stages; }

    public void setSnapshotName(String v) { this.snapshotName = v; }
    public void setAbortReason(String v)  { this.abortReason = v; }
    public void setCounts(int success, int failure, int skipped) {
        this.successCount = success;
        this.failureCount = failure;
        this.skippedCount = skipped;
    }

    public void addStage(StageRecord stage) {
        stages.add(stage);
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostPersist
    @PostLoad
    void markPersisted() {
        this.fresh = false;
    }
}
