package com.trendloop.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One stage line of a persisted run.
 *
 * position is the entry's index in the run report (0-based), which is the
 * execution order; ordinal is the stage's registered position.
 *
 * DB table: stage_results  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "stage_results")
public class StageRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "run_id", nullable = false)
    private RunRecord run;

    @Column(nullable = false)
    private int position;

    @Column(name = "stage_name", nullable = false)
    private String stageName;

    @Column(nullable = false)
    private int ordinal;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StageStatus status;

    // Failure kind for FAILURE rows, null otherwise.
    @Column(name = "failure_kind")
    private String failureKind;

    @Column(columnDefinition = "TEXT")
    private String message;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "duration_ms", nullable = false)
    private long durationMs;

    protected StageRecord() {}   // required by JPA

    public StageRecord(RunRecord run, int position, String stageName, int ordinal, StageStatus status) {
        this.run       = run;
        this.position  = position;
        this.stageName = stageName;
        this.ordinal   = ordinal;
        this.status    = status;
    }

    public UUID        getId()          { return id; }
    public RunRecord   getRun()         { return run; }
    public int         getPosition()    { return position; }
    public String      getStageName()   { return stageName; }
    public int         getOrdinal()     { return ordinal; }
    public StageStatus getStatus()      { return status; }
    public String      getFailureKind() { return failureKind; }
    public String      getMessage()     { return message; }
    public Instant     getStartedAt()   { return startedAt; }
    public long        getDurationMs()  { return durationMs; }

    public void setFailureKind(String v) { this.failureKind = v; }
    public void setMessage(String v)     { this.message = v; }
    public void setStartedAt(Instant v)  { this.startedAt = v; }
    public void setDurationMs(long v)    { this.durationMs = v; }
}
