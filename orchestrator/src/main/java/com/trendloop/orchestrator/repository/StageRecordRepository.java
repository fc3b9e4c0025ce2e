package com.trendloop.orchestrator.repository;

import com.trendloop.orchestrator.model.StageRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Read access to the stage_results table. Rows are written through the
 * cascade on {@code RunRecord.stages}.
 */
public interface StageRecordRepository extends JpaRepository<StageRecord, UUID> {

    /** All stage rows of a run, in execution order. */
    List<StageRecord> findByRunIdOrderByPositionAsc(UUID runId);
}
