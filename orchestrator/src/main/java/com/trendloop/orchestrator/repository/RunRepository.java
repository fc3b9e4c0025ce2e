package com.trendloop.orchestrator.repository;

import com.trendloop.orchestrator.model.RunRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD + history queries for the runs table.
 */
public interface RunRepository extends JpaRepository<RunRecord, UUID> {

    /** Most recent runs first (used by GET /runs/recent). */
    List<RunRecord> findTop20ByOrderByStartedAtDesc();
}
