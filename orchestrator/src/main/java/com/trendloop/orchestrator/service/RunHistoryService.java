package com.trendloop.orchestrator.service;

import com.trendloop.orchestrator.model.RunRecord;
import com.trendloop.orchestrator.model.StageRecord;
import com.trendloop.orchestrator.repository.RunRepository;
import com.trendloop.orchestrator.repository.StageRecordRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read side of the persisted run reports.
 */
@Service
@Transactional(readOnly = true)
public class RunHistoryService {

    private final RunRepository         runRepo;
    private final StageRecordRepository stageRepo;

    public RunHistoryService(RunRepository runRepo, StageRecordRepository stageRepo) {
        this.runRepo   = runRepo;
        this.stageRepo = stageRepo;
    }

    public Optional<RunRecord> findById(UUID id) {
        return runRepo.findById(id);
    }

    /** All stage rows of a run, in execution order. */
    public List<StageRecord> getStages(UUID runId) {
        return stageRepo.findByRunIdOrderByPositionAsc(runId);
    }

    /** Last 20 runs, newest first. */
    public List<RunRecord> recent() {
        return runRepo.findTop20ByOrderByStartedAtDesc();
    }
}
