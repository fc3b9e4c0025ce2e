package com.trendloop.orchestrator.api;

import com.trendloop.orchestrator.api.dto.RunReportResponse;
import com.trendloop.orchestrator.api.dto.RunResponse;
import com.trendloop.orchestrator.api.dto.StageResultResponse;
import com.trendloop.orchestrator.report.RunReport;
import com.trendloop.orchestrator.service.ConcurrentRunException;
import com.trendloop.orchestrator.service.PipelineOrchestrator;
import com.trendloop.orchestrator.service.RunHistoryService;
import com.trendloop.orchestrator.snapshot.SnapshotException;
import com.trendloop.orchestrator.snapshot.SnapshotHandle;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for triggering runs and reading their history.
 *
 * POST /runs                          execute one pipeline run now (blocks until it ends)
 * GET  /runs/active                   id of the run in progress, 204 if idle
 * GET  /runs/recent                   last 20 persisted runs
 * GET  /runs/{id}                     one persisted run
 * GET  /runs/{id}/stages              its stage rows in execution order
 * POST /runs/restore/{snapshotName}   roll the published tree back to a snapshot
 */
@RestController
@RequestMapping("/runs")
public class RunController {

    private final PipelineOrchestrator orchestrator;
    private final RunHistoryService    history;

    public RunController(PipelineOrchestrator orchestrator, RunHistoryService history) {
        this.orchestrator = orchestrator;
        this.history      = history;
    }

    /**
     * Run the pipeline now.
     *
     * HTTP 201: run finished (any verdict; check "verdict" in the body)
     * HTTP 409: another run is in progress; nothing was started
     *
     * Example:
     *   curl -X POST http://localhost:8080/runs
     */
    @PostMapping
    public ResponseEntity<RunReportResponse> trigger() {
        RunReport report = orchestrator.run();
        return ResponseEntity.status(HttpStatus.CREATED).body(RunReportResponse.from(report));
    }

    @GetMapping("/active")
    public ResponseEntity<Map<String, Object>> active() {
        return orchestrator.activeRunId()
                .<ResponseEntity<Map<String, Object>>>map(id -> ResponseEntity.ok(Map.of(
                        "runId", id.toString(),
                        "state", orchestrator.currentState().name())))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/recent")
    public List<RunResponse> recent() {
        return history.recent().stream().map(RunResponse::from).toList();
    }

    /**
     * Returns 404 if the run id is not found.
     */
    @GetMapping("/{id}")
    public RunResponse getRun(@PathVariable UUID id) {
        return history.findById(id)
                .map(RunResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Run not found: " + id));
    }

    @GetMapping("/{id}/stages")
    public List<StageResultResponse> getStages(@PathVariable UUID id) {
        history.findById(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + id));
        return history.getStages(id).stream()
                .map(StageResultResponse::from)
                .toList();
    }

    /**
     * Restore the output tree from a snapshot. The current tree is quarantined first.
     *
     * HTTP 200: restored
     * HTTP 404: no such snapshot
     * HTTP 409: a run is in progress
     * HTTP 500: the restore itself failed; see the message
     */
    @PostMapping("/restore/{snapshotName}")
    public Map<String, Object> restore(@PathVariable String snapshotName) {
        try {
            SnapshotHandle handle = orchestrator.restoreSnapshot(snapshotName);
            return Map.of("snapshot", handle.name(), "restoredTo", handle.sourceTree().toString());
        } catch (SnapshotException e) {
            HttpStatus status = e.getKind() == SnapshotException.Kind.STALE_HANDLE
                    ? HttpStatus.NOT_FOUND
                    : HttpStatus.INTERNAL_SERVER_ERROR;
            throw new ResponseStatusException(status, e.getMessage(), e);
        }
    }

    @ExceptionHandler(ConcurrentRunException.class)
    public ResponseEntity<Map<String, Object>> onConcurrentRun(ConcurrentRunException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                "error",       "run_in_progress",
                "activeRunId", String.valueOf(e.getActiveRunId()),
                "message",     e.getMessage()));
    }
}
