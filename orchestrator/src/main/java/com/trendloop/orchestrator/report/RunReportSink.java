package com.trendloop.orchestrator.report;

/**
 * Receives every finalized run report, whether the run completed or aborted.
 *
 * Implementations persist the report or notify operators. They must not mutate the
 * report. An exception thrown here is logged by the orchestrator and does not change
 * the run's verdict.
 */
public interface RunReportSink {

    void publish(RunReport report);
}
