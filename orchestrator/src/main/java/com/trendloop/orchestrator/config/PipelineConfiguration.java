package com.trendloop.orchestrator.config;

import com.trendloop.orchestrator.agent.AgentServiceClient;
import com.trendloop.orchestrator.report.JpaRunReportSink;
import com.trendloop.orchestrator.report.LoggingRunReportSink;
import com.trendloop.orchestrator.report.RunReportSink;
import com.trendloop.orchestrator.repository.RunRepository;
import com.trendloop.orchestrator.safety.SafetyPolicy;
import com.trendloop.orchestrator.service.PipelineOrchestrator;
import com.trendloop.orchestrator.service.RunLock;
import com.trendloop.orchestrator.snapshot.QuarantineService;
import com.trendloop.orchestrator.snapshot.SnapshotManager;
import com.trendloop.orchestrator.snapshot.SnapshotRetention;
import com.trendloop.orchestrator.stage.ConfigurationException;
import com.trendloop.orchestrator.stage.StageRegistry;
import com.trendloop.orchestrator.stage.impl.RemoteStage;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;

/**
 * Wires the orchestration core from {@code trendloop.*} properties.
 *
 * The core classes are plain Java (no Spring annotations) so the tests can build them
 * by hand; this class is the only place they meet the container.
 */
@Configuration
@EnableConfigurationProperties(StageProperties.class)
public class PipelineConfiguration {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    SafetyPolicy safetyPolicy(
            @Value("${trendloop.safety.max-consecutive-failures:3}") int maxConsecutiveFailures,
            @Value("${trendloop.safety.max-runtime-seconds:600}") long maxRuntimeSeconds) {
        return new SafetyPolicy(maxConsecutiveFailures, Duration.ofSeconds(maxRuntimeSeconds));
    }

    @Bean
    QuarantineService quarantineService(
            @Value("${trendloop.paths.quarantine:_deleted_items}") Path quarantineRoot,
            Clock clock) {
        return new QuarantineService(quarantineRoot, clock);
    }

    @Bean
    SnapshotManager snapshotManager(
            @Value("${trendloop.paths.backups:_backups}") Path backupRoot,
            QuarantineService quarantine,
            Clock clock) {
        return new SnapshotManager(backupRoot, quarantine, clock);
    }

    @Bean
    SnapshotRetention snapshotRetention(
            SnapshotManager snapshots,
            QuarantineService quarantine,
            @Value("${trendloop.paths.output:docs}") Path outputTree,
            @Value("${trendloop.snapshot.retention-days:30}") long retentionDays,
            Clock clock) {
        return new SnapshotRetention(snapshots, quarantine, outputTree, Duration.ofDays(retentionDays), clock);
    }

    @Bean
    AgentServiceClient agentServiceClient(
            @Value("${trendloop.agents.base-url}") String baseUrl,
            @Value("${trendloop.agents.request-timeout-seconds:180}") long timeoutSeconds,
            ObjectMapper objectMapper) {
        return new AgentServiceClient(baseUrl, objectMapper, Duration.ofSeconds(timeoutSeconds));
    }

    /**
     * One RemoteStage per configured definition, sealed immediately so a bad
     * declaration stops the application at startup.
     */
    @Bean
    StageRegistry stageRegistry(StageProperties properties, AgentServiceClient client) {
        if (properties.stages().isEmpty()) {
            throw new ConfigurationException("No pipeline stages configured under trendloop.pipeline.stages");
        }
        StageRegistry registry = new StageRegistry();
        for (StageProperties.StageDefinition def : properties.stages()) {
            registry.register(new RemoteStage(def.name(), def.ordinal(),
                    new HashSet<>(def.inputs()), new HashSet<>(def.outputs()), client));
        }
        registry.seal();
        return registry;
    }

    @Bean
    RunLock runLock() {
        return new RunLock();
    }

    @Bean
    LoggingRunReportSink loggingRunReportSink(SnapshotManager snapshots, QuarantineService quarantine) {
        return new LoggingRunReportSink(snapshots, quarantine);
    }

    @Bean
    JpaRunReportSink jpaRunReportSink(RunRepository runRepo) {
        return new JpaRunReportSink(runRepo);
    }

    @Bean
    PipelineOrchestrator pipelineOrchestrator(
            StageRegistry registry,
            SnapshotManager snapshots,
            SafetyPolicy policy,
            @Value("${trendloop.paths.output:docs}") Path outputTree,
            List<RunReportSink> sinks,
            RunLock runLock,
            MeterRegistry meterRegistry,
            Clock clock) {
        return new PipelineOrchestrator(registry, snapshots, policy, outputTree, sinks, runLock, meterRegistry, clock);
    }
}
