package com.trendloop.orchestrator.stage.impl;

import com.trendloop.orchestrator.agent.AgentServiceClient;
import com.trendloop.orchestrator.agent.AgentServiceException;
import com.trendloop.orchestrator.agent.dto.StageResponse;
import com.trendloop.orchestrator.stage.RunContext;
import com.trendloop.orchestrator.stage.Stage;
import com.trendloop.orchestrator.stage.StageOutcome;
import com.trendloop.orchestrator.stage.StageOutcome.Failure;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A pipeline stage whose work is done by the agents service.
 *
 * Sends the current context, merges the returned outputs back into it, and maps the
 * response onto a {@link StageOutcome}. Every fault on the way (transport, HTTP
 * status, bad JSON, a missing declared output, an attempt to overwrite an upstream
 * key) becomes a {@link Failure}; nothing is thrown to the orchestrator.
 *
 * A declared input that no upstream stage produced is a Failure too, reported without
 * calling the service, so a dead pipeline head drives the failure streak.
 */
public class RemoteStage implements Stage {

    private final String             name;
    private final int                ordinal;
    private final Set<String>        requiredInputs;
    private final Set<String>        producedOutputs;
    private final AgentServiceClient client;

    public RemoteStage(String name,
                       int ordinal,
                       Set<String> requiredInputs,
                       Set<String> producedOutputs,
                       AgentServiceClient client) {
        this.name            = name;
        this.ordinal         = ordinal;
        this.requiredInputs  = Set.copyOf(requiredInputs);
        this.producedOutputs = Set.copyOf(producedOutputs);
        this.client          = client;
    }

    @Override public String      name()            { return name; }
    @Override public int         ordinal()         { return ordinal; }
    @Override public Set<String> requiredInputs()  { return requiredInputs; }
    @Override public Set<String> producedOutputs() { return producedOutputs; }

    @Override
    public StageOutcome execute(RunContext context) {
        Optional<String> missing = requiredInputs.stream()
                .filter(key -> !context.contains(key))
                .sorted()
                .findFirst();
        if (missing.isPresent()) {
            return StageOutcome.failure(Failure.Kind.INVALID_OUTPUT,
                    "missing input '" + missing.get() + "', no upstream stage produced it");
        }

        StageResponse resp;
        try {
            resp = client.runStage(name, context.runId(), context.snapshot());
        } catch (AgentServiceException e) {
            Failure.Kind kind = e.getKind() == AgentServiceException.Kind.TIMEOUT
                    ? Failure.Kind.TIMEOUT
                    : Failure.Kind.EXTERNAL_SERVICE;
            return StageOutcome.failure(kind, e.getMessage());
        } catch (RuntimeException e) {
            return StageOutcome.failure(Failure.Kind.UNHANDLED_EXCEPTION,
                    "Calling the agents service failed: " + e);
        }

        return switch (resp.status().toLowerCase()) {
            case "success" -> accept(resp, context);
            case "skipped" -> StageOutcome.skipped(resp.message());
            case "failure" -> StageOutcome.failure(failureKind(resp.error_type()), resp.message());
            default -> StageOutcome.failure(Failure.Kind.CONTRACT_VIOLATION,
                    "Unknown stage status '" + resp.status() + "'");
        };
    }

    private StageOutcome accept(StageResponse resp, RunContext context) {
        for (String key : producedOutputs) {
            if (resp.outputs().get(key) == null) {
                return StageOutcome.failure(Failure.Kind.INVALID_OUTPUT,
                        "Stage reported success without declared output '" + key + "'");
            }
        }
        try {
            context.putAll(resp.outputs());
        } catch (IllegalStateException | IllegalArgumentException e) {
            return StageOutcome.failure(Failure.Kind.CONTRACT_VIOLATION, e.getMessage());
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("outputs", resp.outputs().keySet());
        if (resp.message() != null && !resp.message().isBlank()) {
            metadata.put("message", resp.message());
        }
        if (!resp.api_calls().isEmpty()) {
            metadata.put(StageOutcome.API_CALLS, resp.api_calls());
        }
        return StageOutcome.success(metadata);
    }

    private static Failure.Kind failureKind(String errorType) {
        if (errorType == null) return Failure.Kind.EXTERNAL_SERVICE;
        return switch (errorType.toUpperCase()) {
            case "TIMEOUT"        -> Failure.Kind.TIMEOUT;
            case "INVALID_OUTPUT" -> Failure.Kind.INVALID_OUTPUT;
            default               -> Failure.Kind.EXTERNAL_SERVICE;
        };
    }

    @Override
    public String toString() {
        return "RemoteStage{#" + ordinal + " " + name + "}";
    }
}
