package com.trendloop.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Stage list bound from {@code trendloop.pipeline.stages} in application.yml.
 *
 * Each entry becomes one {@code RemoteStage}. Inputs and outputs are the context keys
 * the stage consumes and produces; the registry checks at startup that every input is
 * produced by an earlier stage.
 */
@ConfigurationProperties(prefix = "trendloop.pipeline")
public record StageProperties(List<StageDefinition> stages) {

    public StageProperties {
        stages = stages == null ? List.of() : List.copyOf(stages);
    }

    public record StageDefinition(String name, int ordinal, List<String> inputs, List<String> outputs) {

        public StageDefinition {
            inputs  = inputs  == null ? List.of() : List.copyOf(inputs);
            outputs = outputs == null ? List.of() : List.copyOf(outputs);
        }
    }
}
