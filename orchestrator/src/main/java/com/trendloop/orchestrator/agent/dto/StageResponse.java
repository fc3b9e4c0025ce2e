package com.trendloop.orchestrator.agent.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Response from POST /stages/{name}.
 *
 * status is one of "success" | "failure" | "skipped". outputs carries the artifacts
 * the stage produced ("article_path", "image_path", ...) and is merged into the run
 * context on success. api_calls counts the third-party calls the stage made, per
 * service ("gemini", "twitter_write", ...).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StageResponse(
        String status,
        Map<String, Object> outputs,
        String message,
        String error_type,   // "TIMEOUT" | "INVALID_OUTPUT" | null
        Map<String, Integer> api_calls
) {
    @JsonCreator
    public StageResponse {
        outputs   = outputs   == null ? Map.of() : outputs;
        api_calls = api_calls == null ? Map.of() : api_calls;
    }

    public StageResponse(String status, Map<String, Object> outputs, String message, String error_type) {
        this(status, outputs, message, error_type, Map.of());
    }
}
