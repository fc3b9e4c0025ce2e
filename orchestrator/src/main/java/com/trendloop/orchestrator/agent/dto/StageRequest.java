package com.trendloop.orchestrator.agent.dto;

import java.util.Map;

/**
 * Request body for POST /stages/{name} on the agents service.
 * Field names are snake_case to match the service's JSON models.
 */
public record StageRequest(
        String run_id,
        String stage,
        Map<String, Object> context
) {}
