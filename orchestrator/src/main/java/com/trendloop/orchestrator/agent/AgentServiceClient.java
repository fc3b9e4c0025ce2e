package com.trendloop.orchestrator.agent;

import com.trendloop.orchestrator.agent.dto.StageRequest;
import com.trendloop.orchestrator.agent.dto.StageResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * HTTP client for the agents service that hosts the content producers
 * (trend analysis, writer, image generation, distribution, translation).
 *
 * One endpoint: POST /stages/{name}. Uses java.net.http.HttpClient with Jackson so we
 * keep explicit control over headers and timeouts.
 *
 * Called from the orchestrator thread, so blocking I/O here is expected. The request
 * timeout is the only bound on a single stage call; the orchestrator does not
 * interrupt a stage itself.
 */
public class AgentServiceClient {

    private static final Logger log = LoggerFactory.getLogger(AgentServiceClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     requestTimeout;

    public AgentServiceClient(String baseUrl, ObjectMapper objectMapper, Duration requestTimeout) {
        this(HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .connectTimeout(Duration.ofSeconds(10))
                        .build(),
                baseUrl, objectMapper, requestTimeout);
    }

    AgentServiceClient(HttpClient http, String baseUrl, ObjectMapper objectMapper, Duration requestTimeout) {
        this.http           = http;
        this.baseUrl        = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.json           = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Ask the agents service to run one stage.
     *
     * @param context read-only copy of the run context; the service never sees the live map
     * @throws AgentServiceException on transport errors, non-2xx answers or unparseable bodies
     */
    public StageResponse runStage(String stageName, UUID runId, Map<String, Object> context) {
        String opName = "runStage " + stageName;
        String body = toJson(new StageRequest(runId.toString(), stageName, context));
        log.debug("POST /stages/{} (context keys={})", stageName, context.keySet());

        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/stages/" + stageName))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new AgentServiceException(AgentServiceException.Kind.TIMEOUT,
                    opName + " timed out after " + requestTimeout.toSeconds() + "s", e);
        } catch (IOException e) {
            throw new AgentServiceException(AgentServiceException.Kind.UNREACHABLE,
                    opName + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentServiceException(AgentServiceException.Kind.UNREACHABLE,
                    opName + " interrupted", e);
        }

        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new AgentServiceException(AgentServiceException.Kind.HTTP_ERROR,
                    opName + " failed, HTTP " + resp.statusCode() + ": " + resp.body());
        }
        try {
            StageResponse parsed = json.readValue(resp.body(), StageResponse.class);
            if (parsed.status() == null) {
                throw new AgentServiceException(AgentServiceException.Kind.BAD_RESPONSE,
                        opName + " returned no status");
            }
            return parsed;
        } catch (JsonProcessingException e) {
            throw new AgentServiceException(AgentServiceException.Kind.BAD_RESPONSE,
                    "Failed to parse " + opName + " response", e);
        }
    }

    /** Serialize obj to JSON string; throws AgentServiceException on failure. */
    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new AgentServiceException(AgentServiceException.Kind.BAD_RESPONSE,
                    "JSON serialization failed", e);
        }
    }
}
