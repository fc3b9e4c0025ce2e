package com.trendloop.orchestrator.agent;

/**
 * Thrown when the agents service is unreachable, times out, or answers with
 * something other than a well-formed stage response.
 */
public class AgentServiceException extends RuntimeException {

    public enum Kind { UNREACHABLE, TIMEOUT, HTTP_ERROR, BAD_RESPONSE }

    private final Kind kind;

    public AgentServiceException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AgentServiceException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
