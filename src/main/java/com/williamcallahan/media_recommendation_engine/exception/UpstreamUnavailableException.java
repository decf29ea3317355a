package com.williamcallahan.media_recommendation_engine.exception;

/**
 * Raised when an upstream service could not be reached or kept failing after its retry budget.
 * Always absorbed by the component that owns the unit of work.
 */
public class UpstreamUnavailableException extends RuntimeException {

    private final String upstream;
    private final String operation;

    public UpstreamUnavailableException(String upstream, String operation, String message, Throwable cause) {
        super("[" + upstream + "] " + operation + ": " + message, cause);
        this.upstream = upstream;
        this.operation = operation;
    }

    public UpstreamUnavailableException(String upstream, String operation, String message) {
        this(upstream, operation, message, null);
    }

    public String getUpstream() {
        return upstream;
    }

    public String getOperation() {
        return operation;
    }
}
