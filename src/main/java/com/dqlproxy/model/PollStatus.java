package com.dqlproxy.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.NonNull;
import lombok.Value;

/**
 * One response of the Grail poll endpoint.
 */
@Value
public class PollStatus {

    public static final String SUCCEEDED = "SUCCEEDED";
    public static final String FAILED = "FAILED";

    /**
     * Raw status string; null when the backend omitted it.
     */
    String status;

    @NonNull
    JsonNode body;

    public static PollStatus of(JsonNode body) {
        JsonNode status = body.path("status");
        return new PollStatus(status.isTextual() ? status.asText() : null, body);
    }

    public boolean isSucceeded() {
        return SUCCEEDED.equals(status);
    }

    public boolean isFailed() {
        return FAILED.equals(status);
    }

    /**
     * Anything that is not terminal keeps the job in the polling loop.
     */
    public boolean isPending() {
        return !isSucceeded() && !isFailed();
    }
}
