package com.dqlproxy.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Duration;

/**
 * Terminal result of one execution: exactly one of succeeded, failed or timed out.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PollOutcome {

    public enum Kind {
        SUCCEEDED,
        FAILED,
        TIMED_OUT
    }

    Kind kind;

    /**
     * Poll body for SUCCEEDED (the result) and FAILED (the diagnostics); null for TIMED_OUT.
     */
    JsonNode body;

    /**
     * Wall-clock time from submission until the outcome was reached.
     */
    Duration elapsed;

    int pollCount;

    public static PollOutcome succeeded(JsonNode payload, Duration elapsed, int pollCount) {
        return new PollOutcome(Kind.SUCCEEDED, payload, elapsed, pollCount);
    }

    public static PollOutcome failed(JsonNode details, Duration elapsed, int pollCount) {
        return new PollOutcome(Kind.FAILED, details, elapsed, pollCount);
    }

    public static PollOutcome timedOut(Duration elapsed, int pollCount) {
        return new PollOutcome(Kind.TIMED_OUT, null, elapsed, pollCount);
    }

    public boolean isSucceeded() {
        return kind == Kind.SUCCEEDED;
    }
}
