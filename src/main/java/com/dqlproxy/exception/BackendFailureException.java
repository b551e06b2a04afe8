package com.dqlproxy.exception;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

/**
 * Grail reported the job as FAILED. The full poll body is surfaced as diagnostics.
 */
@Getter
public class BackendFailureException extends QueryProxyException {

    private final JsonNode diagnostics;

    public BackendFailureException(JsonNode diagnostics) {
        super(502, "QUERY_FAILED", "Grail reported the query job as FAILED");
        this.diagnostics = diagnostics;
    }

    @Override
    public Object getDetails() {
        return diagnostics;
    }
}
