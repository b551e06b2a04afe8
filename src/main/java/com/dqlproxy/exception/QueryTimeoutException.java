package com.dqlproxy.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * The job was still pending when the execution timeout ran out.
 */
@Getter
public class QueryTimeoutException extends QueryProxyException {

    private final Duration timeout;

    public QueryTimeoutException(Duration timeout) {
        super(504, "QUERY_TIMEOUT", "Grail timeout after " + timeout.toMillis() + " ms");
        this.timeout = timeout;
    }
}
