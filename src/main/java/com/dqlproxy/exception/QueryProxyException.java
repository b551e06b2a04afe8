package com.dqlproxy.exception;

import lombok.Getter;

/**
 * Base class for every error the proxy reports to its clients.
 * Carries the HTTP status the client should see and a stable error code.
 */
@Getter
public abstract class QueryProxyException extends RuntimeException {

    private final int status;
    private final String code;

    protected QueryProxyException(int status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    protected QueryProxyException(int status, String code, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.code = code;
    }

    /**
     * Extra payload for the error response, e.g. the backend's body. Null when none.
     */
    public Object getDetails() {
        return null;
    }
}
