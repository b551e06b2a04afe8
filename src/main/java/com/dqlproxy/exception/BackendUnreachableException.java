package com.dqlproxy.exception;

/**
 * The request never produced an HTTP response: connection refused, reset, response timeout.
 */
public class BackendUnreachableException extends QueryProxyException {

    public BackendUnreachableException(String message, Throwable cause) {
        super(502, "BACKEND_UNREACHABLE", message, cause);
    }
}
