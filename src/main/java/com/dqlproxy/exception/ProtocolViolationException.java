package com.dqlproxy.exception;

/**
 * Grail answered with something the proxy cannot follow, such as a submission without a job id.
 */
public class ProtocolViolationException extends QueryProxyException {

    public ProtocolViolationException(String message) {
        super(502, "PROTOCOL_VIOLATION", message);
    }
}
