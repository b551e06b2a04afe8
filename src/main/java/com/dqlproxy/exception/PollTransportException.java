package com.dqlproxy.exception;

import lombok.Getter;

/**
 * A poll request returned an HTTP error. Not retried.
 */
@Getter
public class PollTransportException extends QueryProxyException {

    private final String jobId;
    private final String responseBody;

    public PollTransportException(String jobId, int status, String responseBody) {
        super(status, "POLL_FAILED", "Polling job " + jobId + " failed (HTTP " + status + ")");
        this.jobId = jobId;
        this.responseBody = responseBody;
    }

    @Override
    public Object getDetails() {
        return responseBody;
    }
}
