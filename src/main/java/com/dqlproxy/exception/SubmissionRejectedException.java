package com.dqlproxy.exception;

import lombok.Getter;

/**
 * Grail refused to create the query job. Status and body are passed through verbatim.
 */
@Getter
public class SubmissionRejectedException extends QueryProxyException {

    private final String responseBody;

    public SubmissionRejectedException(int status, String responseBody) {
        super(status, "SUBMISSION_REJECTED", "Grail rejected the query job (HTTP " + status + ")");
        this.responseBody = responseBody;
    }

    @Override
    public Object getDetails() {
        return responseBody;
    }
}
