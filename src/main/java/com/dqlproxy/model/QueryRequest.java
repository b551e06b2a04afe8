package com.dqlproxy.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;

/**
 * A DQL query bound to a time range, ready to be submitted as a Grail job.
 */
@Value
@Builder
public class QueryRequest {

    /**
     * DQL text, passed through to Grail unvalidated.
     */
    @NonNull
    String query;

    /**
     * Range start in any form Grail accepts, e.g. "now()-1h" or an ISO timestamp.
     */
    @NonNull
    String from;

    @NonNull
    String to;

    /**
     * Upper bound for the whole submit-and-poll sequence.
     */
    @NonNull
    Duration timeout;
}
