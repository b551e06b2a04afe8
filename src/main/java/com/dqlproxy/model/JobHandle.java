package com.dqlproxy.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Identifier Grail assigns to a submitted query job.
 */
@Value
public class JobHandle {

    @NonNull
    String jobId;

    @Override
    public String toString() {
        return jobId;
    }
}
