package com.dqlproxy.backend;

import com.dqlproxy.model.JobHandle;
import com.dqlproxy.model.PollStatus;
import com.dqlproxy.model.QueryRequest;
import reactor.core.publisher.Mono;

/**
 * Interface for asynchronous job-based query backends.
 * Implementations handle authentication, endpoint layout and error mapping.
 */
public interface QueryBackend {

    /**
     * Get backend name (e.g., "grail").
     *
     * @return backend name
     */
    String getName();

    /**
     * Check if the backend is configured and can accept jobs.
     *
     * @return true if ready to use
     */
    boolean isConfigured();

    /**
     * Create a query job.
     *
     * @param request query and time range
     * @return handle of the created job; errors with
     *         {@link com.dqlproxy.exception.SubmissionRejectedException} or
     *         {@link com.dqlproxy.exception.ProtocolViolationException}
     */
    Mono<JobHandle> submit(QueryRequest request);

    /**
     * Fetch the current status of a job once.
     *
     * @param job handle returned by {@link #submit}
     * @return poll response; errors with {@link com.dqlproxy.exception.PollTransportException}
     */
    Mono<PollStatus> poll(JobHandle job);
}
