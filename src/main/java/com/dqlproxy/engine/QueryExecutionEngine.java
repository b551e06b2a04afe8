package com.dqlproxy.engine;

import com.dqlproxy.backend.QueryBackend;
import com.dqlproxy.config.DqlProxyProperties;
import com.dqlproxy.model.JobHandle;
import com.dqlproxy.model.PollOutcome;
import com.dqlproxy.model.PollStatus;
import com.dqlproxy.model.QueryRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs one query as a backend job: submit, then poll until the job succeeds, fails,
 * or the timeout runs out.
 *
 * Flow:
 * 1. Submit the job (errors here are surfaced as-is, never retried)
 * 2. Poll; SUCCEEDED and FAILED end the loop immediately
 * 3. Any other status: give up if the timeout has passed, otherwise wait and poll again
 *
 * The wait doubles after every pending poll, from the initial backoff up to the maximum,
 * and never resets within one execution. Waiting is a timer on the scheduler, so no thread
 * is held while a job runs. Cancelling the returned Mono stops the loop.
 */
@Slf4j
@Service
public class QueryExecutionEngine {

    private final QueryBackend backend;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final Supplier<Scheduler> schedulerSupplier;

    @Autowired
    public QueryExecutionEngine(QueryBackend backend, DqlProxyProperties properties) {
        this(backend,
                properties.getQuery().getInitialBackoff(),
                properties.getQuery().getMaxBackoff(),
                Schedulers::parallel);
    }

    QueryExecutionEngine(QueryBackend backend,
                         Duration initialBackoff,
                         Duration maxBackoff,
                         Supplier<Scheduler> schedulerSupplier) {
        if (initialBackoff.isNegative() || initialBackoff.isZero()) {
            throw new IllegalArgumentException("initialBackoff must be positive");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must not be shorter than initialBackoff");
        }
        this.backend = backend;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.schedulerSupplier = schedulerSupplier;
    }

    /**
     * Execute a query to a terminal outcome.
     *
     * @param request query, range and timeout
     * @return SUCCEEDED with the final poll body, FAILED with the diagnostics, or TIMED_OUT.
     *         Submission and transport problems are error signals, not outcomes.
     */
    public Mono<PollOutcome> execute(QueryRequest request) {
        return Mono.defer(() -> {
            // Scheduler resolved per subscription so virtual time can be swapped in
            Scheduler scheduler = schedulerSupplier.get();
            Execution execution = new Execution(request, scheduler, scheduler.now(TimeUnit.MILLISECONDS));

            return backend.submit(request)
                    .flatMap(job -> pollLoop(execution, job, initialBackoff))
                    .doOnNext(outcome -> log.info("Grail job finished: outcome={}, polls={}, elapsed={}ms",
                            outcome.getKind(), outcome.getPollCount(), outcome.getElapsed().toMillis()))
                    .doOnCancel(() -> log.debug("Query execution cancelled after {} polls", execution.polls));
        });
    }

    private Mono<PollOutcome> pollLoop(Execution execution, JobHandle job, Duration backoff) {
        return Mono.defer(() -> {
            execution.polls++;
            return backend.poll(job);
        }).flatMap(status -> {
            Duration elapsed = execution.elapsed();

            if (status.isSucceeded()) {
                return Mono.just(PollOutcome.succeeded(status.getBody(), elapsed, execution.polls));
            }
            if (status.isFailed()) {
                log.warn("Grail job {} FAILED after {} polls", job, execution.polls);
                return Mono.just(PollOutcome.failed(status.getBody(), elapsed, execution.polls));
            }
            if (elapsed.compareTo(execution.request.getTimeout()) > 0) {
                log.warn("Grail job {} still {} after {}ms, giving up", job, statusLabel(status), elapsed.toMillis());
                return Mono.just(PollOutcome.timedOut(elapsed, execution.polls));
            }

            log.debug("Grail job {} is {} (poll {}), next poll in {}ms",
                    job, statusLabel(status), execution.polls, backoff.toMillis());

            return Mono.delay(backoff, execution.scheduler)
                    .then(pollLoop(execution, job, nextBackoff(backoff)));
        });
    }

    Duration nextBackoff(Duration current) {
        Duration doubled = current.multipliedBy(2);
        return doubled.compareTo(maxBackoff) > 0 ? maxBackoff : doubled;
    }

    private static String statusLabel(PollStatus status) {
        return status.getStatus() == null ? "<no status>" : status.getStatus();
    }

    /**
     * Mutable state of one execution, confined to its own subscription.
     */
    private static final class Execution {
        private final QueryRequest request;
        private final Scheduler scheduler;
        private final long startedAtMs;
        private int polls;

        private Execution(QueryRequest request, Scheduler scheduler, long startedAtMs) {
            this.request = request;
            this.scheduler = scheduler;
            this.startedAtMs = startedAtMs;
        }

        private Duration elapsed() {
            return Duration.ofMillis(scheduler.now(TimeUnit.MILLISECONDS) - startedAtMs);
        }
    }
}
