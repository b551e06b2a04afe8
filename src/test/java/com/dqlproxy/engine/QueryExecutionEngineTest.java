package com.dqlproxy.engine;

import com.dqlproxy.backend.QueryBackend;
import com.dqlproxy.exception.PollTransportException;
import com.dqlproxy.exception.SubmissionRejectedException;
import com.dqlproxy.model.JobHandle;
import com.dqlproxy.model.PollOutcome;
import com.dqlproxy.model.PollStatus;
import com.dqlproxy.model.QueryRequest;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for QueryExecutionEngine, driven on virtual time.
 */
class QueryExecutionEngineTest {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private VirtualTimeScheduler scheduler;
    private ScriptedBackend backend;
    private QueryExecutionEngine engine;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        backend = new ScriptedBackend(scheduler);
        engine = new QueryExecutionEngine(backend, Duration.ofMillis(250), Duration.ofSeconds(1), () -> scheduler);
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    private static QueryRequest request(Duration timeout) {
        return QueryRequest.builder()
                .query("fetch logs | limit 10")
                .from("now()-1h")
                .to("now()")
                .timeout(timeout)
                .build();
    }

    private static PollStatus status(String status) {
        ObjectNode body = NODES.objectNode();
        if (status != null) {
            body.put("status", status);
        }
        return PollStatus.of(body);
    }

    private static PollStatus succeeded() {
        ObjectNode body = NODES.objectNode().put("status", "SUCCEEDED");
        body.putObject("result").putArray("records").addObject().put("v", 1);
        return PollStatus.of(body);
    }

    @Test
    void testSucceededOnFirstPollHasNoDelay() {
        backend.script(succeeded());

        StepVerifier.create(engine.execute(request(Duration.ofSeconds(30))))
                .assertNext(outcome -> {
                    assertEquals(PollOutcome.Kind.SUCCEEDED, outcome.getKind());
                    assertEquals(1, outcome.getPollCount());
                    assertEquals(Duration.ZERO, outcome.getElapsed());
                    assertEquals(1, outcome.getBody().path("result").path("records").size());
                })
                .verifyComplete();

        assertEquals(List.of(0L), backend.pollTimes);
        assertEquals("fetch logs | limit 10", backend.submitted.get(0).getQuery());
    }

    @Test
    void testBackoffDoublesUpToCapUntilSuccess() {
        backend.script(status("RUNNING"), status("RUNNING"), status("RUNNING"), status("RUNNING"), succeeded());

        StepVerifier.create(engine.execute(request(Duration.ofSeconds(30))))
                .then(() -> scheduler.advanceTimeBy(Duration.ofSeconds(10)))
                .assertNext(outcome -> {
                    assertTrue(outcome.isSucceeded());
                    assertEquals(5, outcome.getPollCount());
                    assertEquals(Duration.ofMillis(2750), outcome.getElapsed());
                })
                .verifyComplete();

        assertEquals(List.of(0L, 250L, 750L, 1750L, 2750L), backend.pollTimes);
    }

    @Test
    void testTimeoutAfterFivePollsForTwoSeconds() {
        backend.pendingForever(status("RUNNING"));

        StepVerifier.create(engine.execute(request(Duration.ofSeconds(2))))
                .then(() -> scheduler.advanceTimeBy(Duration.ofSeconds(10)))
                .assertNext(outcome -> {
                    assertEquals(PollOutcome.Kind.TIMED_OUT, outcome.getKind());
                    assertEquals(5, outcome.getPollCount());
                    assertNull(outcome.getBody());
                    assertTrue(outcome.getElapsed().compareTo(Duration.ofSeconds(2)) > 0);
                })
                .verifyComplete();

        assertEquals(List.of(0L, 250L, 750L, 1750L, 2750L), backend.pollTimes);
    }

    @Test
    void testElapsedEqualToTimeoutStillPolls() {
        // 250 + 500 = 750: the third poll lands exactly on the timeout
        backend.pendingForever(status("RUNNING"));

        StepVerifier.create(engine.execute(request(Duration.ofMillis(750))))
                .then(() -> scheduler.advanceTimeBy(Duration.ofSeconds(10)))
                .assertNext(outcome -> {
                    assertEquals(PollOutcome.Kind.TIMED_OUT, outcome.getKind());
                    assertEquals(4, outcome.getPollCount());
                })
                .verifyComplete();

        assertEquals(List.of(0L, 250L, 750L, 1750L), backend.pollTimes);
    }

    @Test
    void testTimeoutIncludesSubmissionTime() {
        backend.submitDelay = Duration.ofSeconds(3);
        backend.pendingForever(status("RUNNING"));

        StepVerifier.create(engine.execute(request(Duration.ofSeconds(2))))
                .then(() -> scheduler.advanceTimeBy(Duration.ofSeconds(10)))
                .assertNext(outcome -> {
                    assertEquals(PollOutcome.Kind.TIMED_OUT, outcome.getKind());
                    assertEquals(1, outcome.getPollCount());
                    assertEquals(Duration.ofSeconds(3), outcome.getElapsed());
                })
                .verifyComplete();
    }

    @Test
    void testFailedStatusEndsLoopWithDiagnostics() {
        ObjectNode failed = NODES.objectNode().put("status", "FAILED");
        failed.putObject("error").put("message", "syntax error");
        backend.script(status("RUNNING"), PollStatus.of(failed));

        StepVerifier.create(engine.execute(request(Duration.ofSeconds(30))))
                .then(() -> scheduler.advanceTimeBy(Duration.ofSeconds(1)))
                .assertNext(outcome -> {
                    assertEquals(PollOutcome.Kind.FAILED, outcome.getKind());
                    assertEquals(2, outcome.getPollCount());
                    assertEquals("syntax error", outcome.getBody().path("error").path("message").asText());
                })
                .verifyComplete();
    }

    @Test
    void testMissingOrUnknownStatusCountsAsPending() {
        backend.script(status(null), status("QUEUED"), status("succeeded"), succeeded());

        StepVerifier.create(engine.execute(request(Duration.ofSeconds(30))))
                .then(() -> scheduler.advanceTimeBy(Duration.ofSeconds(5)))
                .assertNext(outcome -> {
                    assertTrue(outcome.isSucceeded());
                    assertEquals(4, outcome.getPollCount());
                })
                .verifyComplete();
    }

    @Test
    void testSubmissionErrorIsNotRetried() {
        backend.submitError = new SubmissionRejectedException(400, "{\"error\":\"bad query\"}");

        StepVerifier.create(engine.execute(request(Duration.ofSeconds(30))))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(SubmissionRejectedException.class, error);
                    assertEquals(400, ((SubmissionRejectedException) error).getStatus());
                })
                .verify();

        assertEquals(1, backend.submitted.size());
        assertTrue(backend.pollTimes.isEmpty());
    }

    @Test
    void testPollErrorEndsExecution() {
        backend.script(status("RUNNING"));
        backend.pollError = new PollTransportException("job-1", 503, "unavailable");

        StepVerifier.create(engine.execute(request(Duration.ofSeconds(30))))
                .then(() -> scheduler.advanceTimeBy(Duration.ofSeconds(5)))
                .expectError(PollTransportException.class)
                .verify();

        assertEquals(2, backend.pollTimes.size());
    }

    @Test
    void testCancellationStopsPolling() {
        backend.pendingForever(status("RUNNING"));

        Disposable subscription = engine.execute(request(Duration.ofSeconds(30))).subscribe();
        scheduler.advanceTimeBy(Duration.ofMillis(300));
        assertEquals(2, backend.pollTimes.size());

        subscription.dispose();
        scheduler.advanceTimeBy(Duration.ofSeconds(30));

        assertEquals(2, backend.pollTimes.size());
    }

    @Test
    void testExecuteIsLazy() {
        backend.script(succeeded());

        Mono<PollOutcome> execution = engine.execute(request(Duration.ofSeconds(30)));

        assertTrue(backend.submitted.isEmpty());
        StepVerifier.create(execution).expectNextCount(1).verifyComplete();
        assertEquals(1, backend.submitted.size());
    }

    @Test
    void testNextBackoff() {
        assertEquals(Duration.ofMillis(500), engine.nextBackoff(Duration.ofMillis(250)));
        assertEquals(Duration.ofSeconds(1), engine.nextBackoff(Duration.ofMillis(500)));
        assertEquals(Duration.ofSeconds(1), engine.nextBackoff(Duration.ofMillis(750)));
        assertEquals(Duration.ofSeconds(1), engine.nextBackoff(Duration.ofSeconds(1)));
    }

    @Test
    void testInvalidBackoffSettingsAreRejected() {
        Supplier<Scheduler> schedulers = () -> scheduler;

        assertThrows(IllegalArgumentException.class,
                () -> new QueryExecutionEngine(backend, Duration.ZERO, Duration.ofSeconds(1), schedulers));
        assertThrows(IllegalArgumentException.class,
                () -> new QueryExecutionEngine(backend, Duration.ofSeconds(2), Duration.ofSeconds(1), schedulers));
    }

    /**
     * Backend answering polls from a script and recording virtual poll times.
     */
    private static final class ScriptedBackend implements QueryBackend {

        private final VirtualTimeScheduler clock;
        private final Deque<PollStatus> script = new ArrayDeque<>();
        private final List<QueryRequest> submitted = new ArrayList<>();
        private final List<Long> pollTimes = new ArrayList<>();
        private PollStatus repeated;
        private Duration submitDelay = Duration.ZERO;
        private RuntimeException submitError;
        private RuntimeException pollError;

        private ScriptedBackend(VirtualTimeScheduler clock) {
            this.clock = clock;
        }

        void script(PollStatus... statuses) {
            script.addAll(List.of(statuses));
        }

        void pendingForever(PollStatus status) {
            repeated = status;
        }

        @Override
        public String getName() {
            return "scripted";
        }

        @Override
        public boolean isConfigured() {
            return true;
        }

        @Override
        public Mono<JobHandle> submit(QueryRequest request) {
            submitted.add(request);
            if (submitError != null) {
                return Mono.error(submitError);
            }
            Mono<JobHandle> job = Mono.just(new JobHandle("job-1"));
            return submitDelay.isZero() ? job : job.delayElement(submitDelay, clock);
        }

        @Override
        public Mono<PollStatus> poll(JobHandle job) {
            return Mono.defer(() -> {
                pollTimes.add(clock.now(TimeUnit.MILLISECONDS));
                if (!script.isEmpty()) {
                    return Mono.just(script.poll());
                }
                if (pollError != null) {
                    return Mono.error(pollError);
                }
                return repeated == null ? Mono.<PollStatus>empty() : Mono.just(repeated);
            });
        }
    }
}
