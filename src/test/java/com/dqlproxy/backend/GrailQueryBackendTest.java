package com.dqlproxy.backend;

import com.dqlproxy.config.DqlProxyProperties;
import com.dqlproxy.exception.BackendUnreachableException;
import com.dqlproxy.exception.PollTransportException;
import com.dqlproxy.exception.ProtocolViolationException;
import com.dqlproxy.exception.SubmissionRejectedException;
import com.dqlproxy.model.JobHandle;
import com.dqlproxy.model.QueryRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GrailQueryBackend against a stubbed exchange function.
 */
class GrailQueryBackendTest {

    private DqlProxyProperties properties;
    private List<ClientRequest> requests;
    private Mono<ClientResponse> nextResponse;

    @BeforeEach
    void setUp() {
        properties = new DqlProxyProperties();
        properties.getBackend().setBaseUrl("https://tenant.example.com/");
        properties.getBackend().setApiToken("dt0c01.secret");
        requests = new ArrayList<>();
    }

    private GrailQueryBackend backend() {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    return nextResponse;
                })
                .build();
        return new GrailQueryBackend(webClient, properties);
    }

    private void respond(HttpStatus status, String json) {
        nextResponse = Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(json)
                .build());
    }

    private static QueryRequest request() {
        return QueryRequest.builder()
                .query("fetch logs")
                .from("now()-2h")
                .to("now()")
                .timeout(Duration.ofSeconds(30))
                .build();
    }

    @Test
    void testSubmitPostsToExecuteEndpoint() {
        respond(HttpStatus.ACCEPTED, "{\"jobId\":\"abc-123\",\"state\":\"RUNNING\"}");

        StepVerifier.create(backend().submit(request()))
                .expectNext(new JobHandle("abc-123"))
                .verifyComplete();

        ClientRequest sent = requests.get(0);
        assertEquals(HttpMethod.POST, sent.method());
        assertEquals("https://tenant.example.com/api/v2/query:execute", sent.url().toString());
        assertEquals("Api-Token dt0c01.secret", sent.headers().getFirst(HttpHeaders.AUTHORIZATION));
        assertEquals(MediaType.APPLICATION_JSON, sent.headers().getContentType());
    }

    @Test
    void testSubmitErrorStatusIsPassedThrough() {
        respond(HttpStatus.BAD_REQUEST, "{\"error\":{\"message\":\"PARSE_ERROR\"}}");

        StepVerifier.create(backend().submit(request()))
                .expectErrorSatisfies(error -> {
                    SubmissionRejectedException rejected = assertInstanceOf(SubmissionRejectedException.class, error);
                    assertEquals(400, rejected.getStatus());
                    assertTrue(rejected.getResponseBody().contains("PARSE_ERROR"));
                })
                .verify();
    }

    @Test
    void testSubmitWithoutJobIdIsProtocolViolation() {
        respond(HttpStatus.OK, "{\"state\":\"RUNNING\"}");

        StepVerifier.create(backend().submit(request()))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(ProtocolViolationException.class, error);
                    assertEquals("Grail did not return a jobId", error.getMessage());
                })
                .verify();
    }

    @Test
    void testSubmitWithEmptyJobIdIsProtocolViolation() {
        respond(HttpStatus.OK, "{\"jobId\":\"\"}");

        StepVerifier.create(backend().submit(request()))
                .expectError(ProtocolViolationException.class)
                .verify();
    }

    @Test
    void testSubmitConnectionFailureIsUnreachable() {
        nextResponse = Mono.error(new WebClientRequestException(new ConnectException("Connection refused"),
                HttpMethod.POST, URI.create("https://tenant.example.com"), new HttpHeaders()));

        StepVerifier.create(backend().submit(request()))
                .expectErrorSatisfies(error -> {
                    BackendUnreachableException unreachable = assertInstanceOf(BackendUnreachableException.class, error);
                    assertEquals(502, unreachable.getStatus());
                    assertInstanceOf(WebClientRequestException.class, unreachable.getCause());
                })
                .verify();
    }

    @Test
    void testPollSendsJobIdAsQueryParameter() {
        respond(HttpStatus.OK, "{\"state\":\"RUNNING\",\"status\":\"RUNNING\"}");

        StepVerifier.create(backend().poll(new JobHandle("abc-123")))
                .assertNext(status -> {
                    assertEquals("RUNNING", status.getStatus());
                    assertTrue(status.isPending());
                })
                .verifyComplete();

        ClientRequest sent = requests.get(0);
        assertEquals(HttpMethod.GET, sent.method());
        assertEquals("https://tenant.example.com/api/v2/query:poll?jobId=abc-123", sent.url().toString());
        assertEquals("Api-Token dt0c01.secret", sent.headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void testPollKeepsWholeBody() {
        respond(HttpStatus.OK, "{\"status\":\"SUCCEEDED\",\"result\":{\"records\":[{\"a\":1}]}}");

        StepVerifier.create(backend().poll(new JobHandle("abc-123")))
                .assertNext(status -> {
                    assertTrue(status.isSucceeded());
                    assertEquals(1, status.getBody().path("result").path("records").get(0).path("a").asInt());
                })
                .verifyComplete();
    }

    @Test
    void testPollWithoutStatusIsPending() {
        respond(HttpStatus.OK, "{\"progress\":42}");

        StepVerifier.create(backend().poll(new JobHandle("abc-123")))
                .assertNext(status -> {
                    assertNull(status.getStatus());
                    assertTrue(status.isPending());
                })
                .verifyComplete();
    }

    @Test
    void testPollErrorStatusIsTransportError() {
        respond(HttpStatus.SERVICE_UNAVAILABLE, "{\"error\":\"busy\"}");

        StepVerifier.create(backend().poll(new JobHandle("abc-123")))
                .expectErrorSatisfies(error -> {
                    PollTransportException failed = assertInstanceOf(PollTransportException.class, error);
                    assertEquals(503, failed.getStatus());
                    assertEquals("abc-123", failed.getJobId());
                })
                .verify();
    }

    @Test
    void testConfiguredRequiresUrlAndToken() {
        assertTrue(backend().isConfigured());

        properties.getBackend().setApiToken("");
        assertFalse(backend().isConfigured());

        properties.getBackend().setApiToken("dt0c01.secret");
        properties.getBackend().setBaseUrl(" ");
        assertFalse(backend().isConfigured());
    }
}
