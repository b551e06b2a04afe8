package com.dqlproxy.backend;

import com.dqlproxy.config.DqlProxyProperties;
import com.dqlproxy.exception.BackendUnreachableException;
import com.dqlproxy.exception.PollTransportException;
import com.dqlproxy.exception.ProtocolViolationException;
import com.dqlproxy.exception.SubmissionRejectedException;
import com.dqlproxy.model.JobHandle;
import com.dqlproxy.model.PollStatus;
import com.dqlproxy.model.QueryRequest;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dynatrace Grail query backend.
 * Jobs are created with {@code query:execute} and followed with {@code query:poll}.
 */
@Slf4j
@Component
public class GrailQueryBackend implements QueryBackend {

    private static final String JOB_ID_FIELD = "jobId";

    private final WebClient webClient;
    private final DqlProxyProperties.BackendConfig config;

    public GrailQueryBackend(WebClient webClient, DqlProxyProperties properties) {
        this.webClient = webClient;
        this.config = properties.getBackend();

        if (config.getBaseUrl() == null || config.getBaseUrl().isBlank()) {
            log.warn("DT_URL not set");
        }
        if (config.getApiToken() == null || config.getApiToken().isBlank()) {
            log.warn("DT_TOKEN not set");
        }
    }

    @Override
    public String getName() {
        return "grail";
    }

    @Override
    public boolean isConfigured() {
        return config.isConfigured();
    }

    @Override
    public Mono<JobHandle> submit(QueryRequest request) {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("query", request.getQuery());
        payload.put("from", request.getFrom());
        payload.put("to", request.getTo());

        String endpoint = config.normalizedBaseUrl() + config.getExecutePath();
        log.debug("Submitting Grail job to {}: from={}, to={}", endpoint, request.getFrom(), request.getTo());

        return webClient.post()
                .uri(endpoint)
                .header(HttpHeaders.AUTHORIZATION, authorization())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .<JobHandle>exchangeToMono(response -> {
                    if (response.statusCode().isError()) {
                        return response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> Mono.error(
                                        new SubmissionRejectedException(response.statusCode().value(), body)));
                    }
                    return response.bodyToMono(JsonNode.class)
                            .map(this::extractJobHandle)
                            .switchIfEmpty(Mono.error(
                                    new ProtocolViolationException("Grail did not return a jobId")));
                })
                .onErrorMap(WebClientRequestException.class,
                        e -> new BackendUnreachableException("Grail submission failed: " + e.getMessage(), e))
                .doOnSuccess(job -> log.info("Grail job submitted: {}", job));
    }

    @Override
    public Mono<PollStatus> poll(JobHandle job) {
        String endpoint = config.normalizedBaseUrl() + config.getPollPath() + "?" + JOB_ID_FIELD + "={jobId}";

        return webClient.get()
                .uri(endpoint, job.getJobId())
                .header(HttpHeaders.AUTHORIZATION, authorization())
                .accept(MediaType.APPLICATION_JSON)
                .<PollStatus>exchangeToMono(response -> {
                    if (response.statusCode().isError()) {
                        return response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> Mono.error(new PollTransportException(
                                        job.getJobId(), response.statusCode().value(), body)));
                    }
                    return response.bodyToMono(JsonNode.class)
                            .map(PollStatus::of)
                            .switchIfEmpty(Mono.error(new ProtocolViolationException(
                                    "Grail returned an empty poll response for job " + job)));
                })
                .onErrorMap(WebClientRequestException.class,
                        e -> new BackendUnreachableException("Polling job " + job + " failed: " + e.getMessage(), e));
    }

    private JobHandle extractJobHandle(JsonNode body) {
        JsonNode jobId = body.get(JOB_ID_FIELD);
        if (jobId == null || jobId.isNull() || jobId.asText().isEmpty()) {
            throw new ProtocolViolationException("Grail did not return a jobId");
        }
        return new JobHandle(jobId.asText());
    }

    private String authorization() {
        return "Api-Token " + config.getApiToken();
    }
}
