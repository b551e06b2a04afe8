package com.dqlproxy.service;

import com.dqlproxy.backend.QueryBackend;
import com.dqlproxy.cache.CacheKeys;
import com.dqlproxy.cache.TtlCache;
import com.dqlproxy.config.DqlProxyProperties;
import com.dqlproxy.engine.QueryExecutionEngine;
import com.dqlproxy.exception.BackendFailureException;
import com.dqlproxy.exception.BackendNotConfiguredException;
import com.dqlproxy.exception.QueryTimeoutException;
import com.dqlproxy.model.PollOutcome;
import com.dqlproxy.model.QueryRequest;
import com.dqlproxy.model.RawRecordSet;
import com.dqlproxy.model.dto.TableResponse;
import com.dqlproxy.model.dto.TimeseriesResponse;
import com.dqlproxy.shaping.TableShaper;
import com.dqlproxy.shaping.TimeseriesShaper;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Main proxy service that orchestrates cache lookup, Grail execution and shaping.
 *
 * Flow per request:
 * 1. Derive the cache key from the response kind and every parameter that shapes the response
 * 2. Serve from cache if an entry is younger than the caller's TTL
 * 3. Otherwise run the query job, shape the result and store it
 *
 * Only successful responses are cached. Concurrent identical misses each run their own job.
 */
@Slf4j
@Service
public class DqlProxyService {

    private final QueryExecutionEngine engine;
    private final QueryBackend backend;
    private final TableShaper tableShaper;
    private final TimeseriesShaper timeseriesShaper;
    private final TtlCache<Object> cache;
    private final DqlProxyProperties properties;

    public DqlProxyService(QueryExecutionEngine engine,
                           QueryBackend backend,
                           TableShaper tableShaper,
                           TimeseriesShaper timeseriesShaper,
                           TtlCache<Object> cache,
                           DqlProxyProperties properties) {
        this.engine = engine;
        this.backend = backend;
        this.tableShaper = tableShaper;
        this.timeseriesShaper = timeseriesShaper;
        this.cache = cache;
        this.properties = properties;
    }

    /**
     * Run a query and return the final Grail poll body unchanged.
     */
    public Mono<JsonNode> raw(String dql, String from, String to) {
        String key = CacheKeys.derive(CacheKeys.RAW, dql, from, to);
        return cached(key, properties.getCache().getRawTtl(), JsonNode.class,
                () -> run(dql, from, to));
    }

    /**
     * Run a query and flatten its records into a table.
     *
     * @param ttl maximum accepted age of a cached response; null for the configured default
     */
    public Mono<TableResponse> table(String dql, String from, String to, Duration ttl) {
        String key = CacheKeys.derive(CacheKeys.TABLE, dql, from, to);
        return cached(key, ttl, TableResponse.class,
                () -> run(dql, from, to)
                        .map(RawRecordSet::fromPollBody)
                        .map(tableShaper::shape)
                        .map(tableShaper::toResponse));
    }

    /**
     * Run a query and group its records into time series.
     *
     * @param valueField field holding point values
     * @param timeField  field holding timestamps
     * @param labelField field naming the series; null or blank for one series
     * @param ttl        maximum accepted age of a cached response; null for the configured default
     */
    public Mono<TimeseriesResponse> timeseries(String dql, String from, String to,
                                               String valueField, String timeField, String labelField,
                                               Duration ttl) {
        String label = labelField == null || labelField.isBlank() ? null : labelField;
        String key = CacheKeys.derive(CacheKeys.TIMESERIES, dql, from, to,
                valueField, timeField, label == null ? "" : label);
        return cached(key, ttl, TimeseriesResponse.class,
                () -> run(dql, from, to)
                        .map(RawRecordSet::fromPollBody)
                        .map(records -> timeseriesShaper.shape(records, timeField, valueField, label))
                        .map(timeseriesShaper::toResponse));
    }

    /**
     * Clear the response cache.
     */
    public void clearCache() {
        log.info("Clearing response cache ({} entries)", cache.size());
        cache.clear();
    }

    /**
     * Get cache statistics.
     */
    public TtlCache.CacheStats getCacheStats() {
        return cache.getStats();
    }

    private <T> Mono<T> cached(String key, Duration ttl, Class<T> type, Supplier<Mono<T>> loader) {
        Duration maxAge = ttl == null ? properties.getCache().getDefaultTtl() : ttl;
        return Mono.defer(() -> {
            Optional<Object> hit = cache.get(key, maxAge);
            if (hit.isPresent() && type.isInstance(hit.get())) {
                log.info("Cache HIT key={}", abbreviate(key));
                return Mono.just(type.cast(hit.get()));
            }

            log.info("Cache MISS key={} - running query", abbreviate(key));
            return loader.get()
                    .doOnNext(value -> cache.put(key, value));
        });
    }

    /**
     * Execute against Grail and turn every non-success outcome into an error.
     */
    private Mono<JsonNode> run(String dql, String from, String to) {
        if (!backend.isConfigured()) {
            return Mono.error(new BackendNotConfiguredException());
        }
        Duration timeout = properties.getQuery().getTimeout();
        QueryRequest request = QueryRequest.builder()
                .query(dql)
                .from(from)
                .to(to)
                .timeout(timeout)
                .build();

        return engine.execute(request).flatMap(outcome -> toResult(outcome, timeout));
    }

    private static Mono<JsonNode> toResult(PollOutcome outcome, Duration timeout) {
        return switch (outcome.getKind()) {
            case SUCCEEDED -> Mono.just(outcome.getBody());
            case FAILED -> Mono.error(new BackendFailureException(outcome.getBody()));
            case TIMED_OUT -> Mono.error(new QueryTimeoutException(timeout));
        };
    }

    private static String abbreviate(String key) {
        return key.length() > 12 ? key.substring(0, 12) : key;
    }
}
