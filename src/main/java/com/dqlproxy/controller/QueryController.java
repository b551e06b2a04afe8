package com.dqlproxy.controller;

import com.dqlproxy.model.dto.RawQueryBody;
import com.dqlproxy.model.dto.TableResponse;
import com.dqlproxy.model.dto.TimeseriesResponse;
import com.dqlproxy.service.DqlProxyService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Query endpoints for dashboard data sources.
 * Every endpoint runs the DQL as a Grail job unless a fresh enough response is cached.
 */
@Slf4j
@RestController
public class QueryController {

    private final DqlProxyService proxyService;

    public QueryController(DqlProxyService proxyService) {
        this.proxyService = proxyService;
    }

    /**
     * Raw query - returns the Grail poll body as-is.
     *
     * @param body {dql, from, to}; from defaults to "now()-1h" and to to "now()"
     */
    @PostMapping(value = "/query",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<JsonNode> rawQuery(@RequestBody RawQueryBody body) {
        if (body.getDql() == null || body.getDql().isBlank()) {
            return Mono.error(new IllegalArgumentException("Missing 'dql'"));
        }
        log.info("Raw query: from={}, to={}", body.fromOrDefault(), body.toOrDefault());
        return proxyService.raw(body.getDql(), body.fromOrDefault(), body.toOrDefault());
    }

    /**
     * Table view of the query records.
     *
     * @param ttl maximum age in seconds of a cached response this request accepts (default 30)
     */
    @GetMapping(value = "/table", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<TableResponse> table(
            @RequestParam String dql,
            @RequestParam String from,
            @RequestParam String to,
            @RequestParam(required = false) Long ttl) {

        log.info("Table query: from={}, to={}, ttl={}", from, to, ttl);
        return proxyService.table(dql, from, to, seconds(ttl));
    }

    /**
     * Time series view of the query records.
     *
     * @param value   numeric field name
     * @param timecol time field name
     * @param label   field naming the series (optional)
     * @param ttl     maximum age in seconds of a cached response this request accepts (default 30)
     */
    @GetMapping(value = "/timeseries", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<TimeseriesResponse> timeseries(
            @RequestParam String dql,
            @RequestParam String from,
            @RequestParam String to,
            @RequestParam String value,
            @RequestParam(defaultValue = "timestamp") String timecol,
            @RequestParam(required = false) String label,
            @RequestParam(required = false) Long ttl) {

        log.info("Timeseries query: from={}, to={}, value={}, timecol={}, label={}, ttl={}",
                from, to, value, timecol, label, ttl);
        return proxyService.timeseries(dql, from, to, value, timecol, label, seconds(ttl));
    }

    private static Duration seconds(Long ttl) {
        return ttl == null ? null : Duration.ofSeconds(ttl);
    }
}
