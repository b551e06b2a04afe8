package com.dqlproxy.controller;

import com.dqlproxy.config.DqlProxyProperties;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness and scrape endpoints. Both stay open when proxy authentication is enabled.
 */
@RestController
public class HealthController {

    private final DqlProxyProperties properties;
    private final PrometheusMeterRegistry meterRegistry;

    public HealthController(DqlProxyProperties properties, PrometheusMeterRegistry meterRegistry) {
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> health() {
        String baseUrl = properties.getBackend().getBaseUrl();

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "ok");
        health.put("dt_url_set", baseUrl != null && !baseUrl.isBlank());
        health.put("org_bearer_set", properties.getAuth().isEnabled());
        return health;
    }

    /**
     * Prometheus text exposition of every registered meter.
     */
    @GetMapping(value = "/metrics", produces = MediaType.TEXT_PLAIN_VALUE)
    public String metrics() {
        return meterRegistry.scrape();
    }
}
