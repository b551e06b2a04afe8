package com.dqlproxy.metrics;

import com.dqlproxy.backend.QueryBackend;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;

/**
 * Process-level gauges: liveness and whether the query backend is configured.
 * Cache meters are registered by the cache itself.
 */
public class ProxyMeterBinder implements MeterBinder {

    private final QueryBackend backend;

    public ProxyMeterBinder(QueryBackend backend) {
        this.backend = backend;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("dql.proxy.up", () -> 1)
                .description("1 if proxy is running")
                .register(registry);

        Gauge.builder("dql.proxy.backend.configured", backend, b -> b.isConfigured() ? 1 : 0)
                .description("1 if DT_URL and DT_TOKEN are set")
                .strongReference(true)
                .register(registry);
    }
}
