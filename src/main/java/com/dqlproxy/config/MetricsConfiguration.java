package com.dqlproxy.config;

import com.dqlproxy.backend.QueryBackend;
import com.dqlproxy.metrics.ProxyMeterBinder;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Prometheus meter registry backing the {@code /metrics} endpoint.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public PrometheusMeterRegistry prometheusMeterRegistry(QueryBackend backend) {
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        new ProxyMeterBinder(backend).bindTo(registry);
        return registry;
    }
}
