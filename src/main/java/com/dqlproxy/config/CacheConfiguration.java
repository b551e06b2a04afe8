package com.dqlproxy.config;

import com.dqlproxy.cache.TtlCache;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Response cache configuration. One process-wide cache holds raw, table and timeseries
 * responses; keys are namespaced by response kind.
 */
@Slf4j
@Configuration
public class CacheConfiguration {

    private final DqlProxyProperties properties;

    public CacheConfiguration(DqlProxyProperties properties) {
        this.properties = properties;
    }

    @Bean
    public TtlCache<Object> responseCache(MeterRegistry meterRegistry) {
        int maxItems = properties.getCache().getMaxItems();
        log.info("Configured response cache with capacity {}", maxItems);
        return new TtlCache<>(maxItems, Clock.systemUTC(), meterRegistry);
    }
}
