package com.dqlproxy.controller;

import com.dqlproxy.cache.TtlCache;
import com.dqlproxy.service.DqlProxyService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Cache management controller.
 */
@Slf4j
@RestController
@RequestMapping("/cache")
public class CacheController {

    private final DqlProxyService proxyService;

    public CacheController(DqlProxyService proxyService) {
        this.proxyService = proxyService;
    }

    /**
     * Get cache statistics.
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        TtlCache.CacheStats stats = proxyService.getCacheStats();

        return ResponseEntity.ok(Map.of(
                "entries", stats.getSize(),
                "capacity", stats.getCapacity(),
                "hits", stats.getHits(),
                "misses", stats.getMisses(),
                "expirations", stats.getExpirations(),
                "evictions", stats.getEvictions()
        ));
    }

    /**
     * Clear the response cache.
     */
    @PostMapping("/clear")
    public ResponseEntity<Map<String, String>> clearCache() {
        log.info("Cache clear requested");
        proxyService.clearCache();

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Response cache cleared"
        ));
    }
}
