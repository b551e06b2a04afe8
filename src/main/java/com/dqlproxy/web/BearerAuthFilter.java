package com.dqlproxy.web;

import com.dqlproxy.config.DqlProxyProperties;
import com.dqlproxy.model.dto.ErrorResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Set;

/**
 * Protects the proxy with a shared bearer token when {@code dqlproxy.auth.org-bearer} is set.
 *
 * Missing or malformed Authorization header: 401. Wrong token: 403.
 * Health and metrics stay open so probes and scrapers need no token.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class BearerAuthFilter implements WebFilter {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final Set<String> OPEN_PATHS = Set.of("/health", "/metrics");

    private final DqlProxyProperties.AuthConfig config;
    private final ObjectMapper objectMapper;

    public BearerAuthFilter(DqlProxyProperties properties, ObjectMapper objectMapper) {
        this.config = properties.getAuth();
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (!config.isEnabled() || OPEN_PATHS.contains(exchange.getRequest().getPath().value())) {
            return chain.filter(exchange);
        }

        String header = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            return reject(exchange.getResponse(), HttpStatus.UNAUTHORIZED,
                    "Missing or invalid Authorization header");
        }

        String token = header.substring(BEARER_PREFIX.length()).trim();
        if (!matches(token, config.getOrgBearer())) {
            log.warn("Rejected request to {} with wrong bearer token", exchange.getRequest().getPath());
            return reject(exchange.getResponse(), HttpStatus.FORBIDDEN, "Forbidden");
        }
        return chain.filter(exchange);
    }

    private static boolean matches(String presented, String expected) {
        return MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8));
    }

    private Mono<Void> reject(ServerHttpResponse response, HttpStatus status, String message) {
        response.setStatusCode(status);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        ErrorResponse error = ErrorResponse.builder()
                .code(status.name())
                .message(message)
                .build();
        return response.writeWith(Mono.fromCallable(
                () -> response.bufferFactory().wrap(objectMapper.writeValueAsBytes(error))));
    }
}
