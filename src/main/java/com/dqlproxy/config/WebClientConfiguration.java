package com.dqlproxy.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient for the Grail query API.
 *
 * Poll bodies carry whole result sets, so the in-memory buffer limit is raised well above
 * Spring's 256 KB default. Bodies are decoded with the application's mapper.
 */
@Configuration
public class WebClientConfiguration {

    static final int MAX_RESPONSE_BYTES = 16 * 1024 * 1024;

    private final DqlProxyProperties properties;
    private final ObjectMapper objectMapper;

    public WebClientConfiguration(DqlProxyProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Bean
    public WebClient webClient() {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(properties.getBackend().getResponseTimeout());

        Jackson2JsonDecoder decoder = new Jackson2JsonDecoder(objectMapper);
        decoder.setMaxInMemorySize(MAX_RESPONSE_BYTES);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> {
                    codecs.defaultCodecs().jackson2JsonDecoder(decoder);
                    codecs.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(objectMapper));
                    codecs.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES);
                })
                .build();
    }
}
