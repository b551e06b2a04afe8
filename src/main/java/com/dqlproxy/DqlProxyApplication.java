package com.dqlproxy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the DQL proxy - Grail query jobs reshaped for dashboard tools.
 */
@SpringBootApplication
public class DqlProxyApplication {

    public static void main(String[] args) {
        SpringApplication.run(DqlProxyApplication.class, args);
    }
}
