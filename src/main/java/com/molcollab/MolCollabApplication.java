package com.molcollab;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.reactive.ReactiveUserDetailsServiceAutoConfiguration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the molecular collaboration server.
 * <p>
 * Provides room-based real-time collaboration over WebSocket (Spring WebFlux on Netty), session
 * recording, and deterministic replay of recorded sessions over REST. Users are authenticated
 * by JWT; no local user store is configured.
 */
@SpringBootApplication(exclude = ReactiveUserDetailsServiceAutoConfiguration.class)
@EnableScheduling
public class MolCollabApplication {

    public static void main(String[] args) {
        SpringApplication.run(MolCollabApplication.class, args);
    }
}
