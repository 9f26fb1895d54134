package com.example.pipeline.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import reactor.core.publisher.Hooks;

/**
 * Event pipeline service: validated ingestion into a durable event log, live fan-out to
 * WebSocket subscribers through the in-memory router, and history queries over REST.
 */
@SpringBootApplication(scanBasePackages = "com.example.pipeline")
public class EventPipelineApplication {

    static {
        // carry the MDC correlation id across Reactor scheduler hops
        Hooks.enableAutomaticContextPropagation();
    }

    public static void main(String[] args) {
        SpringApplication.run(EventPipelineApplication.class, args);
    }
}
