package com.example.pipeline.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.server.WebFilter;
import reactor.core.publisher.Mono;

@Slf4j
@Configuration
public class LoggingConfig {

    /**
     * Request/response logging for WebFlux, active at DEBUG level only.
     */
    @Bean
    public WebFilter loggingFilter() {
        return (exchange, chain) -> {
            long startTime = System.currentTimeMillis();
            String path = exchange.getRequest().getURI().getPath();
            String method = exchange.getRequest().getMethod().name();

            if (log.isDebugEnabled()) {
                log.debug("Incoming request: {} {} from {}",
                        method, path, exchange.getRequest().getRemoteAddress());
            }

            return chain.filter(exchange)
                    .then(Mono.fromRunnable(() -> {
                        if (log.isDebugEnabled()) {
                            long duration = System.currentTimeMillis() - startTime;
                            log.debug("Outgoing response: {} {} - {} in {}ms",
                                    method, path, exchange.getResponse().getStatusCode(), duration);
                        }
                    }));
        };
    }
}
