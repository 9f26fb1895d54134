package com.example.pipeline.shared.config;

import com.example.pipeline.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Set;

/**
 * Enforces the shared API key on the REST surface when authentication is switched on.
 * WebSocket upgrades are checked by the socket handlers themselves so they can
 * answer with a close code instead of an HTTP status.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiKeyAuthFilter implements WebFilter {

    private static final Set<String> OPEN_PATHS = Set.of(
            "/health", "/readiness", "/event-types", "/api/v1/event-types");

    private final AppProperties appProperties;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        String path = request.getPath().pathWithinApplication().value();

        if (!appProperties.getSecurity().isRequireAuth() || !isProtected(path)) {
            return chain.filter(exchange);
        }

        String presented = request.getHeaders().getFirst(Constants.API_KEY_HEADER);
        if (isValidKey(presented)) {
            return chain.filter(exchange);
        }

        log.warn("Rejected request to {} with invalid or missing API key", path);
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        return exchange.getResponse().setComplete();
    }

    public boolean isValidKey(String presented) {
        if (!appProperties.getSecurity().isRequireAuth()) {
            return true;
        }
        String expected = appProperties.getSecurity().getApiKey();
        if (presented == null || presented.isEmpty() || expected == null || expected.isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8));
    }

    private boolean isProtected(String path) {
        if (OPEN_PATHS.contains(path) || path.startsWith("/ws/") || path.startsWith("/actuator")) {
            return false;
        }
        return path.startsWith("/api/") || path.startsWith("/events") || path.startsWith("/stats");
    }
}
