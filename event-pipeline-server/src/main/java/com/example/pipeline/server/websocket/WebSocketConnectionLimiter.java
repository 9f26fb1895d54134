package com.example.pipeline.server.websocket;

import com.example.pipeline.shared.config.AppProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counts open WebSocket connections per client address across both socket endpoints.
 */
@Component
@Slf4j
public class WebSocketConnectionLimiter {

    private final Map<String, Integer> connections = new ConcurrentHashMap<>();
    private final int maxPerIp;

    @Autowired
    public WebSocketConnectionLimiter(AppProperties appProperties) {
        this(appProperties.getWebsocket().getMaxConnectionsPerIp());
    }

    WebSocketConnectionLimiter(int maxPerIp) {
        this.maxPerIp = maxPerIp;
    }

    /**
     * @return false, without counting the connection, when the address is at its limit
     */
    public boolean tryAcquire(String clientIp) {
        boolean[] acquired = new boolean[1];
        connections.compute(clientIp, (ip, current) -> {
            int count = current == null ? 0 : current;
            if (count >= maxPerIp) {
                return current;
            }
            acquired[0] = true;
            return count + 1;
        });
        if (!acquired[0]) {
            log.warn("Too many WebSocket connections from {} (max {})", clientIp, maxPerIp);
        }
        return acquired[0];
    }

    public void release(String clientIp) {
        connections.computeIfPresent(clientIp, (ip, current) -> current <= 1 ? null : current - 1);
    }

    public int activeConnections(String clientIp) {
        return connections.getOrDefault(clientIp, 0);
    }
}
