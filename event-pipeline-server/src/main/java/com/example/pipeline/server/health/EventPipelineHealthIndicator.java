package com.example.pipeline.server.health;

import com.example.pipeline.server.router.EventRouter;
import com.example.pipeline.shared.dto.RouterStats;
import com.example.pipeline.shared.repository.EventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Actuator view of the pipeline: event store reachability and router load.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EventPipelineHealthIndicator implements HealthIndicator {

    private final EventRouter eventRouter;
    private final EventRepository eventRepository;

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();

        boolean storeHealthy = checkEventStore(details);
        boolean routerHealthy = checkRouter(details);

        Health.Builder builder = storeHealthy && routerHealthy ? Health.up() : Health.down();
        return builder.withDetails(details).build();
    }

    private boolean checkEventStore(Map<String, Object> details) {
        try {
            boolean up = eventRepository.ping();
            details.put("eventStore", up ? "UP" : "DOWN");
            return up;
        } catch (Exception e) {
            log.warn("Event store health check failed: {}", e.getMessage());
            details.put("eventStore", "DOWN");
            details.put("eventStoreError", e.getMessage());
            return false;
        }
    }

    private boolean checkRouter(Map<String, Object> details) {
        RouterStats stats = eventRouter.getStats();
        int maxQueueSize = eventRouter.getProperties().getMaxQueueSize();
        details.put("router", eventRouter.isRunning() ? "RUNNING" : "STOPPED");
        details.put("activeSubscribers", stats.getActiveSubscribers());
        details.put("maxSubscribers", eventRouter.getProperties().getMaxSubscribers());
        details.put("queueSize", stats.getQueueSize());
        details.put("maxQueueSize", maxQueueSize);
        return eventRouter.isRunning();
    }
}
