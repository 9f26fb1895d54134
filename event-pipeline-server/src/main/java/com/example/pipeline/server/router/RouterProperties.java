package com.example.pipeline.server.router;

import com.example.pipeline.shared.config.AppProperties;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Construction-time capacities of an {@link EventRouter}.
 */
@Value
@Builder
public class RouterProperties {
    @Builder.Default
    int maxQueueSize = 10_000;
    @Builder.Default
    int maxSubscribers = 5_000;
    @Builder.Default
    Duration shutdownTimeout = Duration.ofSeconds(5);

    public static RouterProperties from(AppProperties.Router router) {
        return RouterProperties.builder()
                .maxQueueSize(router.getMaxQueueSize())
                .maxSubscribers(router.getMaxSubscribers())
                .shutdownTimeout(router.getShutdownTimeout())
                .build();
    }
}
