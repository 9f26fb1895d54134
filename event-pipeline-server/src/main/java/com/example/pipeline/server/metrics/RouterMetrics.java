package com.example.pipeline.server.metrics;

import com.example.pipeline.server.router.EventRouter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Exports live router load and delivery counters to Prometheus.
 */
@Component
@RequiredArgsConstructor
public class RouterMetrics implements MeterBinder {

    private final EventRouter eventRouter;

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("pipeline.router.subscribers", eventRouter, router -> router.getStats().getActiveSubscribers())
            .description("Number of live subscriptions in the router.")
            .register(registry);
        Gauge.builder("pipeline.router.queue.size", eventRouter, router -> router.getStats().getQueueSize())
            .description("Events waiting for the dispatch loop.")
            .register(registry);

        FunctionCounter.builder("pipeline.router.events.published", eventRouter, EventRouter::getPublishedCount)
            .description("Events accepted into the router queue.")
            .register(registry);
        FunctionCounter.builder("pipeline.router.events.rejected", eventRouter, EventRouter::getRejectedCount)
            .description("Events rejected because the router queue was full.")
            .register(registry);
        FunctionCounter.builder("pipeline.router.deliveries", eventRouter, EventRouter::getDeliveredCount)
            .description("Successful deliveries to subscribers.")
            .register(registry);
        FunctionCounter.builder("pipeline.router.deliveries.failed", eventRouter, EventRouter::getFailedDeliveryCount)
            .description("Deliveries that failed and removed the subscriber.")
            .register(registry);
    }
}
