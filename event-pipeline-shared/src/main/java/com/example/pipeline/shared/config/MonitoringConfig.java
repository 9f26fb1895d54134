package com.example.pipeline.shared.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Metrics plumbing shared by the monitoring aspect and the services.
 */
@Configuration
@EnableAspectJAutoProxy
public class MonitoringConfig {

    @Bean
    public PipelineMetricsCollector pipelineMetricsCollector(MeterRegistry registry) {
        return new PipelineMetricsCollector(registry);
    }

    /**
     * Caches meters by name and tags so hot paths do not go through the registry lookup each time.
     */
    public static class PipelineMetricsCollector {
        private final MeterRegistry registry;
        private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();

        public PipelineMetricsCollector(MeterRegistry registry) {
            this.registry = registry;
        }

        public void incrementCounter(String name, String... tags) {
            String key = name + "_" + String.join("_", tags);
            counters.computeIfAbsent(key, k -> registry.counter(name, tags)).increment();
        }

        public void recordTimer(String name, long duration, String... tags) {
            String key = name + "_" + String.join("_", tags);
            timers.computeIfAbsent(key, k ->
                            Timer.builder(name).tags(tags).register(registry))
                    .record(duration, TimeUnit.MILLISECONDS);
        }

        public long getCounterValue(String name, String... tags) {
            String key = name + "_" + String.join("_", tags);
            Counter counter = counters.get(key);
            return counter != null ? (long) counter.count() : 0;
        }
    }
}
