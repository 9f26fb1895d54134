package com.example.pipeline.server.config;

import com.example.pipeline.server.router.EventRouter;
import com.example.pipeline.server.router.RouterProperties;
import com.example.pipeline.shared.config.AppProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PipelineConfig {

    /**
     * The one router of this process. Capacities are read once here and cannot change
     * while it runs.
     */
    @Bean(initMethod = "start", destroyMethod = "stop")
    public EventRouter eventRouter(AppProperties appProperties) {
        return new EventRouter(RouterProperties.from(appProperties.getRouter()));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
