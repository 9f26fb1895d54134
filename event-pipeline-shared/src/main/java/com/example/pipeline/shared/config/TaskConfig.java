package com.example.pipeline.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class TaskConfig {

    /**
     * Fixed pool of platform threads for blocking JDBC calls issued from WebFlux handlers.
     * Keeps the Netty event loop free while the store is being written or queried.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler jdbcScheduler() {
        int parallelism = 10;
        return Schedulers.newParallel("jdbc-io-", parallelism);
    }
}
