package com.hotel.booking.config;

import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.eventbus.EventBus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * -@Configuration: Marks this class as a Spring configuration class.
 * --Indicates this class contains [@Bean] definitions for the Spring container
 * --WithoutIT: Spring won't recognize this as a configuration class;
 * -[@Bean] methods won't be processed, and Vert.x beans won't be available for
 * injection.
 */
@Configuration
@Slf4j
public class VertxConfig {

    @Value("${vertx.worker-pool-size:20}")
    private int workerPoolSize;

    @Value("${vertx.event-loop-pool-size:2}")
    private int eventLoopPoolSize;

    /**
     * -@Bean: Declares the Vert.x instance managed by Spring.
     * --Used as a library, not deployed as verticles: Spring owns the lifecycle
     * and injects Vert.x into the retry policy, the notification service and the
     * cache maintenance timer
     * --destroyMethod: closes event loops and timers on context shutdown
     * --WithoutIT: Services trying to [@Autowire] Vertx will fail at startup.
     */
    @Bean(destroyMethod = "close")
    public Vertx vertx() {
        VertxOptions options = new VertxOptions()
                .setWorkerPoolSize(workerPoolSize)
                .setEventLoopPoolSize(eventLoopPoolSize);
        log.info("Starting Vert.x with {} event loops and {} workers", eventLoopPoolSize, workerPoolSize);
        return Vertx.vertx(options);
    }

    /**
     * -@Bean: Provides Vert.x EventBus as a Spring bean.
     * --Carries booking lifecycle events (booking.confirmed, booking.modified,
     * booking.cancelled)
     */
    @Bean
    public EventBus eventBus(Vertx vertx) {
        return vertx.eventBus();
    }
}
