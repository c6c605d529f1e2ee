package com.hotel.booking.config;

import com.hotel.booking.cache.CacheStore;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

/**
 * -@Component: Periodic sweep of expired cache entries on a Vert.x timer.
 * --Reads still check expiry lazily; the sweep only bounds memory
 * --WithoutIT: Entries that are never read again would stay in memory until
 * restart.
 */
@Component
@Slf4j
public class CacheMaintenance {

    @Autowired
    private Vertx vertx;

    @Autowired
    private CacheStore cacheStore;

    @Autowired
    private BookingProperties properties;

    private Long timerId;

    /**
     * -@PostConstruct: Starts the periodic timer once dependencies are injected.
     */
    @PostConstruct
    public void start() {
        long interval = properties.getCache().getCleanupInterval().toMillis();
        timerId = vertx.setPeriodic(interval, id -> sweep());
        log.info("Cache cleanup scheduled every {}ms", interval);
    }

    public int sweep() {
        int removed = cacheStore.cleanExpired();
        if (removed > 0) {
            log.debug("Cache cleanup removed {} expired entries", removed);
        }
        return removed;
    }

    @PreDestroy
    public void stop() {
        if (timerId != null) {
            vertx.cancelTimer(timerId);
        }
    }
}
