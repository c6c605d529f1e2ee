package com.hotel.booking.config;

import com.hotel.booking.cache.CacheNamespace;
import org.springframework.cache.CacheManager;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * -@Configuration: Indicates this class contains Spring bean definitions.
 * --WithoutIT: Spring won't process [@Bean] methods;
 * ---CacheStore would have no cache manager to draw its caches from.
 * =========
 * [@EnableCaching] is NOT used in this configuration.
 *
 * Reason: All caching is done programmatically by CacheStore through
 * cacheManager.getCache(), with TTL stamps it checks itself. No Spring cache
 * annotations ([@Cacheable], [@CachePut], [@CacheEvict]) are used.
 */
@Configuration
public class CacheConfig {

    /**
     * -@Bean: In-memory cache manager with a fixed set of caches.
     * --ConcurrentMapCache per namespace; CacheStore walks the native map for
     * prefix invalidation and expiry sweeps
     * --Null values are not cached
     * --No persistence: a restart clears every entry
     * --WithoutIT: CacheStore cannot be created.
     */
    @Bean
    public CacheManager cacheManager() {
        ConcurrentMapCacheManager cacheManager = new ConcurrentMapCacheManager(
                CacheNamespace.AVAILABILITY.getCacheName(), CacheNamespace.PRICING.getCacheName());
        cacheManager.setAllowNullValues(false);
        return cacheManager;
    }
}
