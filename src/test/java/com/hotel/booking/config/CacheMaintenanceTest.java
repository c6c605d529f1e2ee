package com.hotel.booking.config;

import com.hotel.booking.cache.CacheStore;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * TestCategory: Unit Test - Periodic cache cleanup
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CacheMaintenanceTest {

    @Mock
    private Vertx vertx;

    @Mock
    private CacheStore cacheStore;

    @Spy
    private BookingProperties properties = new BookingProperties();

    @InjectMocks
    private CacheMaintenance cacheMaintenance;

    /**
     * Input: cleanup interval 30s
     * ExpectedOut: periodic timer every 30000ms whose tick sweeps the cache;
     * stop cancels the same timer
     */
    @Test
    @SuppressWarnings("unchecked")
    void testStart_SchedulesSweep() {
        // Given
        properties.getCache().setCleanupInterval(Duration.ofSeconds(30));
        when(vertx.setPeriodic(anyLong(), any(Handler.class))).thenReturn(7L);
        when(cacheStore.cleanExpired()).thenReturn(3);

        // When
        cacheMaintenance.start();
        ArgumentCaptor<Handler<Long>> tick = ArgumentCaptor.forClass(Handler.class);
        verify(vertx).setPeriodic(eq(30_000L), tick.capture());
        tick.getValue().handle(7L);
        cacheMaintenance.stop();

        // Then
        verify(cacheStore).cleanExpired();
        verify(vertx).cancelTimer(7L);
    }

    @Test
    void testSweep_ReturnsRemovedCount() {
        when(cacheStore.cleanExpired()).thenReturn(0);

        assertEquals(0, cacheMaintenance.sweep());
    }

    @Test
    void testStop_WithoutStartIsNoOp() {
        cacheMaintenance.stop();

        verify(vertx, never()).cancelTimer(anyLong());
    }
}
