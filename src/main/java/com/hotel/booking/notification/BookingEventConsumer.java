package com.hotel.booking.notification;

import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.util.List;

/**
 * -@Component: Subscribes to the booking lifecycle addresses and logs every
 * event.
 * --WithoutIT: Published notifications would have no consumer in this
 * process.
 * =========
 * -@Slf4j: Logger for the audit trail.
 */
@Component
@Slf4j
public class BookingEventConsumer {

    private static final List<String> ADDRESSES = List.of(
            BookingEvents.CONFIRMED, BookingEvents.MODIFIED, BookingEvents.CANCELLED);

    /**
     * -@Autowired: Vert.x instance from VertxConfig, source of the event bus.
     */
    @Autowired
    private Vertx vertx;

    /**
     * -@PostConstruct: Registers one consumer per address once Vert.x is
     * injected.
     */
    @PostConstruct
    public void registerEventBusConsumers() {
        for (String address : ADDRESSES) {
            vertx.eventBus().<JsonObject>consumer(address, message -> {
                JsonObject payload = message.body();
                log.info("[EventBus] {} booking {} ({}) for {} at {}",
                        address,
                        payload.getString("bookingId"),
                        payload.getString("referenceNumber"),
                        payload.getString("email"),
                        payload.getString("timestamp"));
            });
        }
        log.info("BookingEventConsumer registered to listen on {}", ADDRESSES);
    }
}
