package com.hotel.booking.service;

import com.hotel.booking.cache.CacheStore;
import com.hotel.booking.config.BookingProperties;
import com.hotel.booking.exception.BookingException;
import com.hotel.booking.exception.BookingNotFoundException;
import com.hotel.booking.exception.PaymentException;
import com.hotel.booking.exception.ValidationException;
import com.hotel.booking.model.dto.BookingChanges;
import com.hotel.booking.model.dto.BookingRequest;
import com.hotel.booking.model.dto.CancelBookingRequest;
import com.hotel.booking.model.dto.ModifyBookingRequest;
import com.hotel.booking.model.entity.AvailabilityResponse;
import com.hotel.booking.model.entity.BookingConfirmation;
import com.hotel.booking.model.entity.BookingStatus;
import com.hotel.booking.model.entity.CancellationConfirmation;
import com.hotel.booking.model.entity.GuestInfo;
import com.hotel.booking.model.entity.PricingDetails;
import com.hotel.booking.model.entity.RefundStatus;
import com.hotel.booking.model.entity.RoomOption;
import com.hotel.booking.notification.NotificationService;
import com.hotel.booking.payment.PaymentGateway;
import com.hotel.booking.provider.BookingProviderAdapter;
import com.hotel.booking.provider.HotelCatalog;
import com.hotel.booking.provider.ProviderCircuitBreakers;
import com.hotel.booking.provider.ProviderRegistry;
import com.hotel.booking.ratelimit.OperationClass;
import com.hotel.booking.ratelimit.RateLimiters;
import com.hotel.booking.retry.RetryOptions;
import com.hotel.booking.retry.RetryPolicy;
import com.hotel.booking.util.BookingRequestValidator;
import com.hotel.booking.util.InputSanitizer;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Top-level coordinator of the booking lifecycle.
 *
 * -@Service: Single entry point used by BookingController.
 * --Collaborators are constructor-injected so tests can build isolated
 * instances with their own cache, limiters and ledger
 * =========
 * -@Slf4j: Logs every lifecycle transition and every swallowed side-effect
 * failure.
 *
 * LIFECYCLE:
 * quoting -> reserving -> confirmed, confirmed -> modifying -> confirmed,
 * confirmed -> cancelling -> cancelled. Only confirmed and cancelled are ever
 * stored in the ledger.
 *
 * FAILURE POLICY:
 * - Validation and rate-limit failures fail fast, before any provider call
 * - Provider failures are retried (and guarded by the provider's circuit
 * breaker) before surfacing
 * - Payment failures abort creation/modification with nothing committed;
 * during cancellation they are logged only
 * - Notification failures are always logged only
 */
@Service
@Slf4j
public class BookingOrchestrator {

    static final String DEFAULT_CANCEL_REASON = "Booking cancelled by customer";
    static final String PRICE_DECREASE_REASON = "Booking modification - price decrease";

    private final CacheStore cacheStore;
    private final RateLimiters rateLimiters;
    private final RetryPolicy retryPolicy;
    private final ProviderRegistry providerRegistry;
    private final ProviderCircuitBreakers circuitBreakers;
    private final HotelCatalog hotelCatalog;
    private final BookingLedger ledger;
    private final PricingCalculator pricingCalculator;
    private final CancellationRefundCalculator refundCalculator;
    private final BookingRequestValidator validator;
    private final PaymentGateway paymentGateway;
    private final NotificationService notificationService;
    private final BookingProperties properties;
    private final Clock clock;

    @Autowired
    public BookingOrchestrator(CacheStore cacheStore, RateLimiters rateLimiters, RetryPolicy retryPolicy,
            ProviderRegistry providerRegistry, ProviderCircuitBreakers circuitBreakers, HotelCatalog hotelCatalog,
            BookingLedger ledger, PricingCalculator pricingCalculator,
            CancellationRefundCalculator refundCalculator, BookingRequestValidator validator,
            PaymentGateway paymentGateway, NotificationService notificationService, BookingProperties properties,
            Clock clock) {
        this.cacheStore = cacheStore;
        this.rateLimiters = rateLimiters;
        this.retryPolicy = retryPolicy;
        this.providerRegistry = providerRegistry;
        this.circuitBreakers = circuitBreakers;
        this.hotelCatalog = hotelCatalog;
        this.ledger = ledger;
        this.pricingCalculator = pricingCalculator;
        this.refundCalculator = refundCalculator;
        this.validator = validator;
        this.paymentGateway = paymentGateway;
        this.notificationService = notificationService;
        this.properties = properties;
        this.clock = clock;
    }

    // ---------------------------------------------------------------------
    // Quoting
    // ---------------------------------------------------------------------

    /**
     * Availability for a stay, served from cache while the entry is fresh.
     * Counts against the caller's availability limit on every call.
     */
    public Future<AvailabilityResponse> checkAvailability(String identity, long hotelId, LocalDate checkIn,
            LocalDate checkOut) {
        return guarded(() -> {
            rateLimiters.enforce(OperationClass.AVAILABILITY, identity);
            validator.validateDateOrder(checkIn, checkOut);

            Optional<AvailabilityResponse> cached = cacheStore.getAvailability(hotelId, checkIn, checkOut);
            if (cached.isPresent()) {
                log.debug("Availability cache hit for hotel {} {} -> {}", hotelId, checkIn, checkOut);
                return Future.succeededFuture(cached.get());
            }

            BookingProviderAdapter adapter = providerRegistry.resolve(hotelCatalog.resolve(hotelId));
            log.info("Checking availability for hotel {} {} -> {} via {}", hotelId, checkIn, checkOut,
                    adapter.providerId());
            return retryPolicy.retryWithBackoff(
                    () -> circuitBreakers.execute(adapter.providerId(), "checkAvailability",
                            () -> adapter.checkAvailability(hotelId, checkIn, checkOut)),
                    retryOptions(availabilityAttempts(), "availability for hotel " + hotelId))
                    .map(response -> cacheStore.setAvailability(hotelId, checkIn, checkOut, response).getData());
        });
    }

    /**
     * Price quote for one room, derived from the availability lookup. A room the
     * lookup does not return is a validation error.
     *
     * A cached quote is served when no currency is requested or when it is
     * already shown in the requested currency.
     * <p>
     * Each pricing attempt goes through {@link #checkAvailability}, so every
     * attempt counts against the availability limit and runs its own
     * availability retries. A quote can use up to three availability tokens.
     */
    public Future<PricingDetails> getPricing(String identity, long hotelId, String roomId, LocalDate checkIn,
            LocalDate checkOut, String targetCurrency) {
        return guarded(() -> {
            validator.validateDateOrder(checkIn, checkOut);
            String target = targetCurrency == null || targetCurrency.isBlank() ? null
                    : targetCurrency.toUpperCase(Locale.ROOT);

            Optional<PricingDetails> cached = cacheStore.getPricing(hotelId, roomId, checkIn, checkOut);
            if (cached.isPresent() && (target == null || target.equals(cached.get().getDisplayCurrency()))) {
                log.debug("Pricing cache hit for hotel {} room {}", hotelId, roomId);
                return Future.succeededFuture(cached.get());
            }

            return retryPolicy.retryWithBackoff(
                    () -> checkAvailability(identity, hotelId, checkIn, checkOut)
                            .map(availability -> quote(availability, roomId, checkIn, checkOut)),
                    retryOptions(properties.getRetry().getPricing(), "pricing for hotel " + hotelId))
                    .map(pricing -> pricingCalculator.convert(pricing, target))
                    .map(pricing -> {
                        cacheStore.setPricing(hotelId, roomId, checkIn, checkOut, pricing);
                        return pricing;
                    });
        });
    }

    // ---------------------------------------------------------------------
    // Reserving
    // ---------------------------------------------------------------------

    public Future<BookingConfirmation> createBooking(String identity, BookingRequest request) {
        return guarded(() -> {
            rateLimiters.enforce(OperationClass.BOOKING, identity);

            Optional<String> injection = InputSanitizer.findInjection(request);
            if (injection.isPresent()) {
                log.warn("Rejected booking request from {}: {}", identity, injection.get());
                return Future.failedFuture(new ValidationException("Invalid input detected: " + injection.get()));
            }

            BookingRequest sanitized = InputSanitizer.sanitizeBookingRequest(request);
            if (sanitized.getUserId() == null) {
                sanitized.setUserId(identity);
            }
            validator.validate(sanitized);

            long hotelId = sanitized.getHotelId();
            BookingProviderAdapter adapter = providerRegistry.resolve(hotelCatalog.resolve(hotelId));
            log.info("Creating booking for hotel {} room {} via {}", hotelId, sanitized.getRoomId(),
                    adapter.providerId());

            return retryPolicy.retryWithBackoff(
                    () -> circuitBreakers.execute(adapter.providerId(), "createReservation",
                            () -> adapter.createReservation(sanitized)),
                    retryOptions(properties.getRetry().getReservation(), "booking for hotel " + hotelId))
                    .map(created -> {
                        cacheStore.invalidateHotel(hotelId);
                        BookingConfirmation booking = created.toBuilder()
                                .status(BookingStatus.CONFIRMED)
                                .ownerId(identity)
                                .paymentIntentId(sanitized.getPaymentMethodId())
                                .build();
                        ledger.save(booking);
                        log.info("Booking {} confirmed for {}", booking.getBookingId(), identity);
                        notifySafely("booking confirmation " + booking.getBookingId(),
                                () -> notificationService.sendBookingConfirmation(booking, guestEmail(booking)));
                        return booking;
                    });
        });
    }

    public Future<BookingConfirmation> getBooking(String bookingId) {
        return guarded(() -> Future.succeededFuture(load(bookingId)));
    }

    public Future<List<BookingConfirmation>> getUserBookings(String identity) {
        return guarded(() -> Future.succeededFuture(ledger.findByOwner(identity)));
    }

    // ---------------------------------------------------------------------
    // Modifying
    // ---------------------------------------------------------------------

    /**
     * Changes dates, room or guest details of a confirmed booking.
     *
     * SEQUENCE:
     * - price increase: charge the difference, then commit with the provider;
     * a provider failure refunds the captured difference
     * - price decrease: commit with the provider, then refund the difference;
     * a failed refund (error or failed status) reverts the provider change, a
     * pending refund is accepted
     * - any abort leaves the ledger entry untouched
     */
    public Future<BookingConfirmation> modifyBooking(String identity, String bookingId,
            ModifyBookingRequest command) {
        return guarded(() -> {
            rateLimiters.enforce(OperationClass.MODIFICATION, identity);

            BookingChanges changes = command == null ? null : command.getChanges();
            if (changes == null || changes.isEmpty()) {
                throw new ValidationException("No changes requested");
            }
            BookingConfirmation existing = load(bookingId);
            if (existing.isCancelled()) {
                throw new ValidationException("Booking " + bookingId + " is cancelled");
            }

            BookingChanges effective = sanitize(changes);
            LocalDate checkIn = effective.getCheckInDate() != null ? effective.getCheckInDate()
                    : existing.getCheckInDate();
            LocalDate checkOut = effective.getCheckOutDate() != null ? effective.getCheckOutDate()
                    : existing.getCheckOutDate();
            String roomId = effective.getRoomId() != null ? effective.getRoomId() : existing.getRoomDetails().getId();
            boolean stayChanged = !checkIn.equals(existing.getCheckInDate())
                    || !checkOut.equals(existing.getCheckOutDate())
                    || !roomId.equals(existing.getRoomDetails().getId());
            if (stayChanged) {
                validator.validateStay(checkIn, checkOut);
            }

            long hotelId = existing.getHotel().getId();
            BookingProviderAdapter adapter = providerRegistry.resolve(existing.getHotel());

            Future<PricingDetails> newPricing = stayChanged
                    ? lookupAvailability(adapter, hotelId, checkIn, checkOut)
                            .map(availability -> quote(availability, roomId, checkIn, checkOut))
                    : Future.succeededFuture(existing.getPricing());

            return newPricing.compose(pricing -> {
                BigDecimal difference = pricing.getTotal()
                        .subtract(existing.getPricing().getTotal())
                        .add(properties.getModificationFee());
                log.info("Modifying booking {}: total {} -> {} (difference {})", bookingId,
                        existing.getPricing().getTotal(), pricing.getTotal(), difference);

                Future<BookingConfirmation> committed;
                if (difference.signum() > 0) {
                    committed = chargeThenCommit(identity, existing, effective, adapter, difference, command);
                } else if (difference.signum() < 0) {
                    committed = commitThenRefund(existing, effective, adapter, difference.negate(), command);
                } else {
                    committed = commitModification(adapter, bookingId, effective);
                }

                return committed.map(modified -> {
                    BookingConfirmation updated = modified.toBuilder()
                            .pricing(pricing)
                            .status(BookingStatus.CONFIRMED)
                            .ownerId(existing.getOwnerId())
                            .paymentIntentId(existing.getPaymentIntentId())
                            .createdAt(existing.getCreatedAt())
                            .updatedAt(clock.instant())
                            .build();
                    ledger.save(updated);
                    cacheStore.invalidateHotel(hotelId);
                    log.info("Booking {} modified", bookingId);
                    notifySafely("modification confirmation " + bookingId,
                            () -> notificationService.sendModificationConfirmation(updated, guestEmail(updated)));
                    return updated;
                });
            });
        });
    }

    private Future<BookingConfirmation> chargeThenCommit(String identity, BookingConfirmation existing,
            BookingChanges changes, BookingProviderAdapter adapter, BigDecimal difference,
            ModifyBookingRequest command) {
        String paymentMethodId = command.getPaymentMethodId();
        if (paymentMethodId == null || paymentMethodId.isBlank()) {
            return Future.failedFuture(new ValidationException("Payment method is required for a price increase"));
        }
        long amount = PricingCalculator.toMinorUnits(difference);
        String currency = existing.getPricing().getCurrency().toLowerCase(Locale.ROOT);
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("bookingId", existing.getBookingId());
        metadata.put("type", "modification");
        metadata.put("userId", identity);

        return paymentGateway.createPaymentIntent(amount, currency, metadata)
                .compose(intent -> paymentGateway.confirmPayment(intent.getId(), paymentMethodId)
                        .compose(confirmation -> {
                            if (!confirmation.isSucceeded()) {
                                return Future.failedFuture(new PaymentException("Payment failed for booking "
                                        + existing.getBookingId() + ": " + confirmation.getStatus().getValue()));
                            }
                            log.info("Charged {} {} for booking {}", amount, currency, existing.getBookingId());
                            return Future.succeededFuture(intent.getId());
                        }))
                .recover(error -> Future.failedFuture(asPaymentException(error)))
                .compose(intentId -> commitModification(adapter, existing.getBookingId(), changes)
                        .recover(providerError -> {
                            log.error("Provider rejected modification of {} after payment {}, refunding",
                                    existing.getBookingId(), intentId);
                            refundSafely(intentId, amount, "Booking modification failed");
                            return Future.failedFuture(providerError);
                        }));
    }

    private Future<BookingConfirmation> commitThenRefund(BookingConfirmation existing, BookingChanges changes,
            BookingProviderAdapter adapter, BigDecimal refund, ModifyBookingRequest command) {
        String intentId = command.getPaymentIntentId() != null ? command.getPaymentIntentId()
                : existing.getPaymentIntentId();
        if (intentId == null || intentId.isBlank()) {
            return Future.failedFuture(
                    new ValidationException("Payment reference is required to refund a price decrease"));
        }
        long amount = PricingCalculator.toMinorUnits(refund);

        return commitModification(adapter, existing.getBookingId(), changes)
                .compose(modified -> paymentGateway.processRefund(intentId, amount, PRICE_DECREASE_REASON)
                        .compose(refundConfirmation -> {
                            if (refundConfirmation.getStatus() == RefundStatus.FAILED) {
                                return Future.<BookingConfirmation>failedFuture(new PaymentException(
                                        "Refund failed for booking " + existing.getBookingId()));
                            }
                            log.info("Refunded {} on {} for booking {} ({})", amount, intentId,
                                    existing.getBookingId(), refundConfirmation.getStatus());
                            return Future.succeededFuture(modified);
                        })
                        .recover(refundError -> {
                            log.error("Refund for booking {} failed, reverting provider change",
                                    existing.getBookingId(), refundError);
                            return revert(adapter, existing)
                                    .transform(ignored -> Future.<BookingConfirmation>failedFuture(
                                            asPaymentException(refundError)));
                        }));
    }

    private Future<BookingConfirmation> commitModification(BookingProviderAdapter adapter, String bookingId,
            BookingChanges changes) {
        return retryPolicy.retryWithBackoff(
                () -> circuitBreakers.execute(adapter.providerId(), "modifyReservation",
                        () -> adapter.modifyReservation(bookingId, changes)),
                retryOptions(properties.getRetry().getReservation(), "modification of " + bookingId));
    }

    // Best effort: restores the stay the ledger still holds
    private Future<BookingConfirmation> revert(BookingProviderAdapter adapter, BookingConfirmation original) {
        BookingChanges restore = BookingChanges.builder()
                .checkInDate(original.getCheckInDate())
                .checkOutDate(original.getCheckOutDate())
                .roomId(original.getRoomDetails().getId())
                .guestInfo(original.getGuestInfo())
                .build();
        return commitModification(adapter, original.getBookingId(), restore)
                .onFailure(error -> log.error("Could not revert booking {} at provider {}: {}",
                        original.getBookingId(), adapter.providerId(), error.getMessage()));
    }

    // ---------------------------------------------------------------------
    // Cancelling
    // ---------------------------------------------------------------------

    /**
     * Cancels with the provider, then refunds per the hotel's policy. Refund and
     * notification failures never fail the cancellation.
     */
    public Future<CancellationConfirmation> cancelBooking(String identity, String bookingId,
            CancelBookingRequest command) {
        return guarded(() -> {
            rateLimiters.enforce(OperationClass.CANCELLATION, identity);

            BookingConfirmation existing = load(bookingId);
            if (existing.isCancelled()) {
                throw new ValidationException("Booking " + bookingId + " is already cancelled");
            }
            String reason = command != null && command.getReason() != null && !command.getReason().isBlank()
                    ? InputSanitizer.sanitizeText(command.getReason(), InputSanitizer.MAX_TEXT_LENGTH)
                    : DEFAULT_CANCEL_REASON;
            String intentId = command != null && command.getPaymentIntentId() != null
                    ? command.getPaymentIntentId()
                    : existing.getPaymentIntentId();

            BookingProviderAdapter adapter = providerRegistry.resolve(existing.getHotel());
            log.info("Cancelling booking {} via {}", bookingId, adapter.providerId());

            return retryPolicy.retryWithBackoff(
                    () -> circuitBreakers.execute(adapter.providerId(), "cancelReservation",
                            () -> adapter.cancelReservation(bookingId)),
                    retryOptions(properties.getRetry().getReservation(), "cancellation of " + bookingId))
                    .compose(cancellation -> {
                        RefundQuote quote = refundCalculator.calculate(existing);
                        log.info("Booking {} cancelled {} day(s) before check-in, refund {}% = {}", bookingId,
                                quote.getDaysUntilCheckIn(), quote.getRefundPercentage(), quote.getAmount());
                        return refundOnCancel(bookingId, intentId, quote, reason)
                                .map(refundStatus -> finishCancellation(existing, cancellation, quote,
                                        refundStatus, reason));
                    });
        });
    }

    private Future<RefundStatus> refundOnCancel(String bookingId, String intentId, RefundQuote quote,
            String reason) {
        if (!quote.isOwed()) {
            return Future.succeededFuture(RefundStatus.SUCCEEDED);
        }
        if (intentId == null || intentId.isBlank()) {
            log.warn("Refund of {} owed for booking {} but no payment reference, left pending",
                    quote.getAmount(), bookingId);
            return Future.succeededFuture(RefundStatus.PENDING);
        }
        Future<RefundStatus> refund;
        try {
            refund = paymentGateway.processRefund(intentId, PricingCalculator.toMinorUnits(quote.getAmount()), reason)
                    .map(confirmation -> confirmation.getStatus() == null ? RefundStatus.PENDING
                            : confirmation.getStatus());
        } catch (RuntimeException e) {
            refund = Future.failedFuture(e);
        }
        return refund.recover(error -> {
            log.error("Refund for cancelled booking {} failed, needs reconciliation: {}", bookingId,
                    error.getMessage());
            return Future.succeededFuture(RefundStatus.FAILED);
        });
    }

    private CancellationConfirmation finishCancellation(BookingConfirmation existing,
            CancellationConfirmation providerResult, RefundQuote quote, RefundStatus refundStatus, String reason) {
        BookingConfirmation cancelled = existing.toBuilder()
                .status(BookingStatus.CANCELLED)
                .updatedAt(clock.instant())
                .build();
        ledger.save(cancelled);
        cacheStore.invalidateHotel(existing.getHotel().getId());
        notifySafely("cancellation confirmation " + existing.getBookingId(),
                () -> notificationService.sendCancellationConfirmation(cancelled, quote.getAmount(),
                        guestEmail(cancelled)));

        return CancellationConfirmation.builder()
                .bookingId(existing.getBookingId())
                .referenceNumber(existing.getReferenceNumber())
                .cancelledAt(providerResult != null && providerResult.getCancelledAt() != null
                        ? providerResult.getCancelledAt()
                        : clock.instant())
                .refundPercentage(quote.getRefundPercentage())
                .refundAmount(quote.getAmount())
                .refundCurrency(existing.getPricing().getCurrency())
                .refundStatus(refundStatus)
                .reason(reason)
                .build();
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    // Availability for an internal recomputation: cache-aware, not rate limited
    private Future<AvailabilityResponse> lookupAvailability(BookingProviderAdapter adapter, long hotelId,
            LocalDate checkIn, LocalDate checkOut) {
        Optional<AvailabilityResponse> cached = cacheStore.getAvailability(hotelId, checkIn, checkOut);
        if (cached.isPresent()) {
            return Future.succeededFuture(cached.get());
        }
        return retryPolicy.retryWithBackoff(
                () -> circuitBreakers.execute(adapter.providerId(), "checkAvailability",
                        () -> adapter.checkAvailability(hotelId, checkIn, checkOut)),
                retryOptions(availabilityAttempts(), "availability for hotel " + hotelId))
                .map(response -> cacheStore.setAvailability(hotelId, checkIn, checkOut, response).getData());
    }

    private PricingDetails quote(AvailabilityResponse availability, String roomId, LocalDate checkIn,
            LocalDate checkOut) {
        RoomOption room = availability.findRoom(roomId)
                .orElseThrow(() -> new ValidationException("Room not found"));
        return pricingCalculator.calculate(room.getBasePrice(), checkIn, checkOut);
    }

    private BookingConfirmation load(String bookingId) {
        return ledger.find(bookingId).orElseThrow(() -> new BookingNotFoundException(bookingId));
    }

    private BookingChanges sanitize(BookingChanges changes) {
        if (InputSanitizer.detectXss(changes.getRoomId()) || InputSanitizer.detectSqlInjection(changes.getRoomId())) {
            throw new ValidationException("Invalid input detected: room id");
        }
        GuestInfo guest = null;
        if (changes.getGuestInfo() != null) {
            Optional<String> injection = InputSanitizer.findInjection(changes.getGuestInfo());
            if (injection.isPresent()) {
                throw new ValidationException("Invalid input detected: " + injection.get());
            }
            guest = InputSanitizer.sanitizeGuestInfo(changes.getGuestInfo());
        }
        return changes.toBuilder()
                .roomId(InputSanitizer.sanitizeString(changes.getRoomId()))
                .guestInfo(guest)
                .build();
    }

    private BookingProperties.Attempts availabilityAttempts() {
        BookingProperties.Retry retry = properties.getRetry();
        return retry.isSlowNetwork() ? retry.getSlowNetworkAvailability() : retry.getAvailability();
    }

    private RetryOptions retryOptions(BookingProperties.Attempts attempts, String what) {
        BookingProperties.Retry retry = properties.getRetry();
        return RetryOptions.builder()
                .maxRetries(attempts.getMaxRetries())
                .initialDelayMs(attempts.getInitialDelay().toMillis())
                .maxDelayMs(retry.getMaxDelay() == null ? null : retry.getMaxDelay().toMillis())
                .jitter(retry.isJitter())
                .shouldRetry((error, attempt) -> isRetryable(error))
                .onRetry((error, retryNumber, delay) -> log.warn("Retrying {} (retry {}, in {}ms): {}",
                        what, retryNumber, delay, error.getMessage()))
                .build();
    }

    static boolean isRetryable(Throwable error) {
        if (error instanceof BookingException) {
            return ((BookingException) error).isRetryable();
        }
        return true;
    }

    private static PaymentException asPaymentException(Throwable error) {
        if (error instanceof PaymentException) {
            return (PaymentException) error;
        }
        return new PaymentException("Payment failed: " + error.getMessage(), error);
    }

    private void refundSafely(String intentId, long amount, String reason) {
        notifySafely("refund of " + intentId, () -> paymentGateway.processRefund(intentId, amount, reason).mapEmpty());
    }

    private void notifySafely(String what, Supplier<Future<Void>> sideEffect) {
        try {
            sideEffect.get().onFailure(error -> log.warn("Side effect {} failed: {}", what, error.getMessage()));
        } catch (RuntimeException e) {
            log.warn("Side effect {} failed: {}", what, e.getMessage());
        }
    }

    private static String guestEmail(BookingConfirmation booking) {
        return booking.getGuestInfo() == null ? null : booking.getGuestInfo().getEmail();
    }

    /**
     * Turns synchronous throws (rate limit, validation) into a failed Future.
     */
    private static <T> Future<T> guarded(Supplier<Future<T>> body) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
    }
}
