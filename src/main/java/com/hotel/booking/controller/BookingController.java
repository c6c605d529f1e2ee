package com.hotel.booking.controller;

import com.hotel.booking.exception.BookingNotFoundException;
import com.hotel.booking.exception.PaymentException;
import com.hotel.booking.exception.ProviderException;
import com.hotel.booking.exception.RateLimitException;
import com.hotel.booking.exception.ValidationException;
import com.hotel.booking.model.dto.BookingRequest;
import com.hotel.booking.model.dto.CancelBookingRequest;
import com.hotel.booking.model.dto.ModifyBookingRequest;
import com.hotel.booking.ratelimit.RateLimitResult;
import com.hotel.booking.ratelimit.RateLimiters;
import com.hotel.booking.service.BookingOrchestrator;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * -@RestController: Combines [@Controller] and [@ResponseBody]
 * --Serializes return values to JSON
 * --WithoutIT: This class won't handle HTTP requests;
 * all API endpoints would return 404 Not Found.
 * =========
 * -@RequestMapping("/api/bookings"): Common prefix of every booking endpoint
 * =========
 * -@Validated: Enables [@Pattern] / [@Min] checks on request parameters
 * --If validation fails, throws ConstraintViolationException (handled
 * by [@ExceptionHandler])
 * =========
 * -@Slf4j: Lombok annotation that generates a SLF4J Logger field
 *
 * IDENTITY:
 * The caller identity used for rate limiting and booking ownership comes from
 * the X-Caller-Id header (authenticated user id or server-issued session
 * token).
 *
 * STATUS MAPPING:
 * ValidationException 400, BookingNotFoundException 404, RateLimitException 429
 * (+ Retry-After and X-RateLimit-* headers), PaymentException 402,
 * ProviderException 503, anything else 500.
 */
@RestController
@RequestMapping("/api/bookings")
@Validated
@Slf4j
public class BookingController {

    static final String CALLER_HEADER = "X-Caller-Id";
    private static final String IDENTITY_PATTERN = "^[A-Za-z0-9_.@:-]{1,64}$";
    private static final String IDENTITY_MESSAGE = "Caller id must be 1-64 characters (letters, digits, _ . @ : -)";

    /**
     * -@Autowired: The orchestration core every endpoint delegates to.
     * --WithoutIT: orchestrator would be null;
     * all API calls would fail with NullPointerException.
     */
    @Autowired
    private BookingOrchestrator orchestrator;

    /**
     * -@Autowired: Limiters, read to render X-RateLimit-* headers on 429
     * responses.
     */
    @Autowired
    private RateLimiters rateLimiters;

    @GetMapping("/availability")
    public CompletableFuture<ResponseEntity<?>> checkAvailability(
            @RequestHeader(value = CALLER_HEADER, defaultValue = "anonymous") @Pattern(regexp = IDENTITY_PATTERN, message = IDENTITY_MESSAGE) String callerId,
            @RequestParam @Min(value = 1, message = "hotelId must be positive") long hotelId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate checkIn,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate checkOut) {
        log.info("Availability request from {} for hotel {} {} -> {}", callerId, hotelId, checkIn, checkOut);
        return respond(orchestrator.checkAvailability(callerId, hotelId, checkIn, checkOut), HttpStatus.OK);
    }

    @GetMapping("/pricing")
    public CompletableFuture<ResponseEntity<?>> getPricing(
            @RequestHeader(value = CALLER_HEADER, defaultValue = "anonymous") @Pattern(regexp = IDENTITY_PATTERN, message = IDENTITY_MESSAGE) String callerId,
            @RequestParam @Min(value = 1, message = "hotelId must be positive") long hotelId,
            @RequestParam @Pattern(regexp = "^[A-Za-z0-9_-]{1,64}$", message = "Invalid room id") String roomId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate checkIn,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate checkOut,
            @RequestParam(required = false) @Pattern(regexp = "^[A-Za-z]{3}$", message = "Currency must be a 3-letter ISO code") String currency) {
        log.info("Pricing request from {} for hotel {} room {} ({})", callerId, hotelId, roomId, currency);
        return respond(orchestrator.getPricing(callerId, hotelId, roomId, checkIn, checkOut, currency),
                HttpStatus.OK);
    }

    @PostMapping
    public CompletableFuture<ResponseEntity<?>> createBooking(
            @RequestHeader(value = CALLER_HEADER, defaultValue = "anonymous") @Pattern(regexp = IDENTITY_PATTERN, message = IDENTITY_MESSAGE) String callerId,
            @RequestBody BookingRequest request) {
        log.info("Booking request from {} for hotel {}", callerId, request.getHotelId());
        return respond(orchestrator.createBooking(callerId, request), HttpStatus.CREATED);
    }

    @GetMapping("/{bookingId}")
    public CompletableFuture<ResponseEntity<?>> getBooking(
            @PathVariable @Pattern(regexp = "^[A-Za-z0-9-]{1,64}$", message = "Invalid booking id") String bookingId) {
        return respond(orchestrator.getBooking(bookingId), HttpStatus.OK);
    }

    @GetMapping
    public CompletableFuture<ResponseEntity<?>> getUserBookings(
            @RequestHeader(value = CALLER_HEADER, defaultValue = "anonymous") @Pattern(regexp = IDENTITY_PATTERN, message = IDENTITY_MESSAGE) String callerId) {
        return respond(orchestrator.getUserBookings(callerId), HttpStatus.OK);
    }

    @PatchMapping("/{bookingId}")
    public CompletableFuture<ResponseEntity<?>> modifyBooking(
            @RequestHeader(value = CALLER_HEADER, defaultValue = "anonymous") @Pattern(regexp = IDENTITY_PATTERN, message = IDENTITY_MESSAGE) String callerId,
            @PathVariable @Pattern(regexp = "^[A-Za-z0-9-]{1,64}$", message = "Invalid booking id") String bookingId,
            @RequestBody ModifyBookingRequest request) {
        log.info("Modification request from {} for booking {}", callerId, bookingId);
        return respond(orchestrator.modifyBooking(callerId, bookingId, request), HttpStatus.OK);
    }

    @PostMapping("/{bookingId}/cancel")
    public CompletableFuture<ResponseEntity<?>> cancelBooking(
            @RequestHeader(value = CALLER_HEADER, defaultValue = "anonymous") @Pattern(regexp = IDENTITY_PATTERN, message = IDENTITY_MESSAGE) String callerId,
            @PathVariable @Pattern(regexp = "^[A-Za-z0-9-]{1,64}$", message = "Invalid booking id") String bookingId,
            @RequestBody(required = false) CancelBookingRequest request) {
        log.info("Cancellation request from {} for booking {}", callerId, bookingId);
        return respond(orchestrator.cancelBooking(callerId, bookingId, request), HttpStatus.OK);
    }

    private <T> CompletableFuture<ResponseEntity<?>> respond(Future<T> result, HttpStatus successStatus) {
        CompletableFuture<ResponseEntity<?>> future = new CompletableFuture<>();
        result.onSuccess(body -> future.complete(ResponseEntity.status(successStatus).body(body)))
                .onFailure(error -> future.complete(toErrorResponse(error)));
        return future;
    }

    ResponseEntity<?> toErrorResponse(Throwable error) {
        if (error instanceof ValidationException) {
            log.warn("Validation failed: {}", error.getMessage());
            Map<String, Object> body = errorBody("Bad Request", error.getMessage());
            body.put("violations", ((ValidationException) error).getViolations());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
        }
        if (error instanceof BookingNotFoundException) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorBody("Not Found", error.getMessage()));
        }
        if (error instanceof RateLimitException) {
            return rateLimited((RateLimitException) error);
        }
        if (error instanceof PaymentException) {
            log.warn("Payment failed: {}", error.getMessage());
            return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED)
                    .body(errorBody("Payment Required", error.getMessage()));
        }
        if (error instanceof ProviderException) {
            log.error("Provider failure: {}", error.getMessage());
            Map<String, Object> body = errorBody("Service Unavailable",
                    "Booking provider temporarily unavailable. Please try again later.");
            body.put("providerId", ((ProviderException) error).getProviderId());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
        log.error("Unexpected booking failure", error);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody("Internal Server Error", "An unexpected error occurred"));
    }

    private ResponseEntity<?> rateLimited(RateLimitException error) {
        RateLimitResult result = RateLimitResult.builder()
                .allowed(false)
                .limit(rateLimiters.get(error.getOperationClass()).getMaxRequests())
                .remaining(0)
                .resetAt(error.getResetAt())
                .retryAfterSeconds(error.getRetryAfterSeconds())
                .build();
        HttpHeaders headers = new HttpHeaders();
        rateLimiters.get(error.getOperationClass()).headers(result).forEach(headers::add);

        Map<String, Object> body = errorBody("Too Many Requests", error.getMessage());
        body.put("retryAfter", error.getRetryAfterSeconds());
        body.put("resetAt", error.getResetAt().toString());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).headers(headers).body(body);
    }

    private static Map<String, Object> errorBody(String error, String message) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", error);
        errorResponse.put("message", message);
        errorResponse.put("timestamp", Instant.now().toString());
        return errorResponse;
    }

    /**
     * -@ExceptionHandler: Invalid header, path or query parameter formats.
     * --Returns HTTP 400 (Bad Request)
     */
    @ExceptionHandler(jakarta.validation.ConstraintViolationException.class)
    public ResponseEntity<?> handleValidationException(jakarta.validation.ConstraintViolationException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorBody("Bad Request", ex.getMessage()));
    }

    @ExceptionHandler({ MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class })
    public ResponseEntity<?> handleMalformedRequest(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorBody("Bad Request", ex.getMessage()));
    }

    /**
     * -@ExceptionHandler(Exception.class): Fallback for anything thrown before an
     * orchestrator Future exists.
     * --Returns HTTP 500 (Internal Server Error)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<?> handleException(Exception ex) {
        log.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody("Internal Server Error", ex.getMessage()));
    }
}
