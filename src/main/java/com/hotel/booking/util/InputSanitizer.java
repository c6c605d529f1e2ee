package com.hotel.booking.util;

import com.hotel.booking.model.dto.BookingRequest;
import com.hotel.booking.model.entity.GuestInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Injection detection and field sanitization for booking input.
 *
 * Detection runs on the raw values and rejects the request outright;
 * sanitization then normalizes what is left (tags stripped, names and phones
 * reduced to their allowed characters, email lowercased, free text truncated).
 */
public final class InputSanitizer {

    public static final int MAX_TEXT_LENGTH = 500;

    private static final List<Pattern> XSS_PATTERNS = List.of(
            Pattern.compile("<script", Pattern.CASE_INSENSITIVE),
            Pattern.compile("javascript:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("on\\w+\\s*=", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<iframe", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<object", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<embed", Pattern.CASE_INSENSITIVE),
            Pattern.compile("eval\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("expression\\(", Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> SQL_PATTERNS = List.of(
            Pattern.compile("\\b(SELECT|INSERT|UPDATE|DELETE|DROP|CREATE|ALTER|EXEC|EXECUTE)\\b",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("UNION\\s+SELECT", Pattern.CASE_INSENSITIVE),
            Pattern.compile("('|\")\\s*(OR|AND)\\s*('|\")", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(--|#|/\\*)"),
            Pattern.compile("\\bOR\\b\\s+\\d+\\s*=\\s*\\d+", Pattern.CASE_INSENSITIVE));

    private static final Pattern TAGS = Pattern.compile("<[^>]*>");
    private static final Pattern SCRIPT_BLOCK = Pattern.compile(
            "<script\\b[^<]*(?:(?!</script>)<[^<]*)*</script>", Pattern.CASE_INSENSITIVE);
    private static final Pattern EVENT_HANDLERS = Pattern.compile("on\\w+\\s*=\\s*[\"'][^\"']*[\"']",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern JS_PROTOCOL = Pattern.compile("javascript:", Pattern.CASE_INSENSITIVE);
    private static final Pattern EMAIL = Pattern.compile("^[a-z0-9._%+-]+@[a-z0-9.-]+\\.[a-z]{2,}$");
    private static final Pattern WORD_START = Pattern.compile("\\b\\w");

    private InputSanitizer() {
    }

    public static boolean detectXss(String input) {
        return input != null && XSS_PATTERNS.stream().anyMatch(p -> p.matcher(input).find());
    }

    public static boolean detectSqlInjection(String input) {
        return input != null && SQL_PATTERNS.stream().anyMatch(p -> p.matcher(input).find());
    }

    /**
     * Scans every free-form string of the request.
     *
     * @return the reason of the first detected pattern, empty when clean
     */
    public static Optional<String> findInjection(BookingRequest request) {
        return firstInjection(stringFields(request));
    }

    private static Optional<String> firstInjection(List<String> values) {
        for (String value : values) {
            if (detectXss(value)) {
                return Optional.of("XSS pattern detected");
            }
            if (detectSqlInjection(value)) {
                return Optional.of("SQL injection pattern detected");
            }
        }
        return Optional.empty();
    }

    public static Optional<String> findInjection(GuestInfo guest) {
        List<String> values = new ArrayList<>();
        addGuestFields(values, guest);
        return firstInjection(values);
    }

    public static String sanitizeString(String input) {
        if (input == null) {
            return null;
        }
        String sanitized = TAGS.matcher(input).replaceAll("");
        sanitized = SCRIPT_BLOCK.matcher(sanitized).replaceAll("");
        sanitized = EVENT_HANDLERS.matcher(sanitized).replaceAll("");
        sanitized = JS_PROTOCOL.matcher(sanitized).replaceAll("");
        return sanitized.trim();
    }

    /**
     * Lowercased, tag-free address; empty when the result is not a plausible
     * email.
     */
    public static String sanitizeEmail(String email) {
        if (email == null) {
            return null;
        }
        String sanitized = TAGS.matcher(email.trim().toLowerCase(Locale.ROOT)).replaceAll("");
        return EMAIL.matcher(sanitized).matches() ? sanitized : "";
    }

    // Digits, spaces, +, -, ( and ) only
    public static String sanitizePhone(String phone) {
        if (phone == null) {
            return null;
        }
        return TAGS.matcher(phone).replaceAll("").replaceAll("[^\\d\\s+\\-()]", "").trim();
    }

    /**
     * Letters, spaces, hyphens and apostrophes, each word capitalized.
     */
    public static String sanitizeName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = TAGS.matcher(name).replaceAll("").replaceAll("[^a-zA-Z\\s\\-']", "").trim();
        Matcher matcher = WORD_START.matcher(sanitized);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, matcher.group().toUpperCase(Locale.ROOT));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    public static String sanitizeText(String text, int maxLength) {
        if (text == null) {
            return null;
        }
        String sanitized = TAGS.matcher(text).replaceAll("");
        sanitized = SCRIPT_BLOCK.matcher(sanitized).replaceAll("").trim();
        return sanitized.length() > maxLength ? sanitized.substring(0, maxLength) : sanitized;
    }

    public static GuestInfo sanitizeGuestInfo(GuestInfo guest) {
        if (guest == null) {
            return null;
        }
        return GuestInfo.builder()
                .firstName(sanitizeName(guest.getFirstName()))
                .lastName(sanitizeName(guest.getLastName()))
                .email(sanitizeEmail(guest.getEmail()))
                .phone(sanitizePhone(guest.getPhone()))
                .country(sanitizeString(guest.getCountry()))
                .specialRequests(sanitizeText(guest.getSpecialRequests(), MAX_TEXT_LENGTH))
                .arrivalTime(sanitizeString(guest.getArrivalTime()))
                .build();
    }

    public static BookingRequest sanitizeBookingRequest(BookingRequest request) {
        return request.toBuilder()
                .roomId(sanitizeString(request.getRoomId()))
                .guestInfo(sanitizeGuestInfo(request.getGuestInfo()))
                .paymentMethodId(sanitizeString(request.getPaymentMethodId()))
                .specialRequests(sanitizeText(request.getSpecialRequests(), MAX_TEXT_LENGTH))
                .userId(sanitizeString(request.getUserId()))
                .build();
    }

    private static List<String> stringFields(BookingRequest request) {
        List<String> values = new ArrayList<>();
        values.add(request.getRoomId());
        values.add(request.getPaymentMethodId());
        values.add(request.getSpecialRequests());
        values.add(request.getUserId());
        addGuestFields(values, request.getGuestInfo());
        return values;
    }

    private static void addGuestFields(List<String> values, GuestInfo guest) {
        if (guest != null) {
            values.add(guest.getFirstName());
            values.add(guest.getLastName());
            values.add(guest.getEmail());
            values.add(guest.getPhone());
            values.add(guest.getCountry());
            values.add(guest.getSpecialRequests());
            values.add(guest.getArrivalTime());
        }
    }
}
