package com.hotel.booking.util;

import com.hotel.booking.model.dto.BookingRequest;
import com.hotel.booking.model.entity.GuestInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TestCategory: Unit Test - Injection detection and input cleaning
 */
class InputSanitizerTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "<script>alert(1)</script>",
            "JAVASCRIPT:alert(1)",
            "<img src=x onerror=alert(1)>",
            "<iframe src='evil'>",
            "eval(document.cookie)"
    })
    void testDetectXss_Positive(String input) {
        assertTrue(InputSanitizer.detectXss(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Robert'); DROP TABLE bookings;--",
            "1 UNION SELECT password FROM users",
            "' OR '1'='1",
            "x OR 1=1",
            "comment /* hidden"
    })
    void testDetectSqlInjection_Positive(String input) {
        assertTrue(InputSanitizer.detectSqlInjection(input));
    }

    @Test
    void testDetect_CleanInput() {
        assertFalse(InputSanitizer.detectXss("Late arrival, around 22:00 please"));
        assertFalse(InputSanitizer.detectSqlInjection("Late arrival, around 22:00 please"));
        assertFalse(InputSanitizer.detectXss(null));
        assertFalse(InputSanitizer.detectSqlInjection(null));
    }

    /**
     * Input: request whose guest last name carries a script tag
     * ExpectedOut: "XSS pattern detected"
     */
    @Test
    void testFindInjection_ScansGuestFields() {
        BookingRequest request = BookingRequest.builder()
                .roomId("room-1-1")
                .guestInfo(GuestInfo.builder().firstName("Ada").lastName("<script>x</script>").build())
                .build();

        assertEquals(Optional.of("XSS pattern detected"), InputSanitizer.findInjection(request));
        assertEquals(Optional.of("SQL injection pattern detected"), InputSanitizer.findInjection(
                GuestInfo.builder().email("a@b.com' OR '1'='1").build()));
        assertTrue(InputSanitizer.findInjection(GuestInfo.builder().firstName("Ada").build()).isEmpty());
    }

    @Test
    void testSanitizeString_StripsMarkup() {
        assertEquals("Hello", InputSanitizer.sanitizeString("  <b>Hello</b> "));
        assertEquals("alert(1)", InputSanitizer.sanitizeString("javascript:alert(1)"));
        assertNull(InputSanitizer.sanitizeString(null));
    }

    @Test
    void testSanitizeEmail() {
        assertEquals("ada@example.com", InputSanitizer.sanitizeEmail("  Ada@Example.COM "));
        assertEquals("", InputSanitizer.sanitizeEmail("not-an-email"));
    }

    @Test
    void testSanitizeNameAndPhone() {
        assertEquals("Mary-Jane O'Neil", InputSanitizer.sanitizeName("mary-jane o'neil42"));
        assertEquals("+44 (20) 7946-0958", InputSanitizer.sanitizePhone("+44 (20) 7946-0958 ext"));
    }

    @Test
    void testSanitizeText_Truncates() {
        String longText = "a".repeat(InputSanitizer.MAX_TEXT_LENGTH + 20);

        assertEquals(InputSanitizer.MAX_TEXT_LENGTH,
                InputSanitizer.sanitizeText(longText, InputSanitizer.MAX_TEXT_LENGTH).length());
        assertEquals("quiet room", InputSanitizer.sanitizeText("<p>quiet room</p>", 100));
    }

    @Test
    void testSanitizeBookingRequest_KeepsNonStringFields() {
        BookingRequest request = BookingRequest.builder()
                .hotelId(3L)
                .roomId(" room-3-1 ")
                .guestInfo(GuestInfo.builder().firstName("ada").lastName("lovelace").email("ADA@EXAMPLE.COM")
                        .phone("+1 555 0100").build())
                .paymentMethodId("pm_card_visa")
                .specialRequests("<i>high floor</i>")
                .build();

        BookingRequest sanitized = InputSanitizer.sanitizeBookingRequest(request);

        assertEquals(3L, sanitized.getHotelId());
        assertEquals("room-3-1", sanitized.getRoomId());
        assertEquals("Ada", sanitized.getGuestInfo().getFirstName());
        assertEquals("ada@example.com", sanitized.getGuestInfo().getEmail());
        assertEquals("high floor", sanitized.getSpecialRequests());
    }
}
