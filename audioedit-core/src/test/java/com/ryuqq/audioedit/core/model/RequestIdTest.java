package com.ryuqq.audioedit.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RequestId Value Object 테스트.
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
class RequestIdTest {

    @Test
    void of_ValidValue_CreatesRequestId() {
        // Given
        String value = "REQ-000123";

        // When
        RequestId id = RequestId.of(value);

        // Then
        assertEquals(value, id.getValue());
        assertEquals(value, id.toString());
    }

    @Test
    void sequential_PadsToSixDigits() {
        assertEquals("REQ-000001", RequestId.sequential(1).getValue());
        assertEquals("REQ-000123", RequestId.sequential(123).getValue());
        assertEquals("REQ-1234567", RequestId.sequential(1_234_567).getValue());
    }

    @Test
    void sequential_NonPositive_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> RequestId.sequential(0));
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> RequestId.of("req/1"));
        assertThrows(IllegalArgumentException.class, () -> RequestId.of("req 1"));
    }

    @Test
    void of_BlankOrTooLong_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> RequestId.of(" "));
        assertThrows(IllegalArgumentException.class, () -> RequestId.of(null));
        assertThrows(IllegalArgumentException.class, () -> RequestId.of("a".repeat(65)));
    }

    @Test
    void equals_SameValue_AreEqual() {
        assertEquals(RequestId.of("REQ-1"), RequestId.of("REQ-1"));
        assertEquals(RequestId.of("REQ-1").hashCode(), RequestId.of("REQ-1").hashCode());
        assertNotEquals(RequestId.of("REQ-1"), RequestId.of("REQ-2"));
    }
}
