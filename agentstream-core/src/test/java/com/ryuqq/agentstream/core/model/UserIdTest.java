package com.ryuqq.agentstream.core.model;

import com.ryuqq.agentstream.core.error.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * UserId Value Object 테스트.
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
class UserIdTest {

    @Test
    void of_ValidValue_CreatesUserId() {
        // Given
        String value = "user-1234";

        // When
        UserId userId = UserId.of(value);

        // Then
        assertEquals(value, userId.getValue());
    }

    @Test
    void of_ValueWithDotsAndColons_CreatesUserId() {
        // When
        UserId userId = UserId.of("tenant:acme.user_7");

        // Then
        assertEquals("tenant:acme.user_7", userId.getValue());
    }

    @Test
    void of_NullValue_ThrowsValidationException() {
        // When & Then
        ValidationException exception = assertThrows(ValidationException.class, () -> UserId.of(null));
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void of_BlankValue_ThrowsValidationException() {
        assertThrows(ValidationException.class, () -> UserId.of("   "));
    }

    @Test
    void of_InvalidCharacters_ThrowsValidationException() {
        // When & Then
        ValidationException exception = assertThrows(ValidationException.class, () -> UserId.of("user 1/2"));
        assertTrue(exception.getMessage().contains("invalid characters"));
    }

    @Test
    void of_TooLongValue_ThrowsValidationException() {
        // Given
        String value = "u".repeat(256);

        // When & Then
        assertThrows(ValidationException.class, () -> UserId.of(value));
    }

    @Test
    void of_MaxLengthValue_CreatesUserId() {
        assertDoesNotThrow(() -> UserId.of("u".repeat(255)));
    }

    @Test
    void validationException_IsIllegalArgumentException() {
        assertThrows(IllegalArgumentException.class, () -> UserId.of(""));
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        // Given
        UserId first = UserId.of("user-1");
        UserId second = UserId.of("user-1");

        // Then
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, UserId.of("user-2"));
    }

    @Test
    void toString_ContainsValue() {
        assertEquals("UserId{user-1}", UserId.of("user-1").toString());
    }
}
