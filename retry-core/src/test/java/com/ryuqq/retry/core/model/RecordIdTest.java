package com.ryuqq.retry.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RecordId Value Object 테스트.
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
class RecordIdTest {

    @Test
    void of_ValidValue_CreatesRecordId() {
        // Given
        String value = "log-12345";

        // When
        RecordId recordId = RecordId.of(value);

        // Then
        assertNotNull(recordId);
        assertEquals(value, recordId.getValue());
    }

    @Test
    void of_NullValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> RecordId.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void of_BlankValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> RecordId.of("   ")
        );
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }

    @Test
    void of_TooLongValue_ThrowsException() {
        // Given
        String value = "a".repeat(256);

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> RecordId.of(value)
        );
        assertTrue(exception.getMessage().contains("cannot exceed 255"));
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> RecordId.of("log#1")
        );
        assertTrue(exception.getMessage().contains("invalid characters"));
    }

    @Test
    void random_GeneratesDistinctIds() {
        // When
        RecordId first = RecordId.random();
        RecordId second = RecordId.random();

        // Then
        assertNotEquals(first, second);
    }

    @Test
    void derivedFrom_SameNotificationId_ReturnsSameRecordId() {
        // When
        RecordId first = RecordId.derivedFrom("notification-1");
        RecordId second = RecordId.derivedFrom("notification-1");

        // Then
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void derivedFrom_DifferentNotificationIds_ReturnsDifferentRecordIds() {
        // When
        RecordId first = RecordId.derivedFrom("notification-1");
        RecordId second = RecordId.derivedFrom("notification-2");

        // Then
        assertNotEquals(first, second);
    }

    @Test
    void derivedFrom_BlankNotificationId_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> RecordId.derivedFrom(" "));
    }

    @Test
    void toString_ContainsValue() {
        // Given
        RecordId recordId = RecordId.of("log-1");

        // When & Then
        assertEquals("RecordId{log-1}", recordId.toString());
    }
}
