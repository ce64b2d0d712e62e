package com.ryuqq.retry.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PolicyKey 테스트.
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
class PolicyKeyTest {

    @Test
    void of_NullMethod_ReturnsProcessName() {
        assertEquals("OrderSync", PolicyKey.of("OrderSync", null));
    }

    @Test
    void of_BlankMethod_ReturnsProcessName() {
        assertEquals("OrderSync", PolicyKey.of("OrderSync", "  "));
    }

    @Test
    void of_WithMethod_ReturnsCompositeKey() {
        assertEquals("OrderSync--push", PolicyKey.of("OrderSync", "push"));
    }

    @Test
    void of_NullProcess_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> PolicyKey.of(null, "push"));
    }
}
