package com.ryuqq.retention.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RetentionPolicy, ManagedResource 테스트.
 *
 * @author Retention Team
 * @since 1.0.0
 */
class RetentionPolicyTest {

    @Test
    void hasLimits_OnlyTtls_ReturnsFalse() {
        // Given
        RetentionPolicy policy = RetentionPolicy.ofTtls(Duration.ofMinutes(1), null);

        // When & Then
        assertFalse(policy.hasLimits());
        assertEquals(Duration.ofMinutes(1), policy.findTtlAfterFailed().orElseThrow());
        assertTrue(policy.findTtlAfterSucceeded().isEmpty());
    }

    @Test
    void hasLimits_SingleLimit_ReturnsTrue() {
        // When & Then
        assertTrue(RetentionPolicy.ofLimits(3, null).hasLimits());
        assertTrue(RetentionPolicy.ofLimits(null, 5).hasLimits());
    }

    @Test
    void constructor_ZeroLimit_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> RetentionPolicy.ofLimits(0, null)
        );
        assertTrue(exception.getMessage().contains("failedLimit must be positive"));
    }

    @Test
    void constructor_NegativeTtl_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> RetentionPolicy.ofTtls(null, Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class,
            () -> TtlRetention.of(Duration.ofSeconds(-1), null));
    }

    @Test
    void declaresLimits_ManagedResourceWithoutPolicy_ReturnsFalse() {
        // Given
        ManagedResource managed = ManagedResource.of(ResourceKey.of("ns", "build-a"), null);

        // When & Then
        assertFalse(managed.declaresLimits());
        assertEquals(ResourceKind.MANAGED, managed.kind());
    }

    @Test
    void declaresLimits_ManagedResourceWithLimit_ReturnsTrue() {
        // Given
        ManagedResource managed = ManagedResource.of(
            ResourceKey.of("ns", "build-a"), RetentionPolicy.ofLimits(2, null));

        // When & Then
        assertTrue(managed.declaresLimits());
    }
}
