package com.ryuqq.retention.core.policy;

import com.ryuqq.retention.core.model.ExecutionResource;
import com.ryuqq.retention.core.model.ResourceKey;
import com.ryuqq.retention.core.model.RetentionPolicy;
import com.ryuqq.retention.core.model.TtlRetention;
import com.ryuqq.retention.core.statemachine.CompletionCondition;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DurationPolicyResolver 테스트.
 *
 * @author Retention Team
 * @since 1.0.0
 */
class DurationPolicyResolverTest {

    private static final ResourceKey KEY = ResourceKey.of("ns", "run-1");

    private static ExecutionResource execution(TtlRetention own, RetentionPolicy inherited) {
        return ExecutionResource.running(KEY, "build-a", own, inherited);
    }

    @Test
    void resolve_OnlyInherited_UsesInheritedValues() {
        // Given
        RetentionPolicy inherited = RetentionPolicy.ofTtls(Duration.ofMinutes(10), Duration.ofMinutes(20));

        // When
        EffectiveTtl ttl = DurationPolicyResolver.resolve(execution(null, inherited));

        // Then
        assertEquals(Duration.ofMinutes(10), ttl.ttlAfterFailed());
        assertEquals(Duration.ofMinutes(20), ttl.ttlAfterSucceeded());
    }

    @Test
    void resolve_OwnAndInherited_OwnWins() {
        // Given
        TtlRetention own = TtlRetention.of(Duration.ofMinutes(1), Duration.ofMinutes(2));
        RetentionPolicy inherited = RetentionPolicy.ofTtls(Duration.ofMinutes(10), Duration.ofMinutes(20));

        // When
        EffectiveTtl ttl = DurationPolicyResolver.resolve(execution(own, inherited));

        // Then
        assertEquals(Duration.ofMinutes(1), ttl.ttlAfterFailed());
        assertEquals(Duration.ofMinutes(2), ttl.ttlAfterSucceeded());
    }

    @Test
    void resolve_PartialOverride_EachOutcomeResolvedIndependently() {
        // Given: 실패 TTL만 자체 지정
        TtlRetention own = TtlRetention.of(Duration.ofMinutes(1), null);
        RetentionPolicy inherited = RetentionPolicy.ofTtls(Duration.ofMinutes(10), Duration.ofMinutes(20));

        // When
        EffectiveTtl ttl = DurationPolicyResolver.resolve(execution(own, inherited));

        // Then
        assertEquals(Duration.ofMinutes(1), ttl.ttlAfterFailed());
        assertEquals(Duration.ofMinutes(20), ttl.ttlAfterSucceeded());
    }

    @Test
    void resolve_OwnWithoutInherited_UsesOwn() {
        // Given
        TtlRetention own = TtlRetention.of(null, Duration.ofSeconds(30));

        // When
        EffectiveTtl ttl = DurationPolicyResolver.resolve(execution(own, null));

        // Then
        assertNull(ttl.ttlAfterFailed());
        assertEquals(Duration.ofSeconds(30), ttl.ttlAfterSucceeded());
    }

    @Test
    void resolve_NothingDeclared_ReturnsNone() {
        // When
        EffectiveTtl ttl = DurationPolicyResolver.resolve(execution(null, RetentionPolicy.ofLimits(3, 3)));

        // Then
        assertTrue(ttl.isEmpty());
        assertSame(EffectiveTtl.none(), ttl);
    }

    @Test
    void forCondition_SelectsOutcomeTtl() {
        // Given
        EffectiveTtl ttl = new EffectiveTtl(Duration.ofMinutes(1), Duration.ofMinutes(2));

        // When & Then
        assertEquals(Duration.ofMinutes(1), ttl.forCondition(CompletionCondition.FALSE).orElseThrow());
        assertEquals(Duration.ofMinutes(2), ttl.forCondition(CompletionCondition.TRUE).orElseThrow());
        assertTrue(ttl.forCondition(CompletionCondition.UNKNOWN).isEmpty());
        assertTrue(ttl.forCondition(null).isEmpty());
    }

    @Test
    void resolve_NullResource_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> DurationPolicyResolver.resolve(null));
    }
}
