package com.ryuqq.retention.core.policy;

import com.ryuqq.retention.core.model.ExecutionResource;
import com.ryuqq.retention.core.model.ResourceKey;
import com.ryuqq.retention.core.statemachine.CompletionCondition;
import com.ryuqq.retention.core.statemachine.TtlState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TtlEvaluator 테스트.
 *
 * <p>만료 경계: now == completionTime + ttl 이면 만료로 판정합니다.</p>
 *
 * @author Retention Team
 * @since 1.0.0
 */
class TtlEvaluatorTest {

    private static final ResourceKey KEY = ResourceKey.of("ns", "run-1");
    private static final Instant COMPLETED_AT = Instant.parse("2024-01-01T00:00:00Z");
    private static final EffectiveTtl TTL = new EffectiveTtl(Duration.ofMinutes(1), Duration.ofMinutes(5));

    private static ExecutionResource completed(CompletionCondition outcome) {
        return ExecutionResource.running(KEY, "build-a", null, null).complete(outcome, COMPLETED_AT);
    }

    @Test
    void evaluate_Running_ReturnsUnknown() {
        // Given
        ExecutionResource running = ExecutionResource.running(KEY, "build-a", null, null);

        // When
        TtlEvaluation evaluation = TtlEvaluator.evaluate(running, TTL, COMPLETED_AT.plusSeconds(3600));

        // Then
        assertEquals(TtlState.UNKNOWN, evaluation.state());
        assertTrue(evaluation.findRemaining().isEmpty());
    }

    @Test
    void evaluate_NoConditionReported_ReturnsUnknown() {
        // Given
        ExecutionResource execution = new ExecutionResource(KEY, "build-a", null, null, null, null);

        // When
        TtlEvaluation evaluation = TtlEvaluator.evaluate(execution, TTL, COMPLETED_AT);

        // Then
        assertEquals(TtlState.UNKNOWN, evaluation.state());
    }

    @Test
    void evaluate_NoTtlForOutcome_ReturnsNoTtl() {
        // Given: 실패 TTL만 존재
        EffectiveTtl failedOnly = new EffectiveTtl(Duration.ofMinutes(1), null);

        // When
        TtlEvaluation evaluation = TtlEvaluator.evaluate(
            completed(CompletionCondition.TRUE), failedOnly, COMPLETED_AT.plusSeconds(3600));

        // Then
        assertEquals(TtlState.NO_TTL, evaluation.state());
    }

    @Test
    void evaluate_BeforeDeadline_ReturnsAwaitingWithExactRemaining() {
        // Given
        Instant now = COMPLETED_AT.plusSeconds(30);

        // When
        TtlEvaluation evaluation = TtlEvaluator.evaluate(completed(CompletionCondition.FALSE), TTL, now);

        // Then
        assertEquals(TtlState.AWAITING_EXPIRY, evaluation.state());
        assertEquals(Duration.ofSeconds(30), evaluation.remaining());
    }

    @Test
    void evaluate_OneMillisBeforeDeadline_ReturnsAwaiting() {
        // Given
        Instant now = COMPLETED_AT.plus(Duration.ofMinutes(5)).minusMillis(1);

        // When
        TtlEvaluation evaluation = TtlEvaluator.evaluate(completed(CompletionCondition.TRUE), TTL, now);

        // Then
        assertEquals(TtlState.AWAITING_EXPIRY, evaluation.state());
        assertEquals(Duration.ofMillis(1), evaluation.remaining());
    }

    @Test
    void evaluate_ExactlyAtDeadline_ReturnsExpired() {
        // Given
        Instant now = COMPLETED_AT.plus(Duration.ofMinutes(5));

        // When
        TtlEvaluation evaluation = TtlEvaluator.evaluate(completed(CompletionCondition.TRUE), TTL, now);

        // Then
        assertEquals(TtlState.EXPIRED, evaluation.state());
    }

    @Test
    void evaluate_ZeroTtl_ExpiresImmediately() {
        // Given
        EffectiveTtl zero = new EffectiveTtl(Duration.ZERO, Duration.ZERO);

        // When
        TtlEvaluation evaluation = TtlEvaluator.evaluate(completed(CompletionCondition.FALSE), zero, COMPLETED_AT);

        // Then
        assertEquals(TtlState.EXPIRED, evaluation.state());
    }

    @Test
    void evaluate_ClockBeforeCompletion_ReturnsAwaitingFullTtlAndMore() {
        // Given: 시계가 완료 시각보다 뒤처진 경우
        Instant now = COMPLETED_AT.minusSeconds(10);

        // When
        TtlEvaluation evaluation = TtlEvaluator.evaluate(completed(CompletionCondition.FALSE), TTL, now);

        // Then
        assertEquals(TtlState.AWAITING_EXPIRY, evaluation.state());
        assertEquals(Duration.ofSeconds(70), evaluation.remaining());
    }

    @Test
    void evaluation_AwaitingWithoutRemaining_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> TtlEvaluation.of(TtlState.AWAITING_EXPIRY));
        assertThrows(IllegalArgumentException.class, () -> TtlEvaluation.awaiting(Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> new TtlEvaluation(TtlState.EXPIRED, Duration.ofSeconds(1)));
    }

    @Test
    void evaluate_DeadlineBeyondInstantMax_ReturnsAwaitingWithoutThrowing() {
        // Given
        EffectiveTtl endless = new EffectiveTtl(null, Duration.ofSeconds(Long.MAX_VALUE));
        Instant now = COMPLETED_AT.plusSeconds(60);

        // When
        TtlEvaluation evaluation = assertDoesNotThrow(
            () -> TtlEvaluator.evaluate(completed(CompletionCondition.TRUE), endless, now));

        // Then
        assertEquals(TtlState.AWAITING_EXPIRY, evaluation.state());
        assertEquals(Duration.between(now, Instant.MAX), evaluation.remaining());
    }
}
