package com.ryuqq.retention.core.event;

import com.ryuqq.retention.core.model.ExecutionResource;
import com.ryuqq.retention.core.model.ResourceKey;
import com.ryuqq.retention.core.statemachine.CompletionCondition;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ExecutionResourcePredicates 테스트.
 *
 * <p>UNKNOWN → 종료 상태 전이 이벤트만 허용합니다.</p>
 *
 * @author Retention Team
 * @since 1.0.0
 */
class ExecutionResourcePredicatesTest {

    private static final ResourceKey KEY = ResourceKey.of("ns", "run-1");
    private static final Instant COMPLETED_AT = Instant.parse("2024-01-01T00:00:00Z");

    private static ExecutionResource running(String owner) {
        return ExecutionResource.running(KEY, owner, null, null);
    }

    @Test
    void onUpdate_CompletionEdge_Admits() {
        // Given
        ExecutionResource before = running("build-a");

        // When & Then
        assertEquals(Decision.ADMIT, ExecutionResourcePredicates.forTtlCleanup()
            .onUpdate(before, before.complete(CompletionCondition.TRUE, COMPLETED_AT)));
        assertEquals(Decision.ADMIT, ExecutionResourcePredicates.forTtlCleanup()
            .onUpdate(before, before.complete(CompletionCondition.FALSE, COMPLETED_AT)));
    }

    @Test
    void onUpdate_StillRunning_Drops() {
        // Given
        ExecutionResource before = running("build-a");

        // When & Then
        assertEquals(Decision.DROP, ExecutionResourcePredicates.forTtlCleanup().onUpdate(before, before));
    }

    @Test
    void onUpdate_AlreadyCompleted_Drops() {
        // Given
        ExecutionResource completed = running("build-a").complete(CompletionCondition.TRUE, COMPLETED_AT);

        // When & Then
        assertEquals(Decision.DROP, ExecutionResourcePredicates.forTtlCleanup().onUpdate(completed, completed));
    }

    @Test
    void onUpdate_ConditionMissingOnOldSnapshot_Drops() {
        // Given
        ExecutionResource before = new ExecutionResource(KEY, "build-a", null, null, null, null);
        ExecutionResource after = before.complete(CompletionCondition.TRUE, COMPLETED_AT);

        // When & Then
        assertEquals(Decision.DROP, ExecutionResourcePredicates.forTtlCleanup().onUpdate(before, after));
    }

    @Test
    void onCreate_CompletedExecution_Drops() {
        // Given
        ExecutionResource completed = running("build-a").complete(CompletionCondition.FALSE, COMPLETED_AT);

        // When & Then
        assertEquals(Decision.DROP, ExecutionResourcePredicates.forTtlCleanup().onCreate(completed));
        assertEquals(Decision.DROP, ExecutionResourcePredicates.forLimitCleanup().onCreate(completed));
    }

    @Test
    void onDelete_Drops() {
        // When & Then
        assertEquals(Decision.DROP, ExecutionResourcePredicates.forTtlCleanup().onDelete(running("build-a")));
        assertEquals(Decision.DROP, ExecutionResourcePredicates.forLimitCleanup().onDelete(running("build-a")));
    }

    @Test
    void onUpdate_LimitCleanupWithoutOwner_Drops() {
        // Given
        ExecutionResource before = running("");
        ExecutionResource after = before.complete(CompletionCondition.TRUE, COMPLETED_AT);

        // When & Then
        assertEquals(Decision.DROP, ExecutionResourcePredicates.forLimitCleanup().onUpdate(before, after));
        assertEquals(Decision.ADMIT, ExecutionResourcePredicates.forTtlCleanup().onUpdate(before, after));
    }

    @Test
    void onUpdate_LimitCleanupWithOwner_Admits() {
        // Given
        ExecutionResource before = running("build-a");
        ExecutionResource after = before.complete(CompletionCondition.FALSE, COMPLETED_AT);

        // When & Then
        assertEquals(Decision.ADMIT, ExecutionResourcePredicates.forLimitCleanup().onUpdate(before, after));
    }
}
