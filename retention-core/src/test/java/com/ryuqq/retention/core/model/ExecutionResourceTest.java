package com.ryuqq.retention.core.model;

import com.ryuqq.retention.core.statemachine.CompletionCondition;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ExecutionResource 불변식 테스트.
 *
 * @author Retention Team
 * @since 1.0.0
 */
class ExecutionResourceTest {

    private static final ResourceKey KEY = ResourceKey.of("ns", "run-1");
    private static final Instant COMPLETED_AT = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void running_CreatesUnknownWithoutCompletionTime() {
        // When
        ExecutionResource execution = ExecutionResource.running(KEY, "build-a", null, null);

        // Then
        assertEquals(CompletionCondition.UNKNOWN, execution.condition());
        assertNull(execution.completionTime());
        assertFalse(execution.isCompleted());
        assertTrue(execution.hasOwner());
        assertEquals(ResourceKind.EXECUTION, execution.kind());
    }

    @Test
    void complete_FromUnknown_SetsConditionAndCompletionTime() {
        // Given
        ExecutionResource running = ExecutionResource.running(KEY, "build-a", null, null);

        // When
        ExecutionResource completed = running.complete(CompletionCondition.FALSE, COMPLETED_AT);

        // Then
        assertEquals(CompletionCondition.FALSE, completed.condition());
        assertEquals(COMPLETED_AT, completed.completionTime());
        assertTrue(completed.isCompleted());
        assertEquals(CompletionCondition.UNKNOWN, running.condition(), "previous snapshot unchanged");
    }

    @Test
    void complete_SameTerminalCondition_ReturnsSameSnapshot() {
        // Given
        ExecutionResource completed = ExecutionResource.running(KEY, "build-a", null, null)
            .complete(CompletionCondition.TRUE, COMPLETED_AT);

        // When
        ExecutionResource again = completed.complete(CompletionCondition.TRUE, COMPLETED_AT.plusSeconds(60));

        // Then
        assertSame(completed, again);
        assertEquals(COMPLETED_AT, again.completionTime());
    }

    @Test
    void complete_OtherTerminalCondition_ThrowsException() {
        // Given
        ExecutionResource completed = ExecutionResource.running(KEY, "build-a", null, null)
            .complete(CompletionCondition.TRUE, COMPLETED_AT);

        // When & Then
        assertThrows(IllegalStateException.class,
            () -> completed.complete(CompletionCondition.FALSE, COMPLETED_AT));
    }

    @Test
    void complete_NonTerminalOutcome_ThrowsException() {
        // Given
        ExecutionResource running = ExecutionResource.running(KEY, "build-a", null, null);

        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> running.complete(CompletionCondition.UNKNOWN, COMPLETED_AT));
        assertThrows(IllegalArgumentException.class,
            () -> running.complete(CompletionCondition.TRUE, null));
    }

    @Test
    void constructor_TerminalWithoutCompletionTime_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new ExecutionResource(KEY, "build-a", null, CompletionCondition.TRUE, null, null)
        );
        assertTrue(exception.getMessage().contains("completionTime is required"));
    }

    @Test
    void constructor_CompletionTimeWithoutTerminal_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> new ExecutionResource(KEY, "build-a", null, CompletionCondition.UNKNOWN, COMPLETED_AT, null));
        assertThrows(IllegalArgumentException.class,
            () -> new ExecutionResource(KEY, "build-a", null, null, COMPLETED_AT, null));
    }

    @Test
    void constructor_NoConditionReported_IsNotCompleted() {
        // When
        ExecutionResource execution = new ExecutionResource(KEY, " ", null, null, null, null);

        // Then
        assertTrue(execution.findCondition().isEmpty());
        assertFalse(execution.isCompleted());
        assertFalse(execution.hasOwner());
    }
}
