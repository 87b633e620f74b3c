/**
 * Completion condition and TTL reconcile states.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retention.core.statemachine.CompletionCondition} - UNKNOWN, TRUE, FALSE</li>
 *   <li>{@link com.ryuqq.retention.core.statemachine.ConditionTransition} - Monotonic transition validation and edge detection</li>
 *   <li>{@link com.ryuqq.retention.core.statemachine.TtlState} - States of one TTL reconcile</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Retention Team
 */
package com.ryuqq.retention.core.statemachine;
