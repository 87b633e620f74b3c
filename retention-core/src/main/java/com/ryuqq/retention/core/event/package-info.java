/**
 * Change notification classification.
 *
 * <p>This package reduces the stream of create/update/delete notifications for both resource
 * kinds to the minimal set of reconciliation requests.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retention.core.event.EventPredicate} - Per-kind create/update/delete hooks</li>
 *   <li>{@link com.ryuqq.retention.core.event.ManagedResourcePredicates} - Policy tightening detection</li>
 *   <li>{@link com.ryuqq.retention.core.event.ExecutionResourcePredicates} - Completion edge detection</li>
 *   <li>{@link com.ryuqq.retention.core.event.KeyMappers} - Own-key and owner-key remapping</li>
 *   <li>{@link com.ryuqq.retention.core.event.EventClassifier} - Predicate + key mapper bound to a kind</li>
 * </ul>
 *
 * <h2>Edge Triggering</h2>
 * <pre>
 * UNKNOWN → TRUE    ADMIT
 * UNKNOWN → FALSE   ADMIT
 * TRUE    → TRUE    DROP  (already terminal, any other field change)
 * (none)  → TRUE    DROP  (no previous condition to compare)
 * </pre>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Purity:</strong> Same (old, new) pair always yields the same classification</li>
 *   <li><strong>Total:</strong> Malformed or partial events are dropped, never thrown</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Retention Team
 */
package com.ryuqq.retention.core.event;
