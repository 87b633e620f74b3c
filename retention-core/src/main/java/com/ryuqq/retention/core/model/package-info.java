/**
 * Core resource model.
 *
 * <p>Immutable snapshots of the two watched resource kinds and the retention configuration
 * they carry:</p>
 *
 * <h2>Resources</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retention.core.model.ManagedResource} - Template declaring a retention policy (primary)</li>
 *   <li>{@link com.ryuqq.retention.core.model.ExecutionResource} - Run owned by a template, subject to TTL (secondary)</li>
 * </ul>
 *
 * <h2>Retention Configuration</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retention.core.model.RetentionPolicy} - Count limits and TTLs declared by a template</li>
 *   <li>{@link com.ryuqq.retention.core.model.TtlRetention} - Per-run TTL override</li>
 * </ul>
 *
 * <h2>Identity</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retention.core.model.ResourceKey} - (namespace, name), also the reconciliation request</li>
 *   <li>{@link com.ryuqq.retention.core.model.ResourceKind} - MANAGED or EXECUTION</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Retention Team
 */
package com.ryuqq.retention.core.model;
