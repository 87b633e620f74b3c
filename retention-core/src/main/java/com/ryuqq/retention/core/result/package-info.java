/**
 * Reconcile result package.
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retention.core.result.ReconcileResult} - Sealed interface (permits Done, RequeueAfter, Failure)</li>
 * </ul>
 *
 * <h2>Result Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retention.core.result.Done} - Nothing further to do</li>
 *   <li>{@link com.ryuqq.retention.core.result.RequeueAfter} - Reconcile again after a delay</li>
 *   <li>{@link com.ryuqq.retention.core.result.Failure} - Retryable error, classified by {@link com.ryuqq.retention.core.result.ErrorKind}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Retention Team
 */
package com.ryuqq.retention.core.result;
