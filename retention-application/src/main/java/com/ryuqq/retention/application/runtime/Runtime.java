package com.ryuqq.retention.application.runtime;

import java.time.Duration;

/**
 * Controller Runtime.
 *
 * <p>This interface defines the runtime behavior that drains a controller's
 * work queue and drives its reconciler.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Dequeue reconciliation requests from the work queue</li>
 *   <li>Run the reconciler within a per-request time limit</li>
 *   <li>Translate results into queue actions (ack, requeue after delay, backoff)</li>
 * </ul>
 *
 * <p><strong>Runtime Operation Flow:</strong></p>
 * <pre>
 * processNext(pollTimeout)
 *   ↓
 * 1. Dequeue one key (wait up to pollTimeout)
 * 2. reconcile(key) bounded by the reconcile timeout
 * 3. Handle result:
 *    - Done         → ack
 *    - RequeueAfter → ack → enqueueAfter(delay)
 *    - Failure      → ack → enqueueAfter(backoff)
 * </pre>
 *
 * <p><strong>Execution Context:</strong></p>
 * <ul>
 *   <li>{@link #start()} runs worker loops that call {@link #processNext(Duration)} until shutdown</li>
 *   <li>Tests may call {@link #processNext(Duration)} directly for deterministic stepping</li>
 *   <li>Requests are never dropped: failures are always requeued</li>
 * </ul>
 *
 * @author Retention Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Processes a single reconciliation request.
     *
     * @param pollTimeout maximum time to wait for a request
     * @return true if a request was processed, false if the queue stayed empty
     * @throws InterruptedException if interrupted while waiting for a request
     */
    boolean processNext(Duration pollTimeout) throws InterruptedException;

    /**
     * Starts the worker loops.
     *
     * @throws IllegalStateException if already started or shut down
     */
    void start();

    /**
     * Stops the worker loops, waiting for in-flight requests to finish.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    void shutdown() throws InterruptedException;
}
