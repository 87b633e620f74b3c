package com.ryuqq.retention.core.spi;

import com.ryuqq.retention.core.model.ResourceKey;

import java.time.Duration;
import java.util.Optional;

/**
 * Reconciliation request queue SPI.
 *
 * <p>A single typed queue of {@link ResourceKey}s feeds one controller. Event classifiers
 * enqueue keys; runners dequeue, reconcile, acknowledge and optionally re-enqueue with a delay.</p>
 *
 * <p><strong>Delivery Semantics:</strong></p>
 * <ul>
 *   <li>Deduplication: a key waits in the queue at most once; the earliest due time wins</li>
 *   <li>Exclusivity: a dequeued key is not handed to another consumer until {@link #ack(ResourceKey)}</li>
 *   <li>Dirty redelivery: a key enqueued while in flight is delivered again after ack</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * queue.enqueue(key);
 *
 * Optional&lt;ResourceKey&gt; next = queue.dequeue(Duration.ofMillis(100));
 * next.ifPresent(k -&gt; {
 *     try {
 *         ReconcileResult result = reconciler.reconcile(k);
 *         // ...
 *     } finally {
 *         queue.ack(k);
 *     }
 * });
 * </pre>
 *
 * @author Retention Team
 * @since 1.0.0
 */
public interface WorkQueue {

    /**
     * Enqueues a key for immediate processing.
     *
     * @param key the key to enqueue
     * @throws IllegalArgumentException if key is null
     */
    void enqueue(ResourceKey key);

    /**
     * Enqueues a key that becomes available after the given delay.
     *
     * <p>If the key is already waiting with an earlier or equal due time, this call has no effect.</p>
     *
     * @param key the key to enqueue
     * @param delay the delay before the key becomes available (zero for immediate)
     * @throws IllegalArgumentException if key is null or delay is null or negative
     */
    void enqueueAfter(ResourceKey key, Duration delay);

    /**
     * Dequeues the next available key, blocking up to the given timeout.
     *
     * @param timeout maximum time to wait
     * @return the next key, or empty if none became available in time
     * @throws IllegalArgumentException if timeout is null or negative
     * @throws InterruptedException if interrupted while waiting
     */
    Optional<ResourceKey> dequeue(Duration timeout) throws InterruptedException;

    /**
     * Marks a dequeued key as processed.
     *
     * <p>Idempotent. If the key was enqueued again while in flight, it becomes available again.</p>
     *
     * @param key the key to acknowledge
     * @throws IllegalArgumentException if key is null
     */
    void ack(ResourceKey key);

    /**
     * Returns the number of keys waiting (including delayed ones, excluding in-flight keys).
     *
     * @return number of waiting keys
     */
    int size();
}
