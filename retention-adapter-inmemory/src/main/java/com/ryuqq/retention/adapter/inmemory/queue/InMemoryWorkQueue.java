package com.ryuqq.retention.adapter.inmemory.queue;

import com.ryuqq.retention.core.model.ResourceKey;
import com.ryuqq.retention.core.spi.WorkQueue;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;

/**
 * In-memory implementation of {@link WorkQueue} SPI for testing and reference purposes.
 *
 * <p>This implementation uses {@link DelayQueue} for delayed delivery and keeps per-key
 * bookkeeping so that a key waits at most once and is never handed to two consumers at once.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Timer:</strong> DelayQueue&lt;DelayedKey&gt; - timestamp-based ordering of due keys</li>
 *   <li><strong>Waiting:</strong> Map&lt;ResourceKey, Long&gt; - current due time per waiting key
 *       (timer entries that no longer match are stale and skipped)</li>
 *   <li><strong>Processing:</strong> Set&lt;ResourceKey&gt; - keys handed out and not yet acknowledged</li>
 *   <li><strong>Dirty:</strong> Map&lt;ResourceKey, Long&gt; - keys enqueued while processing,
 *       released on ack</li>
 * </ul>
 *
 * <p><strong>Semantics:</strong></p>
 * <ul>
 *   <li>Enqueueing a waiting key keeps the earlier due time</li>
 *   <li>Enqueueing a processing key defers it until {@link #ack(ResourceKey)}</li>
 *   <li>Ack of an unknown key is a no-op</li>
 *   <li>Delays longer than {@link #MAX_DELAY} (about 73 years) are clamped to it; the key is
 *       redelivered then and the reconciler decides again</li>
 * </ul>
 *
 * @author Retention Team
 * @since 1.0.0
 */
public class InMemoryWorkQueue implements WorkQueue {

    /** Longest delay the nanosecond timer can hold without overflowing. */
    public static final Duration MAX_DELAY = Duration.ofNanos(Long.MAX_VALUE / 4);

    private final DelayQueue<DelayedKey> timer;
    private final Map<ResourceKey, Long> waiting;
    private final Set<ResourceKey> processing;
    private final Map<ResourceKey, Long> dirty;

    /**
     * Creates an empty queue.
     */
    public InMemoryWorkQueue() {
        this.timer = new DelayQueue<>();
        this.waiting = new HashMap<>();
        this.processing = new HashSet<>();
        this.dirty = new HashMap<>();
    }

    @Override
    public void enqueue(ResourceKey key) {
        enqueueAfter(key, Duration.ZERO);
    }

    @Override
    public synchronized void enqueueAfter(ResourceKey key, Duration delay) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay cannot be null or negative (current: " + delay + ")");
        }

        Duration clamped = delay.compareTo(MAX_DELAY) > 0 ? MAX_DELAY : delay;
        long dueAtNanos = System.nanoTime() + clamped.toNanos();

        if (processing.contains(key)) {
            dirty.merge(key, dueAtNanos, Math::min);
            return;
        }

        Long current = waiting.get(key);
        if (current != null && current <= dueAtNanos) {
            return;
        }
        schedule(key, dueAtNanos);
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Blocks on the DelayQueue without holding the queue monitor</li>
     *   <li>Stale timer entries (superseded by an earlier due time) are discarded</li>
     * </ul>
     */
    @Override
    public Optional<ResourceKey> dequeue(Duration timeout) throws InterruptedException {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be null or negative (current: " + timeout + ")");
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            DelayedKey next = timer.poll(Math.max(remaining, 0L), TimeUnit.NANOSECONDS);
            if (next == null) {
                return Optional.empty();
            }
            if (claim(next)) {
                return Optional.of(next.key);
            }
        }
    }

    @Override
    public synchronized void ack(ResourceKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (!processing.remove(key)) {
            return;
        }

        Long deferred = dirty.remove(key);
        if (deferred != null) {
            schedule(key, deferred);
        }
    }

    @Override
    public synchronized int size() {
        return waiting.size();
    }

    /**
     * Checks whether a key is currently handed out and not yet acknowledged.
     *
     * @param key the key
     * @return true if processing
     */
    public synchronized boolean isProcessing(ResourceKey key) {
        return processing.contains(key);
    }

    /**
     * Clears all state. Used for test cleanup.
     */
    public synchronized void clear() {
        timer.clear();
        waiting.clear();
        processing.clear();
        dirty.clear();
    }

    private void schedule(ResourceKey key, long dueAtNanos) {
        waiting.put(key, dueAtNanos);
        timer.put(new DelayedKey(key, dueAtNanos));
    }

    private synchronized boolean claim(DelayedKey next) {
        Long current = waiting.get(next.key);
        if (current == null || current != next.dueAtNanos) {
            return false;
        }
        waiting.remove(next.key);
        processing.add(next.key);
        return true;
    }

    /**
     * Timer entry for a key with its due time.
     */
    private static final class DelayedKey implements Delayed {

        private final ResourceKey key;
        private final long dueAtNanos;

        DelayedKey(ResourceKey key, long dueAtNanos) {
            this.key = key;
            this.dueAtNanos = dueAtNanos;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(dueAtNanos - System.nanoTime(), TimeUnit.NANOSECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            if (other instanceof DelayedKey delayedKey) {
                return Long.compare(dueAtNanos, delayedKey.dueAtNanos);
            }
            return Long.compare(getDelay(TimeUnit.NANOSECONDS), other.getDelay(TimeUnit.NANOSECONDS));
        }
    }
}
