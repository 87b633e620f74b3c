package com.ryuqq.retention.core.exception;

import com.ryuqq.retention.core.model.ResourceKey;

/**
 * 리컨실 시간 예산 초과.
 *
 * @author Retention Team
 * @since 1.0.0
 */
public class ReconcileTimeoutException extends RuntimeException {

    private final ResourceKey key;
    private final long timeoutMs;

    /**
     * 생성자.
     *
     * @param key 리컨실 대상 키
     * @param timeoutMs 허용된 시간 (밀리초)
     * @param cause 원인 (null 가능)
     */
    public ReconcileTimeoutException(ResourceKey key, long timeoutMs, Throwable cause) {
        super("Reconcile of " + key + " timed out after " + timeoutMs + "ms", cause);
        this.key = key;
        this.timeoutMs = timeoutMs;
    }

    public ResourceKey getKey() {
        return key;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
