package com.ryuqq.retention.core.result;

import com.ryuqq.retention.core.model.ResourceKey;

/**
 * 재시도 가능한 리컨실 오류.
 *
 * <p>코어는 내부적으로 재시도하지 않습니다. 이 결과를 받은 작업 큐가 자체 백오프 정책에 따라 재전달합니다.</p>
 *
 * @param key 리컨실 대상 키
 * @param kind 오류 분류
 * @param message 오류 메시지
 *
 * @author Retention Team
 * @since 1.0.0
 */
public record Failure(
    ResourceKey key,
    ErrorKind kind,
    String message
) implements ReconcileResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 없는 경우
     */
    public Failure {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * Failure 생성.
     *
     * @param key 리컨실 대상 키
     * @param kind 오류 분류
     * @param message 오류 메시지
     * @return Failure 인스턴스
     */
    public static Failure of(ResourceKey key, ErrorKind kind, String message) {
        return new Failure(key, kind, message);
    }
}
