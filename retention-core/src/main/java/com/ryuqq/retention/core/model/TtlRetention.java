package com.ryuqq.retention.core.model;

import java.time.Duration;

/**
 * ExecutionResource 자체에 선언된 TTL 설정.
 *
 * <p>결과(outcome)별로 독립적으로 상속 정책을 덮어씁니다.
 * 예를 들어 ttlAfterFailed만 지정하면, 성공 TTL은 여전히 상속 스냅샷에서 가져옵니다.</p>
 *
 * @param ttlAfterFailed 실패 후 보존 기간 (null 가능)
 * @param ttlAfterSucceeded 성공 후 보존 기간 (null 가능)
 *
 * @author Retention Team
 * @since 1.0.0
 */
public record TtlRetention(
    Duration ttlAfterFailed,
    Duration ttlAfterSucceeded
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException TTL이 음수인 경우
     */
    public TtlRetention {
        if (ttlAfterFailed != null && ttlAfterFailed.isNegative()) {
            throw new IllegalArgumentException("ttlAfterFailed must be non-negative (current: " + ttlAfterFailed + ")");
        }
        if (ttlAfterSucceeded != null && ttlAfterSucceeded.isNegative()) {
            throw new IllegalArgumentException("ttlAfterSucceeded must be non-negative (current: " + ttlAfterSucceeded + ")");
        }
    }

    /**
     * TtlRetention 생성.
     *
     * @param ttlAfterFailed 실패 후 보존 기간 (null 가능)
     * @param ttlAfterSucceeded 성공 후 보존 기간 (null 가능)
     * @return TtlRetention 인스턴스
     */
    public static TtlRetention of(Duration ttlAfterFailed, Duration ttlAfterSucceeded) {
        return new TtlRetention(ttlAfterFailed, ttlAfterSucceeded);
    }
}
