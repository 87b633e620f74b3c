package com.ryuqq.retention.core.model;

import java.time.Duration;
import java.util.Optional;

/**
 * ManagedResource가 선언하는 보존 정책.
 *
 * <p>개수 기반(failedLimit, succeededLimit)과 시간 기반(ttlAfterFailed, ttlAfterSucceeded)
 * 항목을 모두 담습니다. 모든 항목은 선택이며, 값이 없으면 해당 정리 규칙이 적용되지 않습니다.</p>
 *
 * <p>ExecutionResource는 생성 시점에 소유자의 RetentionPolicy 스냅샷을 보관하며,
 * 자체 TTL이 없는 결과(outcome)에 대해 이 스냅샷의 TTL을 상속합니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>failedLimit, succeededLimit: 1 이상 (null 허용)</li>
 *   <li>ttlAfterFailed, ttlAfterSucceeded: 음수 불가 (null 허용)</li>
 * </ul>
 *
 * @param failedLimit 보존할 실패 실행 최대 개수 (null 가능)
 * @param succeededLimit 보존할 성공 실행 최대 개수 (null 가능)
 * @param ttlAfterFailed 실패 후 보존 기간 (null 가능)
 * @param ttlAfterSucceeded 성공 후 보존 기간 (null 가능)
 *
 * @author Retention Team
 * @since 1.0.0
 */
public record RetentionPolicy(
    Integer failedLimit,
    Integer succeededLimit,
    Duration ttlAfterFailed,
    Duration ttlAfterSucceeded
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException limit이 양수가 아니거나 TTL이 음수인 경우
     */
    public RetentionPolicy {
        if (failedLimit != null && failedLimit < 1) {
            throw new IllegalArgumentException("failedLimit must be positive (current: " + failedLimit + ")");
        }
        if (succeededLimit != null && succeededLimit < 1) {
            throw new IllegalArgumentException("succeededLimit must be positive (current: " + succeededLimit + ")");
        }
        if (ttlAfterFailed != null && ttlAfterFailed.isNegative()) {
            throw new IllegalArgumentException("ttlAfterFailed must be non-negative (current: " + ttlAfterFailed + ")");
        }
        if (ttlAfterSucceeded != null && ttlAfterSucceeded.isNegative()) {
            throw new IllegalArgumentException("ttlAfterSucceeded must be non-negative (current: " + ttlAfterSucceeded + ")");
        }
    }

    /**
     * 개수 제한만 가진 정책 생성.
     *
     * @param failedLimit 실패 실행 최대 개수 (null 가능)
     * @param succeededLimit 성공 실행 최대 개수 (null 가능)
     * @return RetentionPolicy 인스턴스
     */
    public static RetentionPolicy ofLimits(Integer failedLimit, Integer succeededLimit) {
        return new RetentionPolicy(failedLimit, succeededLimit, null, null);
    }

    /**
     * TTL만 가진 정책 생성.
     *
     * @param ttlAfterFailed 실패 후 보존 기간 (null 가능)
     * @param ttlAfterSucceeded 성공 후 보존 기간 (null 가능)
     * @return RetentionPolicy 인스턴스
     */
    public static RetentionPolicy ofTtls(Duration ttlAfterFailed, Duration ttlAfterSucceeded) {
        return new RetentionPolicy(null, null, ttlAfterFailed, ttlAfterSucceeded);
    }

    /**
     * 개수 제한이 하나라도 설정되어 있는지 확인.
     *
     * @return failedLimit 또는 succeededLimit이 설정된 경우 true
     */
    public boolean hasLimits() {
        return failedLimit != null || succeededLimit != null;
    }

    /**
     * 실패 후 보존 기간 조회.
     *
     * @return ttlAfterFailed (없으면 empty)
     */
    public Optional<Duration> findTtlAfterFailed() {
        return Optional.ofNullable(ttlAfterFailed);
    }

    /**
     * 성공 후 보존 기간 조회.
     *
     * @return ttlAfterSucceeded (없으면 empty)
     */
    public Optional<Duration> findTtlAfterSucceeded() {
        return Optional.ofNullable(ttlAfterSucceeded);
    }
}
