package com.ryuqq.retention.core.result;

import com.ryuqq.retention.core.model.ResourceKey;

import java.time.Duration;

/**
 * 지정 시간 후 재확인 예약.
 *
 * <p>리컨실러는 만료 시각까지 블로킹하지 않고, 남은 시간만큼 뒤에 다시 호출되도록 이 결과를 반환합니다.
 * 고정 주기 폴링 대신 정확한 만료 시각에 한 번만 깨어납니다.</p>
 *
 * @param key 리컨실 대상 키
 * @param delay 재확인까지 대기 시간 (양수)
 *
 * @author Retention Team
 * @since 1.0.0
 */
public record RequeueAfter(
    ResourceKey key,
    Duration delay
) implements ReconcileResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException key가 null이거나 delay가 양수가 아닌 경우
     */
    public RequeueAfter {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (delay == null || delay.isNegative() || delay.isZero()) {
            throw new IllegalArgumentException("delay must be positive (current: " + delay + ")");
        }
    }

    /**
     * RequeueAfter 생성.
     *
     * @param key 리컨실 대상 키
     * @param delay 대기 시간
     * @return RequeueAfter 인스턴스
     */
    public static RequeueAfter of(ResourceKey key, Duration delay) {
        return new RequeueAfter(key, delay);
    }
}
