package com.ryuqq.retention.core.policy;

import com.ryuqq.retention.core.statemachine.CompletionCondition;

import java.time.Duration;
import java.util.Optional;

/**
 * 결과(outcome)별로 확정된 TTL.
 *
 * <p>값이 없으면 해당 결과에는 TTL 정리가 적용되지 않는다는 뜻입니다 (즉시 삭제가 아님).</p>
 *
 * @param ttlAfterFailed 실패 후 보존 기간 (null 가능)
 * @param ttlAfterSucceeded 성공 후 보존 기간 (null 가능)
 *
 * @author Retention Team
 * @since 1.0.0
 */
public record EffectiveTtl(
    Duration ttlAfterFailed,
    Duration ttlAfterSucceeded
) {

    private static final EffectiveTtl NONE = new EffectiveTtl(null, null);

    /**
     * TTL이 전혀 없는 인스턴스.
     *
     * @return 빈 EffectiveTtl
     */
    public static EffectiveTtl none() {
        return NONE;
    }

    /**
     * 완료 조건에 해당하는 TTL 선택.
     *
     * @param condition 완료 조건 (null 가능)
     * @return TRUE이면 ttlAfterSucceeded, FALSE이면 ttlAfterFailed, 그 외 empty
     */
    public Optional<Duration> forCondition(CompletionCondition condition) {
        if (condition == null) {
            return Optional.empty();
        }
        return switch (condition) {
            case TRUE -> Optional.ofNullable(ttlAfterSucceeded);
            case FALSE -> Optional.ofNullable(ttlAfterFailed);
            case UNKNOWN -> Optional.empty();
        };
    }

    /**
     * 어느 결과에도 TTL이 없는지 확인.
     *
     * @return 두 TTL 모두 없는 경우 true
     */
    public boolean isEmpty() {
        return ttlAfterFailed == null && ttlAfterSucceeded == null;
    }
}
