package com.ryuqq.retention.core.policy;

import com.ryuqq.retention.core.statemachine.TtlState;

import java.time.Duration;
import java.util.Optional;

/**
 * TTL 판정 결과.
 *
 * @param state 판정 상태
 * @param remaining 만료까지 남은 시간 (AWAITING_EXPIRY일 때만 존재)
 *
 * @author Retention Team
 * @since 1.0.0
 */
public record TtlEvaluation(
    TtlState state,
    Duration remaining
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException state와 remaining 조합이 유효하지 않은 경우
     */
    public TtlEvaluation {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (state == TtlState.AWAITING_EXPIRY) {
            if (remaining == null || remaining.isNegative() || remaining.isZero()) {
                throw new IllegalArgumentException("remaining must be positive for AWAITING_EXPIRY (current: " + remaining + ")");
            }
        } else if (remaining != null) {
            throw new IllegalArgumentException("remaining must be absent for " + state);
        }
    }

    /**
     * 남은 시간 없는 판정 결과 생성.
     *
     * @param state 판정 상태
     * @return TtlEvaluation
     */
    public static TtlEvaluation of(TtlState state) {
        return new TtlEvaluation(state, null);
    }

    /**
     * 만료 대기 판정 결과 생성.
     *
     * @param remaining 남은 시간
     * @return TtlEvaluation
     */
    public static TtlEvaluation awaiting(Duration remaining) {
        return new TtlEvaluation(TtlState.AWAITING_EXPIRY, remaining);
    }

    /**
     * 남은 시간 조회.
     *
     * @return remaining (없으면 empty)
     */
    public Optional<Duration> findRemaining() {
        return Optional.ofNullable(remaining);
    }
}
