package com.ryuqq.retention.core.policy;

import com.ryuqq.retention.core.model.ExecutionResource;
import com.ryuqq.retention.core.statemachine.CompletionCondition;
import com.ryuqq.retention.core.statemachine.TtlState;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 로드된 ExecutionResource의 TTL 만료 여부 판정.
 *
 * <p><strong>판정 흐름:</strong></p>
 * <pre>
 * 1. condition 없음 또는 UNKNOWN → UNKNOWN
 * 2. 결과별 TTL 선택 (TRUE → ttlAfterSucceeded, FALSE → ttlAfterFailed)
 *    없음 → NO_TTL
 * 3. deadline = completionTime + ttl (Instant.MAX를 넘으면 Instant.MAX, 만료되지 않음)
 *    now >= deadline → EXPIRED
 *    now &lt; deadline  → AWAITING_EXPIRY(deadline - now)
 * </pre>
 *
 * <p>저장소 호출이 없는 순수 함수입니다. 현재 시각은 호출자가 주입합니다.</p>
 *
 * @author Retention Team
 * @since 1.0.0
 */
public final class TtlEvaluator {

    // Utility class - prevent instantiation
    private TtlEvaluator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * TTL 판정.
     *
     * @param resource 로드된 리소스
     * @param ttl 확정된 TTL
     * @param now 현재 시각
     * @return 판정 결과
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static TtlEvaluation evaluate(ExecutionResource resource, EffectiveTtl ttl, Instant now) {
        if (resource == null || ttl == null || now == null) {
            throw new IllegalArgumentException(
                "Arguments cannot be null (resource: " + resource + ", ttl: " + ttl + ", now: " + now + ")"
            );
        }

        CompletionCondition condition = resource.condition();
        if (condition == null || !condition.isTerminal()) {
            return TtlEvaluation.of(TtlState.UNKNOWN);
        }

        Optional<Duration> selected = ttl.forCondition(condition);
        if (selected.isEmpty()) {
            return TtlEvaluation.of(TtlState.NO_TTL);
        }

        Instant deadline = deadline(resource.completionTime(), selected.get());
        if (!now.isBefore(deadline)) {
            return TtlEvaluation.of(TtlState.EXPIRED);
        }
        return TtlEvaluation.awaiting(Duration.between(now, deadline));
    }

    private static Instant deadline(Instant completionTime, Duration ttl) {
        if (Duration.between(completionTime, Instant.MAX).compareTo(ttl) < 0) {
            return Instant.MAX;
        }
        return completionTime.plus(ttl);
    }
}
