package com.ryuqq.retention.core.policy;

import com.ryuqq.retention.core.model.ExecutionResource;
import com.ryuqq.retention.core.model.RetentionPolicy;
import com.ryuqq.retention.core.model.TtlRetention;

import java.time.Duration;

/**
 * ExecutionResource에 적용할 TTL을 2단계 설정에서 확정합니다.
 *
 * <p><strong>우선순위 (결과별로 독립 적용):</strong></p>
 * <pre>
 * 1. ExecutionResource 자체 TTL (retention)
 * 2. 생성 시점 소유자 정책 스냅샷 (embeddedPolicy)
 * 3. 없음 → 해당 결과에는 TTL 정리 없음
 * </pre>
 *
 * <p>예를 들어 자체 ttlAfterFailed=10m, 스냅샷 ttlAfterFailed=2h, ttlAfterSucceeded=1h이면
 * 결과는 (failed=10m, succeeded=1h)입니다.</p>
 *
 * <p>순수 함수이며 부수 효과와 오류가 없습니다.</p>
 *
 * @author Retention Team
 * @since 1.0.0
 */
public final class DurationPolicyResolver {

    // Utility class - prevent instantiation
    private DurationPolicyResolver() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 적용할 TTL 확정.
     *
     * @param resource 대상 ExecutionResource
     * @return 결과별 TTL
     * @throws IllegalArgumentException resource가 null인 경우
     */
    public static EffectiveTtl resolve(ExecutionResource resource) {
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }

        TtlRetention own = resource.retention();
        RetentionPolicy inherited = resource.embeddedPolicy();

        Duration failed = firstPresent(
            own == null ? null : own.ttlAfterFailed(),
            inherited == null ? null : inherited.ttlAfterFailed()
        );
        Duration succeeded = firstPresent(
            own == null ? null : own.ttlAfterSucceeded(),
            inherited == null ? null : inherited.ttlAfterSucceeded()
        );

        if (failed == null && succeeded == null) {
            return EffectiveTtl.none();
        }
        return new EffectiveTtl(failed, succeeded);
    }

    private static Duration firstPresent(Duration own, Duration inherited) {
        return own != null ? own : inherited;
    }
}
