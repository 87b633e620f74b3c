package com.ryuqq.retention.core.event;

import com.ryuqq.retention.core.model.ManagedResource;
import com.ryuqq.retention.core.model.RetentionPolicy;

/**
 * ManagedResource 정책 변경 필터 (개수 기반 정리 경로).
 *
 * <p><strong>판정 규칙:</strong></p>
 * <ul>
 *   <li>CREATE: limit이 하나라도 선언된 경우 ADMIT</li>
 *   <li>UPDATE: 정리 대상이 늘어날 수 있는 변경만 ADMIT
 *     <ul>
 *       <li>정책이 새로 생기고 limit이 하나라도 설정됨</li>
 *       <li>없던 limit이 새로 설정됨</li>
 *       <li>기존 limit 값이 감소함</li>
 *     </ul>
 *   </li>
 *   <li>DELETE: 항상 DROP</li>
 * </ul>
 *
 * <p>정책 제거, limit 증가, 관련 없는 필드 변경은 DROP합니다.</p>
 *
 * @author Retention Team
 * @since 1.0.0
 */
public final class ManagedResourcePredicates implements EventPredicate<ManagedResource> {

    private static final ManagedResourcePredicates INSTANCE = new ManagedResourcePredicates();

    private ManagedResourcePredicates() {
    }

    /**
     * 인스턴스 조회.
     *
     * @return ManagedResourcePredicates
     */
    public static ManagedResourcePredicates instance() {
        return INSTANCE;
    }

    @Override
    public Decision onCreate(ManagedResource created) {
        return Decision.of(created.declaresLimits());
    }

    @Override
    public Decision onUpdate(ManagedResource before, ManagedResource after) {
        RetentionPolicy oldPolicy = before.retention();
        RetentionPolicy newPolicy = after.retention();

        if (newPolicy == null) {
            return Decision.DROP;
        }
        if (oldPolicy == null) {
            return Decision.of(newPolicy.hasLimits());
        }

        return Decision.of(
            tightened(oldPolicy.failedLimit(), newPolicy.failedLimit())
                || tightened(oldPolicy.succeededLimit(), newPolicy.succeededLimit())
        );
    }

    @Override
    public Decision onDelete(ManagedResource deleted) {
        // 템플릿 삭제 시 정리할 것이 없음
        return Decision.DROP;
    }

    /**
     * limit이 새로 설정되었거나 감소했는지 확인.
     */
    private static boolean tightened(Integer oldLimit, Integer newLimit) {
        if (newLimit == null) {
            return false;
        }
        return oldLimit == null || newLimit < oldLimit;
    }
}
