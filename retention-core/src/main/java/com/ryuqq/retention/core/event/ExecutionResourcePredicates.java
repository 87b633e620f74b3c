package com.ryuqq.retention.core.event;

import com.ryuqq.retention.core.model.ExecutionResource;
import com.ryuqq.retention.core.statemachine.ConditionTransition;

/**
 * ExecutionResource 완료 전이 필터.
 *
 * <p>완료 조건이 UNKNOWN에서 종료 상태(TRUE, FALSE)로 바뀌는 단 한 번의 전이에만 반응합니다.
 * 이미 종료된 리소스의 후속 업데이트는 다른 필드가 바뀌어도 DROP입니다.</p>
 *
 * <p><strong>두 가지 경로:</strong></p>
 * <ul>
 *   <li>{@link #forTtlCleanup()}: TTL 정리. 자기 자신의 키로 리컨실</li>
 *   <li>{@link #forLimitCleanup()}: 개수 기반 정리. 소유자 참조가 없으면 DROP</li>
 * </ul>
 *
 * <p>CREATE, DELETE는 두 경로 모두 DROP입니다.</p>
 *
 * @author Retention Team
 * @since 1.0.0
 */
public final class ExecutionResourcePredicates implements EventPredicate<ExecutionResource> {

    private static final ExecutionResourcePredicates TTL_CLEANUP = new ExecutionResourcePredicates(false);
    private static final ExecutionResourcePredicates LIMIT_CLEANUP = new ExecutionResourcePredicates(true);

    private final boolean ownerRequired;

    private ExecutionResourcePredicates(boolean ownerRequired) {
        this.ownerRequired = ownerRequired;
    }

    /**
     * TTL 정리 경로용 필터.
     *
     * @return ExecutionResourcePredicates
     */
    public static ExecutionResourcePredicates forTtlCleanup() {
        return TTL_CLEANUP;
    }

    /**
     * 개수 기반 정리 경로용 필터.
     *
     * @return ExecutionResourcePredicates
     */
    public static ExecutionResourcePredicates forLimitCleanup() {
        return LIMIT_CLEANUP;
    }

    @Override
    public Decision onCreate(ExecutionResource created) {
        return Decision.DROP;
    }

    @Override
    public Decision onUpdate(ExecutionResource before, ExecutionResource after) {
        if (ownerRequired && !after.hasOwner()) {
            return Decision.DROP;
        }
        return Decision.of(ConditionTransition.isCompletion(before.condition(), after.condition()));
    }

    @Override
    public Decision onDelete(ExecutionResource deleted) {
        return Decision.DROP;
    }
}
