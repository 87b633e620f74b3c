package com.ryuqq.retention.core.model;

import com.ryuqq.retention.core.statemachine.CompletionCondition;
import com.ryuqq.retention.core.statemachine.ConditionTransition;

import java.time.Instant;
import java.util.Optional;

/**
 * ManagedResource가 소유하는 개별 실행 리소스 (예: BuildRun).
 *
 * <p>외부 실행 엔진이 생성하며, 완료 조건은 UNKNOWN에서 종료 상태로 정확히 한 번 전이합니다.
 * TTL 만료 시 이 코어가 삭제하거나, 외부에서 삭제됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>completionTime은 condition이 종료 상태(TRUE, FALSE)일 때만, 그리고 반드시 존재</li>
 *   <li>condition 전이는 {@link #complete(CompletionCondition, Instant)}로만 수행하며 역방향 불가</li>
 * </ul>
 *
 * @param key 리소스 식별자
 * @param ownerName 소유 ManagedResource 이름 (null 또는 빈 문자열 가능)
 * @param retention 자체 TTL 설정 (null 가능)
 * @param condition 완료 조건 (null이면 아직 보고되지 않음)
 * @param completionTime 완료 시각 (종료 상태에서만 존재)
 * @param embeddedPolicy 생성 시점 소유자 정책 스냅샷 (null 가능)
 *
 * @author Retention Team
 * @since 1.0.0
 */
public record ExecutionResource(
    ResourceKey key,
    String ownerName,
    TtlRetention retention,
    CompletionCondition condition,
    Instant completionTime,
    RetentionPolicy embeddedPolicy
) implements Resource {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException key가 null이거나 completionTime 불변식을 위반한 경우
     */
    public ExecutionResource {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        boolean terminal = condition != null && condition.isTerminal();
        if (terminal && completionTime == null) {
            throw new IllegalArgumentException("completionTime is required for terminal condition " + condition);
        }
        if (!terminal && completionTime != null) {
            throw new IllegalArgumentException("completionTime must be absent for non-terminal condition " + condition);
        }
    }

    /**
     * 실행 중(UNKNOWN) 상태의 리소스 생성.
     *
     * @param key 리소스 식별자
     * @param ownerName 소유자 이름
     * @param retention 자체 TTL 설정 (null 가능)
     * @param embeddedPolicy 소유자 정책 스냅샷 (null 가능)
     * @return ExecutionResource 인스턴스
     */
    public static ExecutionResource running(
        ResourceKey key,
        String ownerName,
        TtlRetention retention,
        RetentionPolicy embeddedPolicy
    ) {
        return new ExecutionResource(key, ownerName, retention, CompletionCondition.UNKNOWN, null, embeddedPolicy);
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.EXECUTION;
    }

    /**
     * 종료 상태로 전이한 새 스냅샷 생성.
     *
     * @param outcome 종료 조건 (TRUE 또는 FALSE)
     * @param at 완료 시각
     * @return 전이된 새 ExecutionResource
     * @throws IllegalArgumentException outcome이 종료 상태가 아니거나 at이 null인 경우
     * @throws IllegalStateException 이미 다른 종료 상태인 경우
     */
    public ExecutionResource complete(CompletionCondition outcome, Instant at) {
        if (outcome == null || !outcome.isTerminal()) {
            throw new IllegalArgumentException("outcome must be TRUE or FALSE (current: " + outcome + ")");
        }
        if (at == null) {
            throw new IllegalArgumentException("completion time cannot be null");
        }
        ConditionTransition.validate(condition, outcome);
        if (condition == outcome) {
            return this;
        }
        return new ExecutionResource(key, ownerName, retention, outcome, at, embeddedPolicy);
    }

    /**
     * 완료 조건 조회.
     *
     * @return 완료 조건 (보고되지 않았으면 empty)
     */
    public Optional<CompletionCondition> findCondition() {
        return Optional.ofNullable(condition);
    }

    /**
     * 소유자 참조가 있는지 확인.
     *
     * @return ownerName이 비어있지 않은 경우 true
     */
    public boolean hasOwner() {
        return ownerName != null && !ownerName.isBlank();
    }

    /**
     * 종료 상태인지 확인.
     *
     * @return condition이 TRUE 또는 FALSE인 경우 true
     */
    public boolean isCompleted() {
        return condition != null && condition.isTerminal();
    }
}
