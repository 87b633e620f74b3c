package com.ryuqq.retention.core.statemachine;

/**
 * 완료 조건 전이 검증 및 감지.
 *
 * <p>분류기는 상태 레벨이 아니라 <strong>전이(edge)</strong>에 반응해야 합니다.
 * 이미 종료된 리소스의 반복 업데이트를 다시 받아들이면 리컨실이 끝없이 반복됩니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>(없음) → UNKNOWN, TRUE, FALSE</li>
 *   <li>UNKNOWN → UNKNOWN, TRUE, FALSE</li>
 *   <li>TRUE → TRUE, FALSE → FALSE (동일 상태 재보고)</li>
 * </ul>
 *
 * @author Retention Team
 * @since 1.0.0
 */
public final class ConditionTransition {

    // Utility class - prevent instantiation
    private ConditionTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 완료 전이(UNKNOWN → 종료 상태)인지 확인.
     *
     * <p>이전 또는 새 조건이 없으면 완료 전이로 보지 않습니다.</p>
     *
     * @param from 이전 조건 (null 가능)
     * @param to 새 조건 (null 가능)
     * @return UNKNOWN에서 TRUE 또는 FALSE로 바뀐 경우 true
     */
    public static boolean isCompletion(CompletionCondition from, CompletionCondition to) {
        if (from == null || to == null) {
            return false;
        }
        return from == CompletionCondition.UNKNOWN && to.isTerminal();
    }

    /**
     * 조건 전이가 유효한지 검증.
     *
     * @param from 현재 조건 (null이면 아직 보고되지 않음)
     * @param to 다음 조건
     * @throws IllegalArgumentException to가 null인 경우
     * @throws IllegalStateException 종료 상태에서 다른 상태로 전이하려는 경우
     */
    public static void validate(CompletionCondition from, CompletionCondition to) {
        if (to == null) {
            throw new IllegalArgumentException("target condition cannot be null (from: " + from + ")");
        }
        if (from == null || from == CompletionCondition.UNKNOWN) {
            return;
        }
        if (from != to) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal condition: %s → %s", from, to)
            );
        }
    }
}
