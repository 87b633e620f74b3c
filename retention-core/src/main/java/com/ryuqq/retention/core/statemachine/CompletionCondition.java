package com.ryuqq.retention.core.statemachine;

/**
 * ExecutionResource의 완료 조건 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>UNKNOWN → TRUE (성공)</li>
 *   <li>UNKNOWN → FALSE (실패)</li>
 *   <li><strong>역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * UNKNOWN
 *    │
 *    ├─► TRUE  (성공, completionTime 기록)
 *    │
 *    └─► FALSE (실패, completionTime 기록)
 *
 * 금지된 전이:
 * - TRUE → UNKNOWN ❌
 * - FALSE → UNKNOWN ❌
 * - TRUE ↔ FALSE ❌
 * </pre>
 *
 * @author Retention Team
 * @since 1.0.0
 */
public enum CompletionCondition {

    /**
     * 실행 중 (아직 결과 없음).
     */
    UNKNOWN,

    /**
     * 성공.
     */
    TRUE,

    /**
     * 실패.
     */
    FALSE;

    /**
     * 종료 상태인지 확인.
     *
     * @return TRUE 또는 FALSE인 경우 true
     */
    public boolean isTerminal() {
        return this == TRUE || this == FALSE;
    }
}
