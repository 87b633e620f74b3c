package com.ryuqq.retention.core.model;

/**
 * 감시 대상 리소스 종류.
 *
 * <p><strong>관계:</strong></p>
 * <pre>
 * MANAGED (1) ──owns──► (N) EXECUTION
 * </pre>
 *
 * @author Retention Team
 * @since 1.0.0
 */
public enum ResourceKind {

    /**
     * 보존 정책을 선언하는 템플릿 리소스 (primary).
     */
    MANAGED,

    /**
     * ManagedResource가 소유하는 개별 실행 리소스 (secondary).
     */
    EXECUTION
}
