package com.ryuqq.retention.core.model;

/**
 * 보존 정책을 선언하는 템플릿 리소스 (예: Build).
 *
 * <p>이 코어에서는 읽기 전용입니다. 외부에서 변경되며,
 * 정책 변경 이벤트는 개수 기반 정리 컨트롤러로 전달됩니다.</p>
 *
 * @param key 리소스 식별자
 * @param retention 보존 정책 (null 가능)
 *
 * @author Retention Team
 * @since 1.0.0
 */
public record ManagedResource(
    ResourceKey key,
    RetentionPolicy retention
) implements Resource {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException key가 null인 경우
     */
    public ManagedResource {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        // retention은 null 허용
    }

    /**
     * ManagedResource 생성.
     *
     * @param key 리소스 식별자
     * @param retention 보존 정책 (null 가능)
     * @return ManagedResource 인스턴스
     */
    public static ManagedResource of(ResourceKey key, RetentionPolicy retention) {
        return new ManagedResource(key, retention);
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.MANAGED;
    }

    /**
     * 개수 제한이 있는 보존 정책을 선언했는지 확인.
     *
     * @return retention이 있고 limit이 하나라도 설정된 경우 true
     */
    public boolean declaresLimits() {
        return retention != null && retention.hasLimits();
    }
}
