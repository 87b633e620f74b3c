package com.ryuqq.retention.core.event;

import com.ryuqq.retention.core.model.Resource;

/**
 * 리소스 변경 알림 (old, new 스냅샷 쌍).
 *
 * <p><strong>유형별 스냅샷:</strong></p>
 * <ul>
 *   <li>CREATE: newObject만 존재</li>
 *   <li>UPDATE: oldObject, newObject 모두 존재</li>
 *   <li>DELETE: oldObject만 존재 (마지막으로 관측된 상태)</li>
 * </ul>
 *
 * <p>감시 메커니즘이 불완전한 알림을 전달할 수 있으므로 스냅샷 누락을 생성 시점에 거부하지 않습니다.
 * 불완전한 이벤트는 분류기에서 DROP으로 처리됩니다.</p>
 *
 * @param type 변경 유형
 * @param oldObject 변경 전 스냅샷 (null 가능)
 * @param newObject 변경 후 스냅샷 (null 가능)
 * @param <R> 리소스 타입
 *
 * @author Retention Team
 * @since 1.0.0
 */
public record ResourceEvent<R extends Resource>(
    ChangeType type,
    R oldObject,
    R newObject
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException type이 null인 경우
     */
    public ResourceEvent {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        // 스냅샷은 null 허용 (분류기가 DROP 처리)
    }

    /**
     * 생성 이벤트.
     *
     * @param created 생성된 리소스
     * @param <R> 리소스 타입
     * @return ResourceEvent
     */
    public static <R extends Resource> ResourceEvent<R> created(R created) {
        return new ResourceEvent<>(ChangeType.CREATE, null, created);
    }

    /**
     * 변경 이벤트.
     *
     * @param before 변경 전 스냅샷
     * @param after 변경 후 스냅샷
     * @param <R> 리소스 타입
     * @return ResourceEvent
     */
    public static <R extends Resource> ResourceEvent<R> updated(R before, R after) {
        return new ResourceEvent<>(ChangeType.UPDATE, before, after);
    }

    /**
     * 삭제 이벤트.
     *
     * @param deleted 마지막으로 관측된 스냅샷
     * @param <R> 리소스 타입
     * @return ResourceEvent
     */
    public static <R extends Resource> ResourceEvent<R> deleted(R deleted) {
        return new ResourceEvent<>(ChangeType.DELETE, deleted, null);
    }

    /**
     * 이벤트가 가리키는 최신 스냅샷.
     *
     * <p>DELETE는 oldObject, 그 외에는 newObject를 반환합니다.</p>
     *
     * @return 최신 스냅샷 (null 가능)
     */
    public R latest() {
        return type == ChangeType.DELETE ? oldObject : newObject;
    }
}
