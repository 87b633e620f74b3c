package com.ryuqq.retention.core.event;

/**
 * 리소스 변경 알림 유형.
 *
 * @author Retention Team
 * @since 1.0.0
 */
public enum ChangeType {

    /**
     * 생성.
     */
    CREATE,

    /**
     * 변경.
     */
    UPDATE,

    /**
     * 삭제.
     */
    DELETE
}
