package com.ryuqq.retention.core.result;

/**
 * 외부로 보고되는 리컨실 오류 분류.
 *
 * <p>리소스 없음(NotFound)은 항상 성공으로 처리되므로 여기에 포함되지 않습니다.</p>
 *
 * @author Retention Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /**
     * 조회 또는 삭제 실패 (연결, 충돌, 권한 등).
     */
    STORE_ERROR,

    /**
     * 리컨실 시간 예산 초과.
     */
    TIMEOUT,

    /**
     * 분류되지 않은 런타임 오류.
     */
    UNEXPECTED
}
