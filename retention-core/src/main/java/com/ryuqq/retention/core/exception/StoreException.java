package com.ryuqq.retention.core.exception;

/**
 * 리소스 저장소 호출 실패.
 *
 * <p>연결 오류, 쓰기 충돌, 권한 부족 등 조회/삭제가 실패한 모든 경우를 나타냅니다.
 * 리컨실러는 이 예외를 재시도 가능한 오류로 보고합니다.</p>
 *
 * @author Retention Team
 * @since 1.0.0
 */
public class StoreException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     */
    public StoreException(String message) {
        super(message);
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param message 오류 메시지
     * @param cause 원인
     */
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
