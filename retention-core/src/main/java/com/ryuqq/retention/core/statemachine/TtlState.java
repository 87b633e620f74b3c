package com.ryuqq.retention.core.statemachine;

/**
 * TTL 리컨실 1회의 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * (요청)
 *    │
 *    ├─► NOT_FOUND        (이미 삭제됨, no-op)
 *    │
 *    ▼
 * LOADED
 *    │
 *    ├─► UNKNOWN          (아직 종료 안 됨, no-op)
 *    ├─► NO_TTL           (해당 결과에 TTL 없음, no-op)
 *    ├─► AWAITING_EXPIRY  (만료 전, 남은 시간 후 재확인)
 *    └─► EXPIRED          (만료, 즉시 삭제)
 * </pre>
 *
 * @author Retention Team
 * @since 1.0.0
 */
public enum TtlState {

    /**
     * 리소스 없음 (이미 삭제됨).
     */
    NOT_FOUND,

    /**
     * 리소스 로드 완료 (중간 상태).
     */
    LOADED,

    /**
     * 완료 조건이 아직 종료 상태가 아님.
     */
    UNKNOWN,

    /**
     * 해당 결과에 적용할 TTL이 없음.
     */
    NO_TTL,

    /**
     * TTL 만료 전 (재확인 예약 필요).
     */
    AWAITING_EXPIRY,

    /**
     * TTL 만료 (삭제 필요).
     */
    EXPIRED;

    /**
     * 종료 상태인지 확인.
     *
     * @return LOADED가 아닌 경우 true
     */
    public boolean isTerminal() {
        return this != LOADED;
    }
}
