package com.ryuqq.retention.core.event;

/**
 * 이벤트 분류 결과.
 *
 * @author Retention Team
 * @since 1.0.0
 */
public enum Decision {

    /**
     * 리컨실 스트림에 포함.
     */
    ADMIT,

    /**
     * 버림 (리컨실 불필요).
     */
    DROP;

    /**
     * boolean 판정을 Decision으로 변환.
     *
     * @param admitted 포함 여부
     * @return admitted이면 ADMIT, 아니면 DROP
     */
    public static Decision of(boolean admitted) {
        return admitted ? ADMIT : DROP;
    }

    /**
     * 포함 여부.
     *
     * @return ADMIT인 경우 true
     */
    public boolean isAdmitted() {
        return this == ADMIT;
    }
}
