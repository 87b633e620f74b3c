package com.ryuqq.retention.core.result;

import com.ryuqq.retention.core.model.ResourceKey;

/**
 * 완료 결과 (추가 작업 없음).
 *
 * @param key 리컨실 대상 키
 * @param message 완료 사유 (선택, null 가능)
 *
 * @author Retention Team
 * @since 1.0.0
 */
public record Done(
    ResourceKey key,
    String message
) implements ReconcileResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException key가 null인 경우
     */
    public Done {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        // message는 null 허용
    }

    /**
     * 메시지 없이 완료 결과 생성.
     *
     * @param key 리컨실 대상 키
     * @return Done 인스턴스
     */
    public static Done of(ResourceKey key) {
        return new Done(key, null);
    }
}
