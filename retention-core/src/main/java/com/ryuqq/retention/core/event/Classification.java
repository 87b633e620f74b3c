package com.ryuqq.retention.core.event;

import com.ryuqq.retention.core.model.ResourceKey;

import java.util.Optional;

/**
 * 분류 결과와 재매핑된 리컨실 키.
 *
 * <p>ADMIT이면 key가 반드시 존재하고, DROP이면 key는 없습니다.</p>
 *
 * @param decision 분류 결과
 * @param key 리컨실 요청 키 (DROP이면 null)
 *
 * @author Retention Team
 * @since 1.0.0
 */
public record Classification(
    Decision decision,
    ResourceKey key
) {

    private static final Classification DROPPED = new Classification(Decision.DROP, null);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException decision과 key 조합이 유효하지 않은 경우
     */
    public Classification {
        if (decision == null) {
            throw new IllegalArgumentException("decision cannot be null");
        }
        if (decision.isAdmitted() && key == null) {
            throw new IllegalArgumentException("key is required for ADMIT");
        }
        if (!decision.isAdmitted() && key != null) {
            throw new IllegalArgumentException("key must be absent for DROP");
        }
    }

    /**
     * 포함 결과 생성.
     *
     * @param key 리컨실 요청 키
     * @return Classification
     */
    public static Classification admitted(ResourceKey key) {
        return new Classification(Decision.ADMIT, key);
    }

    /**
     * 버림 결과.
     *
     * @return Classification
     */
    public static Classification dropped() {
        return DROPPED;
    }

    /**
     * 포함 여부.
     *
     * @return ADMIT인 경우 true
     */
    public boolean isAdmitted() {
        return decision.isAdmitted();
    }

    /**
     * 리컨실 요청 키 조회.
     *
     * @return key (DROP이면 empty)
     */
    public Optional<ResourceKey> findKey() {
        return Optional.ofNullable(key);
    }
}
