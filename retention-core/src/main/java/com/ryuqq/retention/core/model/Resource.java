package com.ryuqq.retention.core.model;

/**
 * 리컨실러가 다루는 리소스의 공통 계약.
 *
 * <p>구현체는 불변 스냅샷이어야 합니다. 이벤트 분류기는 (old, new) 스냅샷 쌍을
 * 비교하므로, 스냅샷이 변경되면 비교 결과가 의미를 잃습니다.</p>
 *
 * @author Retention Team
 * @since 1.0.0
 */
public interface Resource {

    /**
     * 리소스 식별자.
     *
     * @return ResourceKey
     */
    ResourceKey key();

    /**
     * 리소스 종류.
     *
     * @return ResourceKind
     */
    ResourceKind kind();
}
