package com.ryuqq.retention.core.exception;

import com.ryuqq.retention.core.model.ResourceKey;

/**
 * 대상 리소스가 저장소에 없음.
 *
 * <p>알림과 조회/삭제 사이에 다른 주체가 리소스를 지운 경우입니다.
 * 삭제가 목적인 리컨실러에게는 성공과 같으며, 외부로 보고되지 않습니다.</p>
 *
 * @author Retention Team
 * @since 1.0.0
 */
public class ResourceNotFoundException extends StoreException {

    private final ResourceKey key;

    /**
     * 생성자.
     *
     * @param key 찾지 못한 리소스 키
     */
    public ResourceNotFoundException(ResourceKey key) {
        super("Resource not found: " + key);
        this.key = key;
    }

    /**
     * 찾지 못한 리소스 키.
     *
     * @return ResourceKey
     */
    public ResourceKey getKey() {
        return key;
    }
}
