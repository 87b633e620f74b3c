package com.ryuqq.retention.core.event;

import com.ryuqq.retention.core.model.Resource;
import com.ryuqq.retention.core.model.ResourceKey;

import java.util.Optional;

/**
 * 리소스 스냅샷을 리컨실 요청 키로 변환.
 *
 * <p>키를 만들 수 없으면(예: 소유자 참조 없음) empty를 반환하며, 예외를 던지지 않습니다.</p>
 *
 * @param <R> 리소스 타입
 *
 * @author Retention Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface KeyMapper<R extends Resource> {

    /**
     * 리컨실 요청 키 계산.
     *
     * @param resource 리소스 스냅샷
     * @return 요청 키 (없으면 empty)
     */
    Optional<ResourceKey> map(R resource);
}
