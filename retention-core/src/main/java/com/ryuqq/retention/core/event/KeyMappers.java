package com.ryuqq.retention.core.event;

import com.ryuqq.retention.core.model.ExecutionResource;
import com.ryuqq.retention.core.model.Resource;
import com.ryuqq.retention.core.model.ResourceKey;

import java.util.Optional;

/**
 * 기본 {@link KeyMapper} 모음.
 *
 * @author Retention Team
 * @since 1.0.0
 */
public final class KeyMappers {

    // Utility class - prevent instantiation
    private KeyMappers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 리소스 자신의 키.
     *
     * @param <R> 리소스 타입
     * @return KeyMapper
     */
    public static <R extends Resource> KeyMapper<R> self() {
        return resource -> Optional.ofNullable(resource).map(Resource::key);
    }

    /**
     * ExecutionResource의 소유자 키 (같은 네임스페이스, ownerName).
     *
     * <p>소유자 참조가 비어 있거나 키 이름으로 쓸 수 없으면 empty입니다.</p>
     *
     * @return KeyMapper
     */
    public static KeyMapper<ExecutionResource> owner() {
        return execution -> {
            if (execution == null || !ResourceKey.isValidName(execution.ownerName())) {
                return Optional.empty();
            }
            return Optional.of(ResourceKey.of(execution.key().namespace(), execution.ownerName()));
        };
    }
}
