package com.ryuqq.retention.core.event;

import com.ryuqq.retention.core.model.Resource;
import com.ryuqq.retention.core.model.ResourceKind;

import java.util.Optional;

/**
 * 한 리소스 종류의 변경 알림을 리컨실 요청으로 분류합니다.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * classify(event)
 *   ↓
 * 1. 스냅샷 타입 확인 (다른 종류면 DROP)
 *   ↓
 * 2. predicate.evaluate(event) → ADMIT / DROP
 *   ↓
 * 3. keyMapper.map(latest) → 요청 키 (없으면 DROP)
 * </pre>
 *
 * <p>어떤 입력에도 예외를 던지지 않으며, 입력에 대한 순수 함수입니다.</p>
 *
 * @param <R> 리소스 타입
 *
 * @author Retention Team
 * @since 1.0.0
 */
public final class EventClassifier<R extends Resource> {

    private final ResourceKind kind;
    private final Class<R> resourceType;
    private final EventPredicate<R> predicate;
    private final KeyMapper<R> keyMapper;

    /**
     * 생성자.
     *
     * @param kind 감시 대상 리소스 종류
     * @param resourceType 스냅샷 타입
     * @param predicate 이벤트 필터
     * @param keyMapper 요청 키 변환기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public EventClassifier(ResourceKind kind, Class<R> resourceType, EventPredicate<R> predicate, KeyMapper<R> keyMapper) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (resourceType == null) {
            throw new IllegalArgumentException("resourceType cannot be null");
        }
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
        if (keyMapper == null) {
            throw new IllegalArgumentException("keyMapper cannot be null");
        }
        this.kind = kind;
        this.resourceType = resourceType;
        this.predicate = predicate;
        this.keyMapper = keyMapper;
    }

    /**
     * 감시 대상 리소스 종류.
     *
     * @return ResourceKind
     */
    public ResourceKind kind() {
        return kind;
    }

    /**
     * 변경 알림 분류.
     *
     * @param event 변경 알림 (null 가능)
     * @return 분류 결과 (ADMIT이면 재매핑된 키 포함)
     */
    public Classification classify(ResourceEvent<?> event) {
        Optional<ResourceEvent<R>> typed = narrow(event);
        if (typed.isEmpty()) {
            return Classification.dropped();
        }

        ResourceEvent<R> resourceEvent = typed.get();
        if (!predicate.evaluate(resourceEvent).isAdmitted()) {
            return Classification.dropped();
        }

        return keyMapper.map(resourceEvent.latest())
            .map(Classification::admitted)
            .orElseGet(Classification::dropped);
    }

    /**
     * 스냅샷이 모두 이 분류기의 타입인지 확인하고 타입을 좁힘.
     */
    private Optional<ResourceEvent<R>> narrow(ResourceEvent<?> event) {
        if (event == null) {
            return Optional.empty();
        }
        Resource oldObject = event.oldObject();
        Resource newObject = event.newObject();
        if (!accepts(oldObject) || !accepts(newObject)) {
            return Optional.empty();
        }
        return Optional.of(new ResourceEvent<>(
            event.type(),
            oldObject == null ? null : resourceType.cast(oldObject),
            newObject == null ? null : resourceType.cast(newObject)
        ));
    }

    private boolean accepts(Resource snapshot) {
        return snapshot == null || (resourceType.isInstance(snapshot) && snapshot.kind() == kind);
    }
}
