package com.ryuqq.retention.application.controller;

import com.ryuqq.retention.application.reconciler.Reconciler;
import com.ryuqq.retention.application.reconciler.TtlReconciler;
import com.ryuqq.retention.core.event.EventClassifier;
import com.ryuqq.retention.core.event.ExecutionResourcePredicates;
import com.ryuqq.retention.core.event.KeyMappers;
import com.ryuqq.retention.core.event.ManagedResourcePredicates;
import com.ryuqq.retention.core.model.ExecutionResource;
import com.ryuqq.retention.core.model.ManagedResource;
import com.ryuqq.retention.core.model.ResourceKind;
import com.ryuqq.retention.core.spi.ResourceStore;
import com.ryuqq.retention.core.spi.WorkQueue;

import java.time.Clock;
import java.util.List;

/**
 * 보존 정책 컨트롤러 조립.
 *
 * <p><strong>제공 컨트롤러:</strong></p>
 * <ul>
 *   <li>TTL 정리: ExecutionResource 완료 전이를 감시하고 자기 키로 TtlReconciler에 전달</li>
 *   <li>개수 제한 정리: ManagedResource 정책 강화(자기 키)와 ExecutionResource 완료 전이(소유자 키)를 감시</li>
 * </ul>
 *
 * <p>개수 제한 정리의 리컨실 본문은 호출자가 제공합니다.</p>
 *
 * @author Retention Team
 * @since 1.0.0
 */
public final class RetentionControllers {

    /** TTL 정리 컨트롤러 이름. */
    public static final String TTL_CLEANUP = "execution-ttl-cleanup-controller";

    /** 개수 제한 정리 컨트롤러 이름. */
    public static final String LIMIT_CLEANUP = "managed-limit-cleanup-controller";

    // Utility class - prevent instantiation
    private RetentionControllers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * TTL 정리 컨트롤러 생성.
     *
     * @param store ExecutionResource 저장소
     * @param queue 요청 큐
     * @param clock 현재 시각 제공자
     * @return Controller
     */
    public static Controller ttlCleanup(ResourceStore<ExecutionResource> store, WorkQueue queue, Clock clock) {
        return new Controller(
            TTL_CLEANUP,
            new TtlReconciler(store, clock),
            queue,
            List.of(ttlExecutionClassifier())
        );
    }

    /**
     * 개수 제한 정리 컨트롤러 생성.
     *
     * @param reconciler 소유자 키를 받아 오래된 실행을 정리하는 리컨실러
     * @param queue 요청 큐
     * @return Controller
     */
    public static Controller limitCleanup(Reconciler reconciler, WorkQueue queue) {
        return new Controller(
            LIMIT_CLEANUP,
            reconciler,
            queue,
            List.of(limitManagedClassifier(), limitExecutionClassifier())
        );
    }

    /**
     * TTL 경로의 ExecutionResource 분류기 (자기 키).
     *
     * @return EventClassifier
     */
    public static EventClassifier<ExecutionResource> ttlExecutionClassifier() {
        return new EventClassifier<>(
            ResourceKind.EXECUTION,
            ExecutionResource.class,
            ExecutionResourcePredicates.forTtlCleanup(),
            KeyMappers.self()
        );
    }

    /**
     * 개수 제한 경로의 ManagedResource 분류기 (자기 키).
     *
     * @return EventClassifier
     */
    public static EventClassifier<ManagedResource> limitManagedClassifier() {
        return new EventClassifier<>(
            ResourceKind.MANAGED,
            ManagedResource.class,
            ManagedResourcePredicates.instance(),
            KeyMappers.self()
        );
    }

    /**
     * 개수 제한 경로의 ExecutionResource 분류기 (소유자 키로 재매핑).
     *
     * @return EventClassifier
     */
    public static EventClassifier<ExecutionResource> limitExecutionClassifier() {
        return new EventClassifier<>(
            ResourceKind.EXECUTION,
            ExecutionResource.class,
            ExecutionResourcePredicates.forLimitCleanup(),
            KeyMappers.owner()
        );
    }
}
