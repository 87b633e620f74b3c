package com.ryuqq.retention.application.reconciler;

import com.ryuqq.retention.core.exception.ResourceNotFoundException;
import com.ryuqq.retention.core.exception.StoreException;
import com.ryuqq.retention.core.model.ExecutionResource;
import com.ryuqq.retention.core.model.ResourceKey;
import com.ryuqq.retention.core.model.ResourceKind;
import com.ryuqq.retention.core.policy.DurationPolicyResolver;
import com.ryuqq.retention.core.policy.EffectiveTtl;
import com.ryuqq.retention.core.policy.TtlEvaluation;
import com.ryuqq.retention.core.policy.TtlEvaluator;
import com.ryuqq.retention.core.result.ReconcileResult;
import com.ryuqq.retention.core.spi.ResourceStore;
import com.ryuqq.retention.core.statemachine.TtlState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * ExecutionResource TTL 리컨실러.
 *
 * <p>종료된 실행 리소스가 보존 기간을 넘겼으면 삭제하고, 아니면 정확한 만료 시각에 다시 확인하도록 예약합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * reconcile(key)
 *   ↓
 * 1. store.get(key)              → 없으면 NOT_FOUND (Done)
 *   ↓
 * 2. DurationPolicyResolver      → 결과별 TTL 확정
 *   ↓
 * 3. TtlEvaluator.evaluate       → UNKNOWN / NO_TTL / AWAITING_EXPIRY / EXPIRED
 *   ↓
 * 4. EXPIRED → store.delete(key) (NotFound는 성공 처리)
 *   ↓
 * 5. SchedulingAdapter           → Done / RequeueAfter / Failure
 * </pre>
 *
 * <p><strong>멱등성:</strong></p>
 * <ul>
 *   <li>매번 최신 상태를 다시 로드하므로 중복/동시 전달에 안전</li>
 *   <li>다른 주체가 먼저 삭제한 경우 NotFound를 성공으로 처리</li>
 *   <li>내부 재시도 없음: 저장소 오류는 Failure로 보고하여 외부 큐가 재전달</li>
 * </ul>
 *
 * @author Retention Team
 * @since 1.0.0
 */
public final class TtlReconciler implements Reconciler {

    private static final Logger log = LoggerFactory.getLogger(TtlReconciler.class);

    private final ResourceStore<ExecutionResource> store;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param store ExecutionResource 저장소
     * @param clock 현재 시각 제공자
     * @throws IllegalArgumentException 의존성이 null이거나 저장소 종류가 EXECUTION이 아닌 경우
     */
    public TtlReconciler(ResourceStore<ExecutionResource> store, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (store.kind() != ResourceKind.EXECUTION) {
            throw new IllegalArgumentException("store must hold EXECUTION resources (current: " + store.kind() + ")");
        }
        this.store = store;
        this.clock = clock;
    }

    @Override
    public ReconcileResult reconcile(ResourceKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }

        log.debug("Start reconciling execution ttl: namespace={}, name={}", key.namespace(), key.name());
        try {
            TtlEvaluation evaluation = evaluate(key);
            if (evaluation.state() == TtlState.EXPIRED) {
                deleteExpired(key);
            }

            ReconcileResult result = SchedulingAdapter.toResult(key, evaluation);
            log.debug("Finish reconciling execution ttl: namespace={}, name={}, state={}",
                key.namespace(), key.name(), evaluation.state());
            return result;

        } catch (StoreException e) {
            log.debug("Store error while reconciling execution ttl: namespace={}, name={}",
                key.namespace(), key.name(), e);
            return SchedulingAdapter.fromException(key, e);
        }
    }

    /**
     * 최신 상태 로드 후 TTL 판정.
     *
     * @param key 리컨실 대상 키
     * @return 판정 결과
     */
    private TtlEvaluation evaluate(ResourceKey key) {
        Optional<ExecutionResource> loaded = store.get(key);
        if (loaded.isEmpty()) {
            return TtlEvaluation.of(TtlState.NOT_FOUND);
        }

        ExecutionResource resource = loaded.get();
        EffectiveTtl ttl = DurationPolicyResolver.resolve(resource);
        return TtlEvaluator.evaluate(resource, ttl, clock.instant());
    }

    /**
     * 만료된 리소스 삭제.
     *
     * <p>이미 삭제된 경우(NotFound)는 성공으로 처리합니다. 그 외 오류는 호출자에게 전파합니다.</p>
     *
     * @param key 삭제 대상 키
     */
    private void deleteExpired(ResourceKey key) {
        log.info("Deleting execution as ttl has been reached: namespace={}, name={}", key.namespace(), key.name());
        try {
            store.delete(key);
        } catch (ResourceNotFoundException e) {
            // 동시 삭제: 이미 목적 달성
            log.debug("Execution already removed: namespace={}, name={}", key.namespace(), key.name());
        }
    }
}
