package com.ryuqq.retention.application.reconciler;

import com.ryuqq.retention.core.model.ResourceKey;
import com.ryuqq.retention.core.result.ReconcileResult;

/**
 * 리컨실 요청 1건을 처리하는 컴포넌트.
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>매 호출마다 저장소에서 최신 상태를 다시 로드합니다 (이벤트 스냅샷에 의존하지 않음)</li>
 *   <li>같은 키에 대한 중복/동시 호출에 안전해야 합니다 (멱등)</li>
 *   <li>저장소 오류는 예외가 아니라 {@link com.ryuqq.retention.core.result.Failure}로 보고합니다</li>
 *   <li>대기가 필요하면 블로킹하지 않고 {@link com.ryuqq.retention.core.result.RequeueAfter}를 반환합니다</li>
 * </ul>
 *
 * @author Retention Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Reconciler {

    /**
     * 리컨실 실행.
     *
     * @param key 리컨실 대상 키
     * @return 리컨실 결과 (Done, RequeueAfter, Failure)
     * @throws IllegalArgumentException key가 null인 경우
     */
    ReconcileResult reconcile(ResourceKey key);
}
