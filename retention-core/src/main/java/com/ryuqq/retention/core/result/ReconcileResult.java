package com.ryuqq.retention.core.result;

import com.ryuqq.retention.core.model.ResourceKey;

/**
 * 리컨실 1회의 결과.
 *
 * <p>ReconcileResult는 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Done}: 더 할 일 없음</li>
 *   <li>{@link RequeueAfter}: 지정 시간 후 다시 리컨실</li>
 *   <li>{@link Failure}: 재시도 가능한 오류 (외부 큐가 재전달)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * <p><strong>분기 예시:</strong></p>
 * <pre>
 * if (result instanceof RequeueAfter requeue) {
 *     queue.enqueueAfter(requeue.key(), requeue.delay());
 * } else if (result instanceof Failure failure) {
 *     queue.enqueueAfter(failure.key(), backoff.calculate(attempt));
 * }
 * </pre>
 *
 * @author Retention Team
 * @since 1.0.0
 */
public sealed interface ReconcileResult permits Done, RequeueAfter, Failure {

    /**
     * 리컨실 대상 키.
     *
     * @return ResourceKey
     */
    ResourceKey key();

    /**
     * 결과가 완료인지 확인.
     *
     * @return 완료 여부
     */
    default boolean isDone() {
        return this instanceof Done;
    }

    /**
     * 결과가 재확인 예약인지 확인.
     *
     * @return 재확인 예약 여부
     */
    default boolean isRequeue() {
        return this instanceof RequeueAfter;
    }

    /**
     * 결과가 오류인지 확인.
     *
     * @return 오류 여부
     */
    default boolean isFailure() {
        return this instanceof Failure;
    }
}
