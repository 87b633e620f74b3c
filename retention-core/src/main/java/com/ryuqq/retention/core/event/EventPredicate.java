package com.ryuqq.retention.core.event;

import com.ryuqq.retention.core.model.Resource;

/**
 * 리소스 종류별 이벤트 필터.
 *
 * <p>각 훅은 불변 스냅샷만 받는 순수 함수이며, 예외를 던지지 않아야 합니다.
 * 같은 입력에는 항상 같은 Decision을 반환합니다.</p>
 *
 * <p>재발생할 수 있는 조건은 새 스냅샷만 보고 판단하지 않습니다.
 * 반드시 old/new를 비교해 전이를 감지해야 합니다.</p>
 *
 * @param <R> 리소스 타입
 *
 * @author Retention Team
 * @since 1.0.0
 */
public interface EventPredicate<R extends Resource> {

    /**
     * 생성 알림 판정.
     *
     * @param created 생성된 리소스
     * @return Decision
     */
    Decision onCreate(R created);

    /**
     * 변경 알림 판정.
     *
     * @param before 변경 전 스냅샷
     * @param after 변경 후 스냅샷
     * @return Decision
     */
    Decision onUpdate(R before, R after);

    /**
     * 삭제 알림 판정.
     *
     * @param deleted 삭제된 리소스
     * @return Decision
     */
    Decision onDelete(R deleted);

    /**
     * 변경 유형에 맞는 훅으로 판정.
     *
     * <p>필요한 스냅샷이 없으면 DROP입니다.</p>
     *
     * @param event 변경 알림
     * @return Decision
     */
    default Decision evaluate(ResourceEvent<R> event) {
        if (event == null) {
            return Decision.DROP;
        }
        return switch (event.type()) {
            case CREATE -> event.newObject() == null ? Decision.DROP : onCreate(event.newObject());
            case UPDATE -> event.oldObject() == null || event.newObject() == null
                ? Decision.DROP
                : onUpdate(event.oldObject(), event.newObject());
            case DELETE -> event.oldObject() == null ? Decision.DROP : onDelete(event.oldObject());
        };
    }
}
