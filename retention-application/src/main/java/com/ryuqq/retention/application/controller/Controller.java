package com.ryuqq.retention.application.controller;

import com.ryuqq.retention.application.reconciler.Reconciler;
import com.ryuqq.retention.core.event.Classification;
import com.ryuqq.retention.core.event.EventClassifier;
import com.ryuqq.retention.core.event.ResourceEvent;
import com.ryuqq.retention.core.model.Resource;
import com.ryuqq.retention.core.model.ResourceKind;
import com.ryuqq.retention.core.spi.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 감시 대상 종류별 분류기, 단일 요청 큐, 리컨실러를 묶은 컨트롤러.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * onEvent(event)
 *   ↓
 * 1. 스냅샷 종류로 분류기 선택 (감시하지 않는 종류면 DROP)
 *   ↓
 * 2. classifier.classify(event) → ADMIT(key) / DROP
 *   ↓
 * 3. ADMIT → queue.enqueue(key)
 * </pre>
 *
 * <p>여러 종류의 이벤트가 하나의 요청 큐로 모입니다. 리컨실 실행은 Runtime 구현체가 담당합니다.</p>
 *
 * @author Retention Team
 * @since 1.0.0
 */
public final class Controller {

    private static final Logger log = LoggerFactory.getLogger(Controller.class);

    private final String name;
    private final Reconciler reconciler;
    private final WorkQueue queue;
    private final Map<ResourceKind, EventClassifier<?>> classifiers;

    /**
     * 생성자.
     *
     * @param name 컨트롤러 이름 (로그, MDC에 사용)
     * @param reconciler 리컨실러
     * @param queue 요청 큐
     * @param classifiers 감시 종류별 분류기 (종류 중복 불가)
     * @throws IllegalArgumentException 인자가 null/빈 값이거나 분류기 종류가 중복된 경우
     */
    public Controller(String name, Reconciler reconciler, WorkQueue queue, List<EventClassifier<?>> classifiers) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (reconciler == null) {
            throw new IllegalArgumentException("reconciler cannot be null");
        }
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (classifiers == null || classifiers.isEmpty()) {
            throw new IllegalArgumentException("classifiers cannot be null or empty");
        }

        Map<ResourceKind, EventClassifier<?>> byKind = new EnumMap<>(ResourceKind.class);
        for (EventClassifier<?> classifier : classifiers) {
            if (classifier == null) {
                throw new IllegalArgumentException("classifier cannot be null");
            }
            if (byKind.putIfAbsent(classifier.kind(), classifier) != null) {
                throw new IllegalArgumentException("duplicate classifier for kind " + classifier.kind());
            }
        }

        this.name = name;
        this.reconciler = reconciler;
        this.queue = queue;
        this.classifiers = Collections.unmodifiableMap(byKind);
    }

    /**
     * 변경 알림 처리.
     *
     * @param event 변경 알림 (null 가능)
     * @return 분류 결과
     */
    public Classification onEvent(ResourceEvent<?> event) {
        EventClassifier<?> classifier = selectClassifier(event);
        if (classifier == null) {
            return Classification.dropped();
        }

        Classification classification = classifier.classify(event);
        if (classification.isAdmitted()) {
            queue.enqueue(classification.key());
            log.debug("Enqueued reconcile request: controller={}, type={}, key={}",
                name, event.type(), classification.key());
        }
        return classification;
    }

    /**
     * 컨트롤러 이름.
     *
     * @return 이름
     */
    public String name() {
        return name;
    }

    /**
     * 리컨실러.
     *
     * @return Reconciler
     */
    public Reconciler reconciler() {
        return reconciler;
    }

    /**
     * 요청 큐.
     *
     * @return WorkQueue
     */
    public WorkQueue queue() {
        return queue;
    }

    /**
     * 감시 중인 리소스 종류인지 확인.
     *
     * @param kind 리소스 종류
     * @return 감시 여부
     */
    public boolean watches(ResourceKind kind) {
        return classifiers.containsKey(kind);
    }

    private EventClassifier<?> selectClassifier(ResourceEvent<?> event) {
        if (event == null) {
            return null;
        }
        Resource snapshot = event.newObject() != null ? event.newObject() : event.oldObject();
        if (snapshot == null) {
            return null;
        }
        return classifiers.get(snapshot.kind());
    }
}
