/**
 * Runner Adapter Layer - Runtime 구현체.
 *
 * <p>이 패키지는 Runtime 인터페이스의 워커 풀 구현체와 설정을 포함합니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retention.adapter.runner.ControllerRunner} - 요청 큐를 소비하는 워커 풀 러너</li>
 *   <li>{@link com.ryuqq.retention.adapter.runner.ControllerConfig} - 동시성, 제한 시간 설정</li>
 *   <li>{@link com.ryuqq.retention.adapter.runner.BackoffCalculator} - 실패 재전달 지연 계산</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (ControllerRunner)
 *   ↓ implements
 * application (Runtime, Controller, Reconciler)
 *   ↓ depends on
 * core (ResourceKey, ReconcileResult, WorkQueue)
 * </pre>
 *
 * @author Retention Team
 * @since 1.0.0
 */
package com.ryuqq.retention.adapter.runner;
