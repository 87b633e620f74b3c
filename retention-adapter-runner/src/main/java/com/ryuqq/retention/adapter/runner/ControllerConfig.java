package com.ryuqq.retention.adapter.runner;

import java.util.Map;

/**
 * ControllerRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxConcurrentReconciles: 동시 리컨실 수 (기본 0 = 런타임 기본값 1)</li>
 *   <li>pollIntervalMs: 큐 대기 간격 (기본 100ms)</li>
 *   <li>reconcileTimeoutMs: 요청 1건 처리 제한 시간 (기본 300000ms = 5분)</li>
 *   <li>shutdownTimeoutMs: 종료 시 진행 중 작업 대기 시간 (기본 60000ms)</li>
 * </ul>
 *
 * <p><strong>환경 변수:</strong></p>
 * <ul>
 *   <li>{@value #EXECUTION_MAX_CONCURRENT_RECONCILES}: TTL 정리 컨트롤러 동시성</li>
 *   <li>{@value #MANAGED_MAX_CONCURRENT_RECONCILES}: 개수 제한 정리 컨트롤러 동시성</li>
 *   <li>{@value #CTX_TIMEOUT}: 요청 처리 제한 시간 (초)</li>
 * </ul>
 *
 * @author Retention Team
 * @since 1.0.0
 * @param maxConcurrentReconciles 동시 리컨실 수 (0 이상, 0이면 1)
 * @param pollIntervalMs 큐 대기 간격 (밀리초, 양수여야 함)
 * @param reconcileTimeoutMs 요청 처리 제한 시간 (밀리초, 양수여야 함)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 양수여야 함)
 */
public record ControllerConfig(
    int maxConcurrentReconciles,
    long pollIntervalMs,
    long reconcileTimeoutMs,
    long shutdownTimeoutMs
) {

    /** TTL 정리 컨트롤러 동시성 환경 변수. */
    public static final String EXECUTION_MAX_CONCURRENT_RECONCILES = "EXECUTION_MAX_CONCURRENT_RECONCILES";

    /** 개수 제한 정리 컨트롤러 동시성 환경 변수. */
    public static final String MANAGED_MAX_CONCURRENT_RECONCILES = "MANAGED_MAX_CONCURRENT_RECONCILES";

    /** 요청 처리 제한 시간 환경 변수 (초 단위). */
    public static final String CTX_TIMEOUT = "CTX_TIMEOUT";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxConcurrentReconciles=0, pollIntervalMs=100ms,
     * reconcileTimeoutMs=300000ms, shutdownTimeoutMs=60000ms</p>
     */
    public ControllerConfig() {
        this(0, 100, 300000, 60000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ControllerConfig {
        if (maxConcurrentReconciles < 0) {
            throw new IllegalArgumentException(
                "maxConcurrentReconciles cannot be negative (current: " + maxConcurrentReconciles + ")"
            );
        }
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollIntervalMs must be positive (current: " + pollIntervalMs + ")"
            );
        }
        if (reconcileTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "reconcileTimeoutMs must be positive (current: " + reconcileTimeoutMs + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * 환경 변수에서 설정 로드.
     *
     * <p>없는 변수는 기본값을 유지합니다.</p>
     *
     * @param environment 환경 변수 (예: {@code System.getenv()})
     * @param concurrencyVariable 동시성 환경 변수 이름
     * @return ControllerConfig
     * @throws IllegalArgumentException 값이 정수가 아니거나 범위를 벗어난 경우
     */
    public static ControllerConfig fromEnvironment(Map<String, String> environment, String concurrencyVariable) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        if (concurrencyVariable == null || concurrencyVariable.isBlank()) {
            throw new IllegalArgumentException("concurrencyVariable cannot be null or blank");
        }

        ControllerConfig config = new ControllerConfig();

        String concurrency = environment.get(concurrencyVariable);
        if (concurrency != null && !concurrency.isBlank()) {
            config = config.withMaxConcurrentReconciles(parse(concurrencyVariable, concurrency));
        }

        String timeoutSeconds = environment.get(CTX_TIMEOUT);
        if (timeoutSeconds != null && !timeoutSeconds.isBlank()) {
            config = config.withReconcileTimeoutMs(parse(CTX_TIMEOUT, timeoutSeconds) * 1000L);
        }

        return config;
    }

    /**
     * 실제 워커 수 (0이면 1).
     *
     * @return 1 이상의 워커 수
     */
    public int effectiveConcurrency() {
        return maxConcurrentReconciles == 0 ? 1 : maxConcurrentReconciles;
    }

    /**
     * maxConcurrentReconciles만 변경한 새 인스턴스 생성.
     */
    public ControllerConfig withMaxConcurrentReconciles(int maxConcurrentReconciles) {
        return new ControllerConfig(maxConcurrentReconciles, pollIntervalMs, reconcileTimeoutMs, shutdownTimeoutMs);
    }

    /**
     * pollIntervalMs만 변경한 새 인스턴스 생성.
     */
    public ControllerConfig withPollIntervalMs(long pollIntervalMs) {
        return new ControllerConfig(maxConcurrentReconciles, pollIntervalMs, reconcileTimeoutMs, shutdownTimeoutMs);
    }

    /**
     * reconcileTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public ControllerConfig withReconcileTimeoutMs(long reconcileTimeoutMs) {
        return new ControllerConfig(maxConcurrentReconciles, pollIntervalMs, reconcileTimeoutMs, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public ControllerConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new ControllerConfig(maxConcurrentReconciles, pollIntervalMs, reconcileTimeoutMs, shutdownTimeoutMs);
    }

    private static int parse(String variable, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(variable + " must be an integer (current: " + value + ")", e);
        }
    }
}
