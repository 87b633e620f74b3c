package com.ryuqq.retention.adapter.runner;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 실패한 리컨실 요청의 재전달 지연 계산기 (Exponential Backoff with Jitter).
 *
 * <p>같은 키가 연속으로 실패할수록 재전달 간격을 지수적으로 늘리고, Jitter로 동시 재전달을 분산합니다.
 * 최대값에 도달해도 요청을 버리지 않고 최대 간격으로 계속 재전달합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * exponential = min(baseDelay * 2^(attempt-1), maxDelay)
 * delay = min(exponential + random(0, exponential * jitterFactor), maxDelay)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=1000ms, maxDelay=300000ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attempt=1: 1000-1100ms</li>
 *   <li>attempt=3: 4000-4400ms</li>
 *   <li>attempt=10 이상: 300000ms (상한)</li>
 * </ul>
 *
 * @author Retention Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    // 2^30 * base 이후는 항상 상한에 걸림 (shift overflow 방지)
    private static final int MAX_SHIFT = 30;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=1000ms, maxDelay=300000ms, jitterFactor=0.1</p>
     */
    public BackoffCalculator() {
        this(1000, 300000, 0.1);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        this(baseDelayMs, maxDelayMs, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수 공급자를 주입하여 생성 (테스트용).
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @param random [0.0, 1.0) 범위 난수 공급자
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }

        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * 재전달 지연 시간 계산.
     *
     * @param attempt 연속 실패 횟수 (1부터 시작)
     * @return 재전달 전 대기 시간 (양수)
     * @throws IllegalArgumentException attempt가 양수가 아닌 경우
     */
    public Duration calculate(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException(
                "attempt must be positive (current: " + attempt + ")"
            );
        }

        // 1. 지수적 백오프
        int shift = Math.min(attempt - 1, MAX_SHIFT);
        long exponential = Math.min(baseDelayMs << shift, maxDelayMs);

        // 2. Jitter 추가
        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());

        // 3. 최대값 제한
        return Duration.ofMillis(Math.min(exponential + jitter, maxDelayMs));
    }

    /**
     * 기본 지연 시간 조회.
     *
     * @return 기본 지연 시간 (밀리초)
     */
    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    /**
     * 최대 지연 시간 조회.
     *
     * @return 최대 지연 시간 (밀리초)
     */
    public long getMaxDelayMs() {
        return maxDelayMs;
    }
}
