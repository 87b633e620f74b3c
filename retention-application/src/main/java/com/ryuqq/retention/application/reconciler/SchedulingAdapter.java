package com.ryuqq.retention.application.reconciler;

import com.ryuqq.retention.core.exception.ReconcileTimeoutException;
import com.ryuqq.retention.core.exception.ResourceNotFoundException;
import com.ryuqq.retention.core.exception.StoreException;
import com.ryuqq.retention.core.model.ResourceKey;
import com.ryuqq.retention.core.policy.TtlEvaluation;
import com.ryuqq.retention.core.result.Done;
import com.ryuqq.retention.core.result.ErrorKind;
import com.ryuqq.retention.core.result.Failure;
import com.ryuqq.retention.core.result.ReconcileResult;
import com.ryuqq.retention.core.result.RequeueAfter;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * TTL 판정과 예외를 스케줄링 지시로 변환.
 *
 * <p><strong>판정 변환:</strong></p>
 * <ul>
 *   <li>AWAITING_EXPIRY → RequeueAfter(remaining)</li>
 *   <li>NOT_FOUND, UNKNOWN, NO_TTL, EXPIRED → Done</li>
 * </ul>
 *
 * <p><strong>예외 변환:</strong></p>
 * <ul>
 *   <li>ResourceNotFoundException → Done (이미 삭제됨)</li>
 *   <li>StoreException → Failure(STORE_ERROR)</li>
 *   <li>ReconcileTimeoutException, TimeoutException → Failure(TIMEOUT)</li>
 *   <li>그 외 → Failure(UNEXPECTED)</li>
 * </ul>
 *
 * <p>독립적인 로직 없이 변환만 수행합니다.</p>
 *
 * @author Retention Team
 * @since 1.0.0
 */
public final class SchedulingAdapter {

    // Utility class - prevent instantiation
    private SchedulingAdapter() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * TTL 판정 결과 변환.
     *
     * @param key 리컨실 대상 키
     * @param evaluation 판정 결과
     * @return ReconcileResult
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws IllegalStateException 판정이 종료 상태가 아닌 경우 (LOADED)
     */
    public static ReconcileResult toResult(ResourceKey key, TtlEvaluation evaluation) {
        if (key == null || evaluation == null) {
            throw new IllegalArgumentException("key and evaluation cannot be null");
        }
        if (!evaluation.state().isTerminal()) {
            throw new IllegalStateException("Cannot schedule non-terminal ttl state: " + evaluation.state());
        }

        return switch (evaluation.state()) {
            case AWAITING_EXPIRY -> RequeueAfter.of(key, evaluation.remaining());
            case EXPIRED -> new Done(key, "deleted after ttl expiry");
            case NOT_FOUND -> new Done(key, "resource not found");
            case UNKNOWN -> new Done(key, "completion condition not terminal");
            case NO_TTL -> new Done(key, "no ttl configured for outcome");
            case LOADED -> throw new IllegalStateException("unreachable");
        };
    }

    /**
     * 리컨실 중 발생한 예외 변환.
     *
     * <p>ExecutionException, CompletionException은 원인을 꺼내서 분류합니다.</p>
     *
     * @param key 리컨실 대상 키
     * @param error 발생한 예외
     * @return ReconcileResult (Done 또는 Failure)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static ReconcileResult fromException(ResourceKey key, Throwable error) {
        if (key == null || error == null) {
            throw new IllegalArgumentException("key and error cannot be null");
        }

        Throwable cause = unwrap(error);
        if (cause instanceof ResourceNotFoundException) {
            return new Done(key, "resource already removed");
        }
        if (cause instanceof StoreException) {
            return Failure.of(key, ErrorKind.STORE_ERROR, messageOf(cause));
        }
        if (cause instanceof ReconcileTimeoutException || cause instanceof TimeoutException) {
            return Failure.of(key, ErrorKind.TIMEOUT, messageOf(cause));
        }
        return Failure.of(key, ErrorKind.UNEXPECTED, messageOf(cause));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String messageOf(Throwable cause) {
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            return cause.getClass().getSimpleName();
        }
        return message;
    }
}
