package com.ryuqq.retention.adapter.runner;

import com.ryuqq.retention.application.controller.Controller;
import com.ryuqq.retention.application.reconciler.SchedulingAdapter;
import com.ryuqq.retention.application.runtime.Runtime;
import com.ryuqq.retention.core.exception.ReconcileTimeoutException;
import com.ryuqq.retention.core.model.ResourceKey;
import com.ryuqq.retention.core.result.ErrorKind;
import com.ryuqq.retention.core.result.Failure;
import com.ryuqq.retention.core.result.ReconcileResult;
import com.ryuqq.retention.core.result.RequeueAfter;
import com.ryuqq.retention.core.spi.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Controller Runner 구현체.
 *
 * <p>컨트롤러의 요청 큐에서 키를 꺼내 리컨실러를 실행하고, 결과에 따라 큐를 조작합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * processNext(pollTimeout)
 *   ↓
 * queue.dequeue(pollTimeout) → key
 *   ↓
 * 1. MDC(controller, namespace, name) 설정
 * 2. reconcile(key) → reconcileTimeoutMs 제한 (초과 시 cancel + TIMEOUT)
 * 3. 결과 처리:
 *    - Done         → 실패 횟수 초기화 + ack
 *    - RequeueAfter → 실패 횟수 초기화 + enqueueAfter(delay) + ack
 *    - Failure      → 실패 횟수 증가 + enqueueAfter(backoff) + ack
 * </pre>
 *
 * <p>재등록은 ack 전에 수행합니다. 처리 중 재등록된 키는 ack 시점에 대기열로 돌아가므로,
 * 재등록이 실패해도 키가 처리 중 상태에서 사라지지 않습니다.</p>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>워커 수는 maxConcurrentReconciles (0이면 1)</li>
 *   <li>같은 키의 동시 처리는 WorkQueue가 막음 (처리 중 재등록은 ack 후 재전달)</li>
 *   <li>요청은 버려지지 않음: 실패는 항상 backoff 후 재등록</li>
 *   <li>리컨실 스레드 풀은 워커 수와 무관하게 늘어남: 인터럽트에 응답하지 않는 리컨실러가
 *       제한 시간 후에도 스레드를 점유해도 다음 요청은 새 스레드에서 실행</li>
 * </ul>
 *
 * @author Retention Team
 * @since 1.0.0
 */
public final class ControllerRunner implements Runtime {

    private static final Logger log = LoggerFactory.getLogger(ControllerRunner.class);

    static final String MDC_CONTROLLER = "controller";
    static final String MDC_NAMESPACE = "namespace";
    static final String MDC_NAME = "name";

    private final Controller controller;
    private final ControllerConfig config;
    private final BackoffCalculator backoffCalculator;
    private final ExecutorService workerExecutor;
    private final ExecutorService reconcileExecutor;
    private final Map<ResourceKey, Integer> failureAttempts;
    private final AtomicBoolean started;
    private volatile boolean running;
    private volatile boolean terminated;

    /**
     * 생성자 (기본 BackoffCalculator 사용).
     *
     * @param controller 실행할 컨트롤러
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ControllerRunner(Controller controller, ControllerConfig config) {
        this(controller, config, new BackoffCalculator());
    }

    /**
     * 생성자 (커스텀 BackoffCalculator 주입).
     *
     * @param controller 실행할 컨트롤러
     * @param config 설정
     * @param backoffCalculator 백오프 계산기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ControllerRunner(Controller controller, ControllerConfig config, BackoffCalculator backoffCalculator) {
        if (controller == null) {
            throw new IllegalArgumentException("controller cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }

        this.controller = controller;
        this.config = config;
        this.backoffCalculator = backoffCalculator;
        this.workerExecutor = Executors.newFixedThreadPool(
            config.effectiveConcurrency(), namedThreads(controller.name() + "-worker"));
        // 동시 리컨실 수는 워커 수가 제한함
        this.reconcileExecutor = Executors.newCachedThreadPool(namedThreads(controller.name() + "-reconcile"));
        this.failureAttempts = new ConcurrentHashMap<>();
        this.started = new AtomicBoolean(false);
    }

    @Override
    public boolean processNext(Duration pollTimeout) throws InterruptedException {
        if (terminated) {
            throw new IllegalStateException("runner is shut down: " + controller.name());
        }

        WorkQueue queue = controller.queue();
        Optional<ResourceKey> next = queue.dequeue(pollTimeout);
        if (next.isEmpty()) {
            return false;
        }

        ResourceKey key = next.get();
        MDC.put(MDC_CONTROLLER, controller.name());
        MDC.put(MDC_NAMESPACE, key.namespace());
        MDC.put(MDC_NAME, key.name());
        try {
            ReconcileResult result;
            try {
                result = reconcileWithTimeout(key);
            } catch (RuntimeException e) {
                result = SchedulingAdapter.fromException(key, e);
            }
            handleResult(queue, key, result);
            return true;

        } catch (InterruptedException e) {
            // 요청을 잃지 않도록 즉시 재등록
            queue.ack(key);
            queue.enqueue(key);
            throw e;

        } finally {
            MDC.remove(MDC_CONTROLLER);
            MDC.remove(MDC_NAMESPACE);
            MDC.remove(MDC_NAME);
        }
    }

    @Override
    public void start() {
        if (terminated) {
            throw new IllegalStateException("runner is shut down: " + controller.name());
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("runner already started: " + controller.name());
        }

        running = true;
        int workers = config.effectiveConcurrency();
        for (int i = 0; i < workers; i++) {
            workerExecutor.submit(this::workerLoop);
        }
        log.info("Started controller: controller={}, workers={}", controller.name(), workers);
    }

    /**
     * Runner 종료 (리소스 정리).
     *
     * <p>워커 루프를 멈추고 진행 중인 리컨실이 끝나도록 shutdownTimeoutMs까지 대기합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    @Override
    public void shutdown() throws InterruptedException {
        running = false;
        terminated = true;

        awaitTermination(workerExecutor);
        awaitTermination(reconcileExecutor);
        log.info("Stopped controller: controller={}", controller.name());
    }

    /**
     * 키별 연속 실패 횟수 (없으면 0).
     *
     * @param key 리컨실 대상 키
     * @return 연속 실패 횟수
     */
    public int failureAttempts(ResourceKey key) {
        return failureAttempts.getOrDefault(key, 0);
    }

    private void workerLoop() {
        Duration pollTimeout = Duration.ofMillis(config.pollIntervalMs());
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                processNext(pollTimeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (IllegalStateException e) {
                if (terminated) {
                    return;
                }
                log.error("Worker loop error: controller={}", controller.name(), e);
            } catch (RuntimeException e) {
                log.error("Worker loop error: controller={}", controller.name(), e);
            }
        }
    }

    /**
     * 제한 시간 내 리컨실 실행.
     *
     * <p>리컨실러는 별도 스레드에서 실행되며, 호출 스레드의 MDC를 전달받습니다.
     * 제한 시간을 넘기면 인터럽트로 취소하고 TIMEOUT 실패로 변환합니다.</p>
     *
     * @param key 리컨실 대상 키
     * @return 리컨실 결과
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    private ReconcileResult reconcileWithTimeout(ResourceKey key) throws InterruptedException {
        Map<String, String> context = MDC.getCopyOfContextMap();
        Future<ReconcileResult> future = reconcileExecutor.submit(() -> {
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                return controller.reconciler().reconcile(key);
            } finally {
                MDC.clear();
            }
        });

        try {
            ReconcileResult result = future.get(config.reconcileTimeoutMs(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return Failure.of(key, ErrorKind.UNEXPECTED, "reconciler returned no result");
            }
            return result;

        } catch (TimeoutException e) {
            future.cancel(true);
            return SchedulingAdapter.fromException(
                key, new ReconcileTimeoutException(key, config.reconcileTimeoutMs(), e));

        } catch (ExecutionException e) {
            return SchedulingAdapter.fromException(key, e);

        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    /**
     * 결과 분기 처리 (Done, RequeueAfter, Failure).
     *
     * @param queue 요청 큐
     * @param key 리컨실 대상 키
     * @param result 리컨실 결과
     */
    private void handleResult(WorkQueue queue, ResourceKey key, ReconcileResult result) {
        if (result instanceof RequeueAfter requeue) {
            failureAttempts.remove(key);
            requeueThenAck(queue, key, requeue.delay());
            log.debug("Requeued reconcile request: delay={}", requeue.delay());

        } else if (result instanceof Failure failure) {
            int attempt = failureAttempts.merge(key, 1, Integer::sum);
            Duration delay = backoffCalculator.calculate(attempt);
            requeueThenAck(queue, key, delay);
            log.warn("Reconcile failed, requeueing: kind={}, attempt={}, delay={}, message={}",
                failure.kind(), attempt, delay, failure.message());

        } else {
            failureAttempts.remove(key);
            queue.ack(key);
            log.debug("Reconcile done: {}", result);
        }
    }

    /**
     * 재등록 후 ack.
     *
     * <p>지정 지연으로 재등록이 실패하면 최대 backoff 지연으로 한 번 더 재등록합니다.</p>
     *
     * @param queue 요청 큐
     * @param key 리컨실 대상 키
     * @param delay 재전달 지연
     */
    private void requeueThenAck(WorkQueue queue, ResourceKey key, Duration delay) {
        try {
            queue.enqueueAfter(key, delay);
        } catch (RuntimeException e) {
            Duration fallback = Duration.ofMillis(backoffCalculator.getMaxDelayMs());
            log.error("Requeue failed, retrying with fallback delay: delay={}, fallback={}", delay, fallback, e);
            queue.enqueueAfter(key, fallback);
        } finally {
            queue.ack(key);
        }
    }

    private void awaitTermination(ExecutorService executor) throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            log.warn("Executor did not terminate in {}ms, forcing shutdown: controller={}",
                config.shutdownTimeoutMs(), controller.name());
            executor.shutdownNow();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
