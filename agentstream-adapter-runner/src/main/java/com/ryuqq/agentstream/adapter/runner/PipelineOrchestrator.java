package com.ryuqq.agentstream.adapter.runner;

import com.ryuqq.agentstream.application.notifier.EventNotifier;
import com.ryuqq.agentstream.application.orchestrator.Orchestrator;
import com.ryuqq.agentstream.application.orchestrator.RunRequest;
import com.ryuqq.agentstream.application.resource.ResourceFactory;
import com.ryuqq.agentstream.application.resource.ResourceHandle;
import com.ryuqq.agentstream.core.error.AgentStreamException;
import com.ryuqq.agentstream.core.error.RunTimeoutException;
import com.ryuqq.agentstream.core.error.StageExecutionException;
import com.ryuqq.agentstream.core.error.ValidationException;
import com.ryuqq.agentstream.core.event.EventType;
import com.ryuqq.agentstream.core.model.RequestId;
import com.ryuqq.agentstream.core.model.RunId;
import com.ryuqq.agentstream.core.model.UserId;
import com.ryuqq.agentstream.core.spi.SaveResult;
import com.ryuqq.agentstream.core.spi.StateStore;
import com.ryuqq.agentstream.core.stage.Stage;
import com.ryuqq.agentstream.core.stage.StageRegistry;
import com.ryuqq.agentstream.core.state.RequestState;
import com.ryuqq.agentstream.core.state.RunStatus;
import com.ryuqq.agentstream.core.state.StageResult;
import com.ryuqq.agentstream.core.state.StageStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Stage 파이프라인을 실행하는 Orchestrator 구현체.
 *
 * <p><strong>Stage 처리 (등록 순서대로, 하나씩):</strong></p>
 * <pre>
 * CHECK_ENTRY ──false──→ SKIPPED (상태 변경 없음)
 *     │ true
 *     ↓
 * agent_thinking
 *     ↓
 * EXECUTING ──실패──→ backoff 후 재시도 (최대 maxRetries회)
 *     │ 성공             │ 소진 또는 재시도 불가
 *     ↓                  ↓
 * COMPLETED          error(STAGE_FAILED), FAILED 기록
 *     ↓                  ↓
 * CHECKPOINT         CHECKPOINT → haltOnStageFailure ? run FAILED : 다음 Stage
 * </pre>
 *
 * <p><strong>종료 이벤트:</strong> run마다 정확히 하나. COMPLETED이면 agent_completed
 * (결과 + 사용량), FAILED이면 terminal error. deadline 초과 시에는 deadline 스레드가
 * RUN_TIMEOUT error를 발행하고 워커는 인터럽트로 취소됩니다.</p>
 *
 * <p><strong>동시성:</strong> 서로 다른 run은 워커 풀({@link OrchestratorConfig#concurrency()})에서
 * 병렬 실행되며, 같은 runId의 run은 동시에 하나만 활성화됩니다.</p>
 *
 * <p>checkpoint 저장 실패는 경고로 기록하고 run을 계속 진행합니다.</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public final class PipelineOrchestrator implements Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private static final String SUPERVISOR = "supervisor";

    private final StageRegistry stages;
    private final StateStore stateStore;
    private final EventNotifier notifier;
    private final ResourceFactory resourceFactory;
    private final OrchestratorConfig config;
    private final RetryBackoff backoff;
    private final Clock clock;
    private final ConcurrentHashMap<RunId, UserId> activeRuns;
    private final ExecutorService workerExecutor;
    private final ScheduledExecutorService deadlineScheduler;

    public PipelineOrchestrator(
        StageRegistry stages,
        StateStore stateStore,
        EventNotifier notifier,
        ResourceFactory resourceFactory,
        OrchestratorConfig config
    ) {
        this(stages, stateStore, notifier, resourceFactory, config, new RetryBackoff(), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param stages 실행 순서가 고정된 Stage 목록
     * @param stateStore checkpoint 저장소
     * @param notifier 이벤트 발행기
     * @param resourceFactory run별 리소스 핸들 발급
     * @param config 설정
     * @param backoff 재시도 간격 계산
     * @param clock 시간 소스
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public PipelineOrchestrator(
        StageRegistry stages,
        StateStore stateStore,
        EventNotifier notifier,
        ResourceFactory resourceFactory,
        OrchestratorConfig config,
        RetryBackoff backoff,
        Clock clock
    ) {
        if (stages == null) {
            throw new IllegalArgumentException("stages cannot be null");
        }
        if (stateStore == null) {
            throw new IllegalArgumentException("stateStore cannot be null");
        }
        if (notifier == null) {
            throw new IllegalArgumentException("notifier cannot be null");
        }
        if (resourceFactory == null) {
            throw new IllegalArgumentException("resourceFactory cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }

        this.stages = stages;
        this.stateStore = stateStore;
        this.notifier = notifier;
        this.resourceFactory = resourceFactory;
        this.config = config;
        this.backoff = backoff;
        this.clock = clock;
        this.activeRuns = new ConcurrentHashMap<>();
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency(), namedThreads("agentstream-run"));
        this.deadlineScheduler = Executors.newSingleThreadScheduledExecutor(namedThreads("agentstream-deadline"));
    }

    @Override
    public RequestState run(RunRequest request) {
        if (request == null) {
            throw new ValidationException("request cannot be null");
        }
        return runTracked(request, new RunControl(request.runId()));
    }

    @Override
    public RequestState run(RunRequest request, long timeoutMs) {
        CompletableFuture<RequestState> future = submit(request, timeoutMs);
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Run " + request.runId() + " failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for run " + request.runId(), e);
        }
    }

    @Override
    public CompletableFuture<RequestState> submit(RunRequest request) {
        return submit(request, config.defaultRunTimeoutMs());
    }

    @Override
    public CompletableFuture<RequestState> submit(RunRequest request, long timeoutMs) {
        if (request == null) {
            throw new ValidationException("request cannot be null");
        }
        if (timeoutMs <= 0) {
            throw new ValidationException("timeoutMs must be positive (current: " + timeoutMs + ")");
        }

        RunControl control = new RunControl(request.runId());
        CompletableFuture<RequestState> result = new CompletableFuture<>();
        Future<?> task = workerExecutor.submit(() -> {
            try {
                result.complete(runTracked(request, control));
            } catch (RuntimeException | Error e) {
                result.completeExceptionally(e);
            }
        });
        ScheduledFuture<?> deadline = deadlineScheduler.schedule(
            () -> expire(request, control, task, result, timeoutMs),
            timeoutMs,
            TimeUnit.MILLISECONDS
        );
        result.whenComplete((state, error) -> deadline.cancel(false));
        return result;
    }

    @Override
    public boolean isActive(RunId runId) {
        return activeRuns.containsKey(runId);
    }

    /**
     * 워커 풀 종료.
     *
     * <p>진행 중인 run이 끝날 때까지 최대 60초 대기합니다.</p>
     *
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public void shutdown() throws InterruptedException {
        deadlineScheduler.shutdownNow();
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
            workerExecutor.shutdownNow();
        }
    }

    private void expire(
        RunRequest request,
        RunControl control,
        Future<?> task,
        CompletableFuture<RequestState> result,
        long timeoutMs
    ) {
        if (result.isDone()) {
            return;
        }
        String reason = "Run timed out after " + timeoutMs + "ms";
        if (!control.cancel(reason)) {
            return;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("run_id", request.runId().getValue());
        payload.put("error_code", RunTimeoutException.ERROR_CODE);
        payload.put("message", reason);
        payload.put("terminal", true);
        notifier.emit(request.threadId(), EventType.ERROR, payload);

        log.warn("Run {} for {} cancelled: {}", request.runId(), request.userId(), reason);
        result.completeExceptionally(new RunTimeoutException(request.runId().getValue(), timeoutMs));
        task.cancel(true);
    }

    private RequestState runTracked(RunRequest request, RunControl control) {
        RunId runId = request.runId();
        if (activeRuns.putIfAbsent(runId, request.userId()) != null) {
            throw new IllegalStateException("Run " + runId.getValue() + " is already active");
        }
        try {
            return execute(request, control);
        } finally {
            activeRuns.remove(runId);
        }
    }

    private RequestState execute(RunRequest request, RunControl control) {
        long startedAt = clock.millis();
        Optional<RequestState> snapshot = stateStore.load(request.runId(), request.userId());
        if (snapshot.isPresent() && snapshot.get().getStatus().isTerminal()) {
            log.info("Run {} already finished with {}, returning stored state", request.runId(), snapshot.get().getStatus());
            return snapshot.get();
        }

        RequestState initial = snapshot.orElseGet(() -> RequestState.create(
            request.userId(), request.threadId(), request.runId(), request.userRequest(), startedAt
        ));

        ResourceHandle handle;
        try {
            handle = resourceFactory.acquireHandle(request.userId(), RequestId.from(request.runId()), request.threadId());
        } catch (AgentStreamException e) {
            log.warn("Run {} for {} could not acquire resources: {}", request.runId(), request.userId(), e.getMessage());
            if (control.claimTerminal()) {
                emitTerminalError(initial, e.getErrorCode(), e.getMessage());
            }
            throw e;
        }

        try {
            return runPipeline(initial, snapshot.isPresent(), handle, control, startedAt);
        } catch (RuntimeException e) {
            log.error("Run {} aborted unexpectedly", request.runId(), e);
            if (control.claimTerminal()) {
                emitTerminalError(initial, "INTERNAL_ERROR", e.getMessage());
            }
            throw e;
        } finally {
            resourceFactory.release(handle);
        }
    }

    private RequestState runPipeline(
        RequestState initial,
        boolean resumed,
        ResourceHandle handle,
        RunControl control,
        long startedAt
    ) {
        RequestState state = initial;
        if (state.getStatus() == RunStatus.PENDING) {
            state = state.transitionTo(RunStatus.RUNNING, clock.millis());
        }
        log.info("Run {} started for {} ({} stages{})",
            state.getRunId(), state.getUserId(), stages.size(), resumed ? ", resumed" : "");

        Map<String, Object> started = basePayload(state, SUPERVISOR);
        started.put("user_request", state.getUserRequest());
        started.put("resumed", resumed);
        notifier.emit(state.getThreadId(), EventType.AGENT_STARTED, started);
        checkpoint(state);

        List<Stage> ordered = stages.stages();
        for (int index = 0; index < ordered.size(); index++) {
            Stage stage = ordered.get(index);
            if (control.isCancelled() || Thread.currentThread().isInterrupted()) {
                return finishCancelled(state, control);
            }
            if (state.hasResultFor(stage.name())) {
                log.debug("Run {} skipping {}: result already recorded", state.getRunId(), stage.name());
                continue;
            }

            if (!enters(stage, state)) {
                state = state.withStageResult(StageResult.skipped(stage.name(), clock.millis()));
                checkpoint(state);
                continue;
            }

            if (control.isCancelled()) {
                return finishCancelled(state, control);
            }
            Map<String, Object> thinking = basePayload(state, stage.name());
            thinking.put("thought", "Running " + stage.name());
            thinking.put("step_number", index + 1);
            thinking.put("total_steps", ordered.size());
            notifier.emit(state.getThreadId(), EventType.AGENT_THINKING, thinking);

            StageAttempt attempt = executeWithRetry(stage, state, handle, control);
            if (attempt.interrupted() || control.isCancelled()) {
                return finishCancelled(state, control);
            }

            if (attempt.error() == null) {
                RequestState next = attempt.state();
                String output = next.findAttribute(StageResult.outputAttribute(stage.name())).orElse(null);
                state = next.withStageResult(StageResult.completed(stage.name(), attempt.attempts(), output, clock.millis()));
                checkpoint(state);
                continue;
            }

            String message = describe(attempt.error());
            log.error("Stage {} of run {} failed after {} attempts: {}",
                stage.name(), state.getRunId(), attempt.attempts(), message);

            Map<String, Object> failure = basePayload(state, stage.name());
            failure.put("error_code", StageExecutionException.ERROR_CODE);
            failure.put("stage", stage.name());
            failure.put("message", message);
            failure.put("attempts", attempt.attempts());
            failure.put("terminal", false);
            notifier.emit(state.getThreadId(), EventType.ERROR, failure);

            state = state.withStageResult(StageResult.failed(stage.name(), attempt.attempts(), message, clock.millis()));
            checkpoint(state);

            if (config.haltOnStageFailure()) {
                return finishFailed(state, control, "Stage " + stage.name() + " failed: " + message);
            }
        }

        return finishCompleted(state, control, startedAt);
    }

    private boolean enters(Stage stage, RequestState state) {
        try {
            return stage.checkEntryConditions(state);
        } catch (RuntimeException e) {
            log.warn("Entry check of stage {} threw, skipping stage", stage.name(), e);
            return false;
        }
    }

    private StageAttempt executeWithRetry(Stage stage, RequestState state, ResourceHandle handle, RunControl control) {
        int maxAttempts = config.maxRetries() + 1;
        int attempt = 0;
        while (true) {
            attempt++;
            RunStageContext context = new RunStageContext(
                control, stage.name(), attempt, state.getUserId(), state.getThreadId(), handle, notifier, clock
            );
            try {
                RequestState next = stage.execute(state, context);
                verifyIdentity(stage, state, next);
                return StageAttempt.succeeded(next, attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return StageAttempt.cancelled(attempt);
            } catch (Exception e) {
                if (control.isCancelled() || Thread.currentThread().isInterrupted()) {
                    return StageAttempt.cancelled(attempt);
                }
                if (!isRetryable(e) || attempt >= maxAttempts) {
                    return StageAttempt.failed(e, attempt);
                }
                long delay = backoff.delayFor(attempt);
                log.warn("Stage {} of run {} failed on attempt {}/{}, retrying in {}ms: {}",
                    stage.name(), state.getRunId(), attempt, maxAttempts, delay, describe(e));
                if (!sleep(delay)) {
                    return StageAttempt.cancelled(attempt);
                }
            }
        }
    }

    private void verifyIdentity(Stage stage, RequestState before, RequestState after) {
        if (after == null) {
            throw StageExecutionException.permanentFailure(stage.name(), "Stage returned no state");
        }
        if (!after.getRunId().equals(before.getRunId())
            || !after.getUserId().equals(before.getUserId())
            || !after.getUserRequest().equals(before.getUserRequest())
            || after.getStatus() != before.getStatus()) {
            throw StageExecutionException.permanentFailure(stage.name(), "Stage replaced the run identity or status");
        }
    }

    private boolean isRetryable(Exception e) {
        if (e instanceof ValidationException) {
            return false;
        }
        if (e instanceof StageExecutionException stageFailure) {
            return stageFailure.isRetryable();
        }
        return true;
    }

    private RequestState finishCompleted(RequestState state, RunControl control, long startedAt) {
        // deadline이 마지막 stage 이후에 terminal 이벤트를 가져간 경우
        if (!control.claimTerminal()) {
            return finishCancelled(state, control);
        }
        RequestState completed = state.transitionTo(RunStatus.COMPLETED, clock.millis());

        Map<String, Object> stageSummary = new LinkedHashMap<>();
        for (StageResult result : completed.getStageResults().values()) {
            stageSummary.put(result.stageName(), result.status().name());
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", completed.getStatus().name());
        result.put("stages", stageSummary);
        result.put("attributes", new LinkedHashMap<>(completed.getAttributes()));

        Map<String, Object> usage = new LinkedHashMap<>();
        usage.put("stages_executed", completed.countStages(StageStatus.COMPLETED));
        usage.put("stages_skipped", completed.countStages(StageStatus.SKIPPED));
        usage.put("stages_failed", completed.countStages(StageStatus.FAILED));
        usage.put("tool_calls", control.toolCalls());
        usage.put("duration_ms", clock.millis() - startedAt);

        Map<String, Object> payload = basePayload(completed, SUPERVISOR);
        payload.put("result", result);
        payload.put("usage", usage);
        notifier.emit(completed.getThreadId(), EventType.AGENT_COMPLETED, payload);
        checkpoint(completed);
        log.info("Run {} completed for {}: {} executed, {} skipped, {} failed",
            completed.getRunId(), completed.getUserId(),
            completed.countStages(StageStatus.COMPLETED),
            completed.countStages(StageStatus.SKIPPED),
            completed.countStages(StageStatus.FAILED));
        return completed;
    }

    private RequestState finishFailed(RequestState state, RunControl control, String reason) {
        RequestState failed = state.fail(reason, clock.millis());
        if (control.claimTerminal()) {
            emitTerminalError(failed, StageExecutionException.ERROR_CODE, reason);
        }
        checkpoint(failed);
        log.info("Run {} failed for {}: {}", failed.getRunId(), failed.getUserId(), reason);
        return failed;
    }

    private RequestState finishCancelled(RequestState state, RunControl control) {
        String reason = control.isCancelled() ? control.cancelReason() : "Run interrupted";
        RequestState failed = state.fail(reason, clock.millis());
        if (control.claimTerminal()) {
            emitTerminalError(failed, "RUN_CANCELLED", reason);
        }
        checkpoint(failed);
        log.info("Run {} cancelled for {}: {}", failed.getRunId(), failed.getUserId(), reason);
        return failed;
    }

    private void emitTerminalError(RequestState state, String errorCode, String message) {
        Map<String, Object> payload = basePayload(state, SUPERVISOR);
        payload.put("error_code", errorCode);
        payload.put("message", message);
        payload.put("terminal", true);
        notifier.emit(state.getThreadId(), EventType.ERROR, payload);
    }

    private void checkpoint(RequestState state) {
        try {
            SaveResult result = stateStore.save(state.getRunId(), state.getThreadId(), state.getUserId(), state);
            if (!result.success()) {
                log.warn("Checkpoint of run {} rejected: {}", state.getRunId(), result.failureReason());
            }
        } catch (RuntimeException e) {
            log.warn("Checkpoint of run {} failed, continuing", state.getRunId(), e);
        }
    }

    private static Map<String, Object> basePayload(RequestState state, String agentName) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("run_id", state.getRunId().getValue());
        payload.put("agent_name", agentName);
        return payload;
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static boolean sleep(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record StageAttempt(RequestState state, Exception error, int attempts, boolean interrupted) {

        static StageAttempt succeeded(RequestState state, int attempts) {
            return new StageAttempt(state, null, attempts, false);
        }

        static StageAttempt failed(Exception error, int attempts) {
            return new StageAttempt(null, error, attempts, false);
        }

        static StageAttempt cancelled(int attempts) {
            return new StageAttempt(null, null, attempts, true);
        }
    }
}
