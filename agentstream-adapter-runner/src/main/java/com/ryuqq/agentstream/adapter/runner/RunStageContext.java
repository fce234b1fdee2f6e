package com.ryuqq.agentstream.adapter.runner;

import com.ryuqq.agentstream.application.notifier.EventNotifier;
import com.ryuqq.agentstream.application.resource.ResourceHandle;
import com.ryuqq.agentstream.core.event.EventType;
import com.ryuqq.agentstream.core.model.RunId;
import com.ryuqq.agentstream.core.model.ThreadId;
import com.ryuqq.agentstream.core.model.UserId;
import com.ryuqq.agentstream.core.stage.StageContext;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Stage 시도 하나에 제공되는 StageContext.
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
final class RunStageContext implements StageContext {

    private final RunControl control;
    private final String stageName;
    private final int attempt;
    private final UserId userId;
    private final ThreadId threadId;
    private final ResourceHandle handle;
    private final EventNotifier notifier;
    private final Clock clock;

    RunStageContext(
        RunControl control,
        String stageName,
        int attempt,
        UserId userId,
        ThreadId threadId,
        ResourceHandle handle,
        EventNotifier notifier,
        Clock clock
    ) {
        this.control = control;
        this.stageName = stageName;
        this.attempt = attempt;
        this.userId = userId;
        this.threadId = threadId;
        this.handle = handle;
        this.notifier = notifier;
        this.clock = clock;
    }

    @Override
    public RunId runId() {
        return control.runId();
    }

    @Override
    public UserId userId() {
        return userId;
    }

    @Override
    public ThreadId threadId() {
        return threadId;
    }

    @Override
    public int attempt() {
        return attempt;
    }

    @Override
    public void thinking(String thought) {
        Map<String, Object> payload = basePayload();
        payload.put("thought", thought);
        emit(EventType.AGENT_THINKING, payload);
    }

    @Override
    public <T> T executeTool(String toolName, Callable<T> action) throws Exception {
        if (toolName == null || toolName.isBlank()) {
            throw new IllegalArgumentException("toolName cannot be null or blank");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        String toolId = stageName + "-tool-" + control.nextToolCall();

        Map<String, Object> started = basePayload();
        started.put("tool_name", toolName);
        started.put("tool_id", toolId);
        emit(EventType.TOOL_EXECUTING, started);

        long startedAt = clock.millis();
        Map<String, Object> completed = basePayload();
        completed.put("tool_name", toolName);
        completed.put("tool_id", toolId);
        completed.put("status", "error");
        try {
            T result = action.call();
            completed.put("status", "success");
            completed.put("result", String.valueOf(result));
            return result;
        } catch (Exception e) {
            completed.put("error", String.valueOf(e.getMessage()));
            throw e;
        } finally {
            completed.put("duration_ms", clock.millis() - startedAt);
            emit(EventType.TOOL_COMPLETED, completed);
        }
    }

    @Override
    public Object callResource(String operation, Map<String, Object> parameters) throws Exception {
        return handle.execute(operation, parameters);
    }

    // 취소된 run은 terminal 이벤트 이후 아무것도 발행하지 않는다 (짝이 없는 tool_executing 포함)
    private void emit(EventType type, Map<String, Object> payload) {
        if (!control.isCancelled()) {
            notifier.emit(threadId, type, payload);
        }
    }

    private Map<String, Object> basePayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("run_id", control.runId().getValue());
        payload.put("agent_name", stageName);
        return payload;
    }
}
