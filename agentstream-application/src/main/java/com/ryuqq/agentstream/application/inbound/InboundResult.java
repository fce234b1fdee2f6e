package com.ryuqq.agentstream.application.inbound;

import com.ryuqq.agentstream.core.model.RunId;
import com.ryuqq.agentstream.core.state.RequestState;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * 수신 메시지 처리 결과.
 *
 * @author AgentStream Team
 * @since 1.0.0
 * @param action 수행된 동작
 * @param runId 제출된 run (RUN_SUBMITTED일 때만)
 * @param run 제출된 run의 Future (RUN_SUBMITTED일 때만)
 */
public record InboundResult(InboundAction action, RunId runId, CompletableFuture<RequestState> run) {

    public InboundResult {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (action == InboundAction.RUN_SUBMITTED && (runId == null || run == null)) {
            throw new IllegalArgumentException("runId and run are required for RUN_SUBMITTED");
        }
    }

    public static InboundResult of(InboundAction action) {
        return new InboundResult(action, null, null);
    }

    public static InboundResult submitted(RunId runId, CompletableFuture<RequestState> run) {
        return new InboundResult(InboundAction.RUN_SUBMITTED, runId, run);
    }

    public Optional<CompletableFuture<RequestState>> findRun() {
        return Optional.ofNullable(run);
    }
}
