package com.ryuqq.agentstream.adapter.runner;

import com.ryuqq.agentstream.core.model.RunId;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * run 하나의 종료 이벤트 발행권과 취소 상태.
 *
 * <p>terminal 이벤트(agent_completed 또는 terminal error)는 run당 정확히 하나만 발행됩니다.
 * 워커 스레드와 deadline 스레드 중 먼저 {@link #claimTerminal()} 또는 {@link #cancel(String)}에
 * 성공한 쪽이 발행합니다.</p>
 */
final class RunControl {

    private final RunId runId;
    private final AtomicBoolean terminalClaimed = new AtomicBoolean();
    private final AtomicInteger toolCalls = new AtomicInteger();
    private volatile String cancelReason;

    RunControl(RunId runId) {
        this.runId = runId;
    }

    boolean claimTerminal() {
        return terminalClaimed.compareAndSet(false, true);
    }

    /**
     * run 취소. 이미 terminal 이벤트가 발행되었으면 취소하지 않습니다.
     *
     * @param reason 취소 사유
     * @return 취소에 성공했으면 true
     */
    boolean cancel(String reason) {
        if (!terminalClaimed.compareAndSet(false, true)) {
            return false;
        }
        cancelReason = reason;
        return true;
    }

    boolean isCancelled() {
        return cancelReason != null;
    }

    String cancelReason() {
        return cancelReason;
    }

    int nextToolCall() {
        return toolCalls.incrementAndGet();
    }

    int toolCalls() {
        return toolCalls.get();
    }

    RunId runId() {
        return runId;
    }
}
