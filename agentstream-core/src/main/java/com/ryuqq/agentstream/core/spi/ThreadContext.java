package com.ryuqq.agentstream.core.spi;

import com.ryuqq.agentstream.core.model.RunId;
import com.ryuqq.agentstream.core.model.ThreadId;
import com.ryuqq.agentstream.core.model.UserId;
import com.ryuqq.agentstream.core.state.RequestState;

/**
 * 스레드 단위 요약 (해당 스레드의 스냅샷에서 도출).
 *
 * @author AgentStream Team
 * @since 1.0.0
 * @param threadId 스레드 식별자
 * @param userId 스레드 소유 사용자
 * @param latestRunId 가장 최근에 저장된 run
 * @param latestState 가장 최근 run의 상태
 * @param runCount 스레드에 저장된 run 수
 * @param lastSavedAt 마지막 저장 시각 (epoch millis)
 */
public record ThreadContext(
    ThreadId threadId,
    UserId userId,
    RunId latestRunId,
    RequestState latestState,
    int runCount,
    long lastSavedAt
) {

    public ThreadContext {
        if (threadId == null) {
            throw new IllegalArgumentException("threadId cannot be null");
        }
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        if (latestRunId == null) {
            throw new IllegalArgumentException("latestRunId cannot be null");
        }
        if (latestState == null) {
            throw new IllegalArgumentException("latestState cannot be null");
        }
        if (runCount < 1) {
            throw new IllegalArgumentException("runCount must be positive (current: " + runCount + ")");
        }
    }
}
