package com.ryuqq.agentstream.core.state;

import com.ryuqq.agentstream.core.model.RunId;
import com.ryuqq.agentstream.core.model.ThreadId;
import com.ryuqq.agentstream.core.model.UserId;

/**
 * 저장된 RequestState 스냅샷.
 *
 * <p>{@code stateJson}은 StateStore 구현체가 선택한 직렬화 형식의 문자열이며,
 * 역직렬화하면 저장 시점의 RequestState와 같아야 합니다.</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 * @param snapshotId 스냅샷 식별자
 * @param runId run 식별자
 * @param threadId 스레드 식별자
 * @param userId 소유 사용자
 * @param stateJson 직렬화된 RequestState
 * @param savedAt 저장 시각 (epoch millis)
 */
public record RunSnapshot(
    String snapshotId,
    RunId runId,
    ThreadId threadId,
    UserId userId,
    String stateJson,
    long savedAt
) {

    public RunSnapshot {
        if (snapshotId == null || snapshotId.isBlank()) {
            throw new IllegalArgumentException("snapshotId cannot be null or blank");
        }
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (threadId == null) {
            throw new IllegalArgumentException("threadId cannot be null");
        }
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        if (stateJson == null) {
            throw new IllegalArgumentException("stateJson cannot be null");
        }
    }

    /**
     * 소유자 확인.
     *
     * @param candidate 비교할 사용자
     * @return 이 스냅샷의 소유자이면 true
     */
    public boolean isOwnedBy(UserId candidate) {
        return userId.equals(candidate);
    }
}
