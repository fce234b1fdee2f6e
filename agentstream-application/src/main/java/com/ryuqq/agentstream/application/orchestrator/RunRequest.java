package com.ryuqq.agentstream.application.orchestrator;

import com.ryuqq.agentstream.core.error.ValidationException;
import com.ryuqq.agentstream.core.model.RunId;
import com.ryuqq.agentstream.core.model.ThreadId;
import com.ryuqq.agentstream.core.model.UserId;

/**
 * Orchestrator 실행 요청.
 *
 * <p>{@code userRequest}는 그대로 RequestState에 보존되며 변형되지 않습니다.</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 * @param userRequest 사용자 요청 원문 (공백만으로 구성될 수 없음)
 * @param threadId 이벤트를 받을 스레드
 * @param userId 요청 사용자
 * @param runId run 식별자
 */
public record RunRequest(String userRequest, ThreadId threadId, UserId userId, RunId runId) {

    public RunRequest {
        if (userRequest == null || userRequest.isBlank()) {
            throw new ValidationException("userRequest cannot be null or blank");
        }
        if (threadId == null) {
            throw new ValidationException("threadId cannot be null");
        }
        if (userId == null) {
            throw new ValidationException("userId cannot be null");
        }
        if (runId == null) {
            throw new ValidationException("runId cannot be null");
        }
    }

    /**
     * 문자열 식별자로 요청 생성.
     *
     * @throws ValidationException 식별자 형식이 잘못된 경우
     */
    public static RunRequest of(String userRequest, String threadId, String userId, String runId) {
        return new RunRequest(userRequest, ThreadId.of(threadId), UserId.of(userId), RunId.of(runId));
    }
}
