package com.ryuqq.agentstream.core.state;

import com.ryuqq.agentstream.core.model.RunId;
import com.ryuqq.agentstream.core.model.ThreadId;
import com.ryuqq.agentstream.core.model.UserId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 진행 중인 사용자 요청 하나의 상태 (불변, copy-on-write).
 *
 * <p>Stage는 상태를 직접 변경하지 않고 {@code withXxx()} 메서드로 새 인스턴스를 반환합니다.
 * Orchestrator만이 run의 현재 참조를 교체하는 유일한 writer입니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>{@code userRequest}는 생성 시 값 그대로 유지됩니다 (trim 등 변형 없음)</li>
 *   <li>{@code stageResults}는 Stage 처리 순서를 유지합니다</li>
 *   <li>상태 전이는 {@link RunStateTransition} 규칙을 따릅니다</li>
 * </ul>
 *
 * <p>equals/hashCode는 모든 필드를 비교하므로, 저장 후 다시 불러온 상태는
 * 원본과 같아야 합니다.</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public final class RequestState {

    private final UserId userId;
    private final ThreadId threadId;
    private final RunId runId;
    private final String userRequest;
    private final Map<String, StageResult> stageResults;
    private final RunStatus status;
    private final long createdAt;
    private final long updatedAt;
    private final String failureReason;
    private final Map<String, String> attributes;

    private RequestState(
        UserId userId,
        ThreadId threadId,
        RunId runId,
        String userRequest,
        Map<String, StageResult> stageResults,
        RunStatus status,
        long createdAt,
        long updatedAt,
        String failureReason,
        Map<String, String> attributes
    ) {
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        if (threadId == null) {
            throw new IllegalArgumentException("threadId cannot be null");
        }
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (userRequest == null) {
            throw new IllegalArgumentException("userRequest cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (stageResults == null) {
            throw new IllegalArgumentException("stageResults cannot be null");
        }
        if (attributes == null) {
            throw new IllegalArgumentException("attributes cannot be null");
        }
        this.userId = userId;
        this.threadId = threadId;
        this.runId = runId;
        this.userRequest = userRequest;
        this.stageResults = Collections.unmodifiableMap(new LinkedHashMap<>(stageResults));
        this.status = status;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.failureReason = failureReason;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * 새 요청 상태 생성 (PENDING).
     *
     * @param userId 소유 사용자
     * @param threadId 스레드
     * @param runId run 식별자
     * @param userRequest 사용자 요청 원문
     * @param now 생성 시각 (epoch millis)
     * @return PENDING 상태의 RequestState
     */
    public static RequestState create(UserId userId, ThreadId threadId, RunId runId, String userRequest, long now) {
        return new RequestState(
            userId, threadId, runId, userRequest,
            Map.of(), RunStatus.PENDING, now, now, null, Map.of()
        );
    }

    /**
     * 저장된 필드 값으로 상태 복원.
     *
     * <p>StateStore 구현체가 스냅샷을 역직렬화할 때 사용합니다. 전이 규칙은 검사하지 않습니다.</p>
     */
    public static RequestState restore(
        UserId userId,
        ThreadId threadId,
        RunId runId,
        String userRequest,
        Map<String, StageResult> stageResults,
        RunStatus status,
        long createdAt,
        long updatedAt,
        String failureReason,
        Map<String, String> attributes
    ) {
        return new RequestState(
            userId, threadId, runId, userRequest, stageResults,
            status, createdAt, updatedAt, failureReason, attributes
        );
    }

    /**
     * 상태 전이.
     *
     * @param next 다음 상태
     * @param now 전이 시각
     * @return 새 RequestState
     * @throws IllegalStateException 허용되지 않은 전이인 경우
     */
    public RequestState transitionTo(RunStatus next, long now) {
        RunStatus validated = RunStateTransition.transition(status, next);
        return new RequestState(
            userId, threadId, runId, userRequest, stageResults,
            validated, createdAt, now, failureReason, attributes
        );
    }

    /**
     * FAILED로 전이하면서 실패 사유 기록.
     *
     * @param reason 실패 사유
     * @param now 전이 시각
     * @return 새 RequestState
     */
    public RequestState fail(String reason, long now) {
        RunStatus validated = RunStateTransition.transition(status, RunStatus.FAILED);
        return new RequestState(
            userId, threadId, runId, userRequest, stageResults,
            validated, createdAt, now, reason, attributes
        );
    }

    /**
     * Stage 결과 추가 (같은 이름이 있으면 교체, 순서는 최초 기록 위치 유지).
     *
     * @param result Stage 결과
     * @return 새 RequestState
     */
    public RequestState withStageResult(StageResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        Map<String, StageResult> next = new LinkedHashMap<>(stageResults);
        next.put(result.stageName(), result);
        return new RequestState(
            userId, threadId, runId, userRequest, next,
            status, createdAt, Math.max(updatedAt, result.completedAt()), failureReason, attributes
        );
    }

    /**
     * 속성 추가. 이후 Stage가 읽을 수 있는 값을 남길 때 사용합니다.
     *
     * @param key 속성 키
     * @param value 속성 값
     * @return 새 RequestState
     */
    public RequestState withAttribute(String key, String value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        Map<String, String> next = new LinkedHashMap<>(attributes);
        next.put(key, value);
        return new RequestState(
            userId, threadId, runId, userRequest, stageResults,
            status, createdAt, updatedAt, failureReason, next
        );
    }

    public boolean hasResultFor(String stageName) {
        return stageResults.containsKey(stageName);
    }

    public Optional<StageResult> findStageResult(String stageName) {
        return Optional.ofNullable(stageResults.get(stageName));
    }

    public Optional<String> findAttribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    /**
     * 주어진 결과 상태를 가진 Stage 수.
     *
     * @param stageStatus 결과 상태
     * @return 개수
     */
    public int countStages(StageStatus stageStatus) {
        int count = 0;
        for (StageResult result : stageResults.values()) {
            if (result.status() == stageStatus) {
                count++;
            }
        }
        return count;
    }

    /**
     * 실제로 실행된 (SKIPPED가 아닌) Stage 이름 목록, 처리 순서대로.
     *
     * @return Stage 이름 목록
     */
    public List<String> executedStageNames() {
        List<String> names = new ArrayList<>();
        for (StageResult result : stageResults.values()) {
            if (result.status() != StageStatus.SKIPPED) {
                names.add(result.stageName());
            }
        }
        return Collections.unmodifiableList(names);
    }

    public UserId getUserId() {
        return userId;
    }

    public ThreadId getThreadId() {
        return threadId;
    }

    public RunId getRunId() {
        return runId;
    }

    public String getUserRequest() {
        return userRequest;
    }

    public Map<String, StageResult> getStageResults() {
        return stageResults;
    }

    public RunStatus getStatus() {
        return status;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    /**
     * 실패 사유 조회.
     *
     * @return 실패 사유 (FAILED가 아니면 null)
     */
    public String getFailureReason() {
        return failureReason;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RequestState that = (RequestState) o;
        return createdAt == that.createdAt
            && updatedAt == that.updatedAt
            && userId.equals(that.userId)
            && threadId.equals(that.threadId)
            && runId.equals(that.runId)
            && userRequest.equals(that.userRequest)
            && new ArrayList<>(stageResults.values()).equals(new ArrayList<>(that.stageResults.values()))
            && status == that.status
            && Objects.equals(failureReason, that.failureReason)
            && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, threadId, runId, userRequest, stageResults, status,
            createdAt, updatedAt, failureReason, attributes);
    }

    @Override
    public String toString() {
        return "RequestState{" +
            "runId=" + runId +
            ", userId=" + userId +
            ", threadId=" + threadId +
            ", status=" + status +
            ", stages=" + stageResults.keySet() +
            '}';
    }
}
