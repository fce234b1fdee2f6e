package com.ryuqq.agentstream.adapter.inmemory.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.agentstream.core.model.RunId;
import com.ryuqq.agentstream.core.model.ThreadId;
import com.ryuqq.agentstream.core.model.UserId;
import com.ryuqq.agentstream.core.state.RequestState;
import com.ryuqq.agentstream.core.state.RunStatus;
import com.ryuqq.agentstream.core.state.StageResult;
import com.ryuqq.agentstream.core.state.StageStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RequestState ↔ JSON 변환 (Jackson).
 *
 * <p>Stage 결과는 순서를 보존하기 위해 배열로 저장됩니다.</p>
 *
 * <pre>
 * {
 *   "userId": "user-1", "threadId": "thread-1", "runId": "run-1",
 *   "userRequest": "...", "status": "RUNNING",
 *   "createdAt": 1000, "updatedAt": 1010, "failureReason": null,
 *   "stages": [{"stageName": "triage", "status": "COMPLETED", "attempts": 1, ...}],
 *   "attributes": {"triage.category": "gpu"}
 * }
 * </pre>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public final class RequestStateSerializer {

    private final ObjectMapper objectMapper;

    public RequestStateSerializer() {
        this(new ObjectMapper());
    }

    public RequestStateSerializer(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper.copy()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * 직렬화.
     *
     * @param state 상태
     * @return JSON 문자열
     * @throws IllegalStateException 직렬화 실패
     */
    public String serialize(RequestState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        List<StageDocument> stages = new ArrayList<>();
        for (StageResult result : state.getStageResults().values()) {
            stages.add(new StageDocument(
                result.stageName(),
                result.status().name(),
                result.attempts(),
                result.output(),
                result.errorMessage(),
                result.completedAt()
            ));
        }
        StateDocument document = new StateDocument(
            state.getUserId().getValue(),
            state.getThreadId().getValue(),
            state.getRunId().getValue(),
            state.getUserRequest(),
            state.getStatus().name(),
            state.getCreatedAt(),
            state.getUpdatedAt(),
            state.getFailureReason(),
            stages,
            new LinkedHashMap<>(state.getAttributes())
        );
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize state of " + state.getRunId(), e);
        }
    }

    /**
     * 역직렬화.
     *
     * @param json JSON 문자열
     * @return 복원된 상태
     * @throws IllegalStateException JSON이 손상된 경우
     */
    public RequestState deserialize(String json) {
        if (json == null) {
            throw new IllegalArgumentException("json cannot be null");
        }
        StateDocument document;
        try {
            document = objectMapper.readValue(json, StateDocument.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize request state", e);
        }

        Map<String, StageResult> stageResults = new LinkedHashMap<>();
        if (document.stages() != null) {
            for (StageDocument stage : document.stages()) {
                stageResults.put(stage.stageName(), new StageResult(
                    stage.stageName(),
                    StageStatus.valueOf(stage.status()),
                    stage.attempts(),
                    stage.output(),
                    stage.errorMessage(),
                    stage.completedAt()
                ));
            }
        }
        return RequestState.restore(
            UserId.of(document.userId()),
            ThreadId.of(document.threadId()),
            RunId.of(document.runId()),
            document.userRequest(),
            stageResults,
            RunStatus.valueOf(document.status()),
            document.createdAt(),
            document.updatedAt(),
            document.failureReason(),
            document.attributes() == null ? Map.of() : document.attributes()
        );
    }

    record StateDocument(
        String userId,
        String threadId,
        String runId,
        String userRequest,
        String status,
        long createdAt,
        long updatedAt,
        String failureReason,
        List<StageDocument> stages,
        Map<String, String> attributes
    ) {
    }

    record StageDocument(
        String stageName,
        String status,
        int attempts,
        String output,
        String errorMessage,
        long completedAt
    ) {
    }
}
