package com.ryuqq.agentstream.application.orchestrator;

import com.ryuqq.agentstream.core.error.RunTimeoutException;
import com.ryuqq.agentstream.core.model.RunId;
import com.ryuqq.agentstream.core.model.ThreadId;
import com.ryuqq.agentstream.core.model.UserId;
import com.ryuqq.agentstream.core.state.RequestState;

import java.util.concurrent.CompletableFuture;

/**
 * 사용자 요청 하나를 Stage 파이프라인으로 처리하는 진입점.
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * 1. 입력 검증 (ValidationException, 재시도 없음)
 * 2. runId를 활성 run으로 등록 (중복 시 IllegalStateException)
 * 3. 소유자 범위 스냅샷 조회
 *    - 없음: 새 RequestState (PENDING)
 *    - 종료 상태: 재실행 없이 그대로 반환
 *    - 진행 중: 결과가 있는 Stage를 건너뛰고 재개
 * 4. 리소스 핸들 획득 (userId, requestId = runId), 모든 종료 경로에서 해제
 * 5. PENDING → RUNNING, agent_started 발행, checkpoint
 * 6. Stage별: 진입 조건 → agent_thinking → 실행(재시도) → checkpoint
 * 7. 종료: agent_completed 또는 terminal error 이벤트 (정확히 하나)
 * </pre>
 *
 * <p>Stage 오류는 run 밖으로 전파되지 않습니다. 반환된 RequestState의
 * status와 stageResults로 결과를 확인합니다.</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public interface Orchestrator {

    /**
     * 동기 실행.
     *
     * @param request 실행 요청
     * @return 최종 (또는 halt 시 부분 완료된) 상태
     * @throws com.ryuqq.agentstream.core.error.ValidationException 입력이 잘못된 경우
     * @throws IllegalStateException 같은 runId의 run이 이미 실행 중인 경우
     * @throws com.ryuqq.agentstream.core.error.QuotaExceededException run 시작 전 리소스 한도 초과
     */
    RequestState run(RunRequest request);

    /**
     * 동기 실행 (개별 식별자).
     *
     * @param userRequest 사용자 요청 원문
     * @param threadId 스레드
     * @param userId 사용자
     * @param runId run 식별자
     * @return 최종 상태
     */
    default RequestState run(String userRequest, ThreadId threadId, UserId userId, RunId runId) {
        return run(new RunRequest(userRequest, threadId, userId, runId));
    }

    /**
     * 외부 deadline을 적용한 실행.
     *
     * <p>deadline이 지나면 run은 인터럽트로 취소되고 terminal {@code error}(RUN_TIMEOUT)
     * 이벤트가 발행됩니다. 이미 수행된 부작용은 롤백되지 않습니다.</p>
     *
     * @param request 실행 요청
     * @param timeoutMs deadline (밀리초, 양수)
     * @return 최종 상태
     * @throws RunTimeoutException deadline 초과
     */
    RequestState run(RunRequest request, long timeoutMs);

    /**
     * 워커 풀에 비동기 제출. 구현체의 기본 deadline이 적용됩니다.
     *
     * @param request 실행 요청
     * @return 최종 상태를 담은 Future
     */
    CompletableFuture<RequestState> submit(RunRequest request);

    /**
     * deadline을 지정하여 워커 풀에 비동기 제출.
     *
     * <p>deadline이 지나면 Future는 {@link RunTimeoutException}으로 완료됩니다.</p>
     *
     * @param request 실행 요청
     * @param timeoutMs deadline (밀리초, 양수)
     * @return 최종 상태를 담은 Future
     */
    CompletableFuture<RequestState> submit(RunRequest request, long timeoutMs);

    /**
     * run 실행 중 여부.
     *
     * @param runId run 식별자
     * @return 실행 중이면 true
     */
    boolean isActive(RunId runId);
}
