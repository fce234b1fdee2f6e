package com.ryuqq.agentstream.core.spi;

import com.ryuqq.agentstream.core.model.RunId;
import com.ryuqq.agentstream.core.model.ThreadId;
import com.ryuqq.agentstream.core.model.UserId;
import com.ryuqq.agentstream.core.state.RequestState;

import java.util.Optional;

/**
 * Run 상태 저장소 SPI (State Store Bridge).
 *
 * <p>Orchestrator는 Stage 처리마다 이 인터페이스로 checkpoint를 남기고,
 * run 시작 시 같은 runId의 스냅샷이 있으면 재개합니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>save 후 load는 저장한 상태와 같은 값을 반환해야 함 (무손실 round trip)</li>
 *   <li>다른 사용자가 소유한 runId에 대한 save는 실패해야 함 ({@code success = false})</li>
 *   <li>load(runId, userId)는 소유자가 다르면 empty를 반환해야 함</li>
 *   <li>알 수 없는 runId는 예외 없이 empty</li>
 *   <li>thread-safe</li>
 * </ul>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public interface StateStore {

    /**
     * 상태 스냅샷 저장.
     *
     * @param runId run 식별자
     * @param threadId 스레드 식별자
     * @param userId 소유 사용자
     * @param state 저장할 상태
     * @return 저장 결과 (예외 대신 success 플래그로 실패 전달)
     */
    SaveResult save(RunId runId, ThreadId threadId, UserId userId, RequestState state);

    /**
     * 최신 스냅샷 조회.
     *
     * @param runId run 식별자
     * @return 상태 (없으면 empty)
     */
    Optional<RequestState> load(RunId runId);

    /**
     * 소유자 범위 조회.
     *
     * @param runId run 식별자
     * @param userId 요청 사용자
     * @return 해당 사용자가 소유한 상태 (없거나 소유자가 다르면 empty)
     */
    Optional<RequestState> load(RunId runId, UserId userId);

    /**
     * 스레드 요약 조회.
     *
     * @param threadId 스레드 식별자
     * @return 스레드 컨텍스트 (저장된 run이 없으면 empty)
     */
    Optional<ThreadContext> getThreadContext(ThreadId threadId);

    /**
     * TTL이 지난 스냅샷 삭제.
     *
     * @return 삭제된 스냅샷 수
     */
    int purgeExpired();
}
