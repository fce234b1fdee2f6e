package com.ryuqq.agentstream.application.resource;

import com.ryuqq.agentstream.core.error.QuotaExceededException;
import com.ryuqq.agentstream.core.model.RequestId;
import com.ryuqq.agentstream.core.model.ThreadId;
import com.ryuqq.agentstream.core.model.UserId;

import java.util.Optional;

/**
 * 사용자별로 격리되고 개수가 제한된 리소스 핸들 발급.
 *
 * <p><strong>한도:</strong></p>
 * <ul>
 *   <li>사용자별 live 핸들 수는 maxClientsPerUser를 넘지 않음</li>
 *   <li>한도 도달 시 해당 사용자의 유휴 핸들을 먼저 정리한 뒤, 여전히 초과하면 거부</li>
 *   <li>전체 live 핸들 수는 maxTotalHandles를 넘지 않음</li>
 * </ul>
 *
 * <p><strong>사용 중 핸들:</strong> {@link #acquireHandle}로 얻은 핸들은 같은 횟수만큼
 * {@link #release}될 때까지 사용 중이며, 한도 초과 sweep과 유휴 회수 대상에서 제외됩니다.</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public interface ResourceFactory {

    /**
     * 핸들 생성. 같은 (userId, requestId)의 live 핸들이 있으면 그 핸들을 반환합니다.
     *
     * @param userId 사용자
     * @param requestId 요청
     * @param threadId 스레드
     * @return live 핸들
     * @throws QuotaExceededException 사용자별 또는 전체 한도 초과
     */
    ResourceHandle createHandle(UserId userId, RequestId requestId, ThreadId threadId);

    /**
     * 핸들을 생성(또는 기존 핸들 재사용)하고 사용 중으로 표시.
     *
     * <p>호출마다 {@link #release} 한 번으로 반환해야 합니다. 마지막 사용자가 반환할 때
     * 핸들이 해제됩니다.</p>
     *
     * @param userId 사용자
     * @param requestId 요청
     * @param threadId 스레드
     * @return 사용 중으로 표시된 live 핸들
     * @throws QuotaExceededException 사용자별 또는 전체 한도 초과
     */
    ResourceHandle acquireHandle(UserId userId, RequestId requestId, ThreadId threadId);

    /**
     * 핸들 해제.
     *
     * <p>사용 중인 핸들이면 acquire 한 번을 반환하고, 남은 사용자가 없을 때만 해제합니다.
     * 이미 해제된 핸들이면 아무 일도 하지 않습니다.</p>
     *
     * @param handle 해제할 핸들
     * @return 실제로 해제했으면 true
     */
    boolean release(ResourceHandle handle);

    /**
     * 사용자의 모든 핸들 해제. 사용 중인 핸들도 해제합니다.
     *
     * @param userId 사용자
     * @return 해제된 핸들 수
     */
    int cleanupUser(UserId userId);

    /**
     * 범위 한정 핸들 사용. 콜백이 성공하든, 실패하든, 인터럽트되든 acquire한 핸들을 반환합니다.
     * 같은 (userId, requestId)를 다른 곳에서 사용 중이면 핸들은 남아 있습니다.
     *
     * @param userId 사용자
     * @param requestId 요청
     * @param threadId 스레드
     * @param callback 실행할 작업
     * @param <T> 결과 타입
     * @return 콜백 결과
     * @throws Exception 콜백 실패 또는 한도 초과
     */
    <T> T withHandle(UserId userId, RequestId requestId, ThreadId threadId, HandleCallback<T> callback) throws Exception;

    /**
     * live 핸들 조회. 다른 사용자의 requestId로는 조회되지 않습니다.
     */
    Optional<ResourceHandle> findHandle(UserId userId, RequestId requestId);

    int liveHandleCount(UserId userId);

    int totalLiveHandles();
}
