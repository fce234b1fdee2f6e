package com.ryuqq.agentstream.application.resource;

import com.ryuqq.agentstream.core.model.RequestId;
import com.ryuqq.agentstream.core.model.ThreadId;
import com.ryuqq.agentstream.core.model.UserId;

import java.util.Map;

/**
 * (userId, requestId) 하나에 묶인 격리된 리소스 핸들.
 *
 * <p>핸들은 ResourceFactory가 소유하며, 하위 클라이언트는 첫 사용 시점에 연결되고
 * health check를 거칩니다. 연결에 실패하면
 * {@link com.ryuqq.agentstream.core.error.ResourceConnectionException}이 발생하고
 * 핸들은 초기화되지 않은 상태로 남습니다.</p>
 *
 * <p>모든 명령은 {@link #userId()}로 태깅되어 클라이언트에 전달됩니다.
 * 해제된 핸들로 명령을 실행하면 {@link IllegalStateException}이 발생합니다.</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public interface ResourceHandle {

    UserId userId();

    RequestId requestId();

    ThreadId threadId();

    long createdAt();

    long lastUsedAt();

    long operationCount();

    long errorCount();

    /**
     * 하위 클라이언트 연결 여부.
     */
    boolean isInitialized();

    /**
     * 팩토리에서 해제되었는지 여부.
     */
    boolean isReleased();

    /**
     * acquire된 뒤 아직 반환되지 않았는지 여부. 사용 중인 핸들은 유휴 정리 대상이 아닙니다.
     */
    boolean isInUse();

    /**
     * 명령 실행.
     *
     * @param operation 연산 이름
     * @param parameters 연산 파라미터
     * @return 실행 결과
     * @throws com.ryuqq.agentstream.core.error.ResourceConnectionException 연결 실패
     * @throws IllegalStateException 해제된 핸들
     * @throws Exception 클라이언트 실행 실패
     */
    Object execute(String operation, Map<String, Object> parameters) throws Exception;
}
