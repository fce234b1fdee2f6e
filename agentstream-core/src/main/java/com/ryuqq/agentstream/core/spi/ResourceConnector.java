package com.ryuqq.agentstream.core.spi;

import com.ryuqq.agentstream.core.model.UserId;

/**
 * 사용자 전용 ResourceClient 연결 팩토리.
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResourceConnector {

    /**
     * 새 클라이언트 연결.
     *
     * @param userId 클라이언트를 사용할 사용자
     * @return 연결된 클라이언트
     * @throws Exception 연결 실패 (호출자가 ResourceConnectionException으로 감쌈)
     */
    ResourceClient connect(UserId userId) throws Exception;
}
