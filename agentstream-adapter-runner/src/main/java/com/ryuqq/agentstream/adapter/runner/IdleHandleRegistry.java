package com.ryuqq.agentstream.adapter.runner;

import com.ryuqq.agentstream.application.resource.ResourceHandle;

import java.util.List;

/**
 * IdleHandleReaper가 사용하는 유휴 핸들 조회/회수 연산.
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public interface IdleHandleRegistry {

    /**
     * 유휴 핸들 조회.
     *
     * @param idleThresholdMs 마지막 사용 이후 경과 시간 기준 (밀리초)
     * @param limit 최대 반환 개수
     * @return 사용 중이 아니고 기준 이상 유휴 상태인 핸들 (오래된 순)
     */
    List<ResourceHandle> findIdleHandles(long idleThresholdMs, int limit);

    /**
     * 여전히 유휴 상태이면 핸들 해제.
     *
     * <p>조회 이후 다시 사용되었거나 acquire된 핸들은 해제하지 않습니다.</p>
     *
     * @param handle 대상 핸들
     * @param idleThresholdMs 유휴 기준 (밀리초)
     * @return 해제했으면 true
     */
    boolean releaseIfIdle(ResourceHandle handle, long idleThresholdMs);
}
