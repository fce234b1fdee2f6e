package com.ryuqq.agentstream.adapter.runner;

import com.ryuqq.agentstream.application.resource.ResourceHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 유휴 리소스 핸들 회수.
 *
 * <p>TTL(clientTtlMs) 이상 사용되지 않은 핸들을 찾아 해제합니다.
 * 핸들 하나의 해제가 실패해도 나머지 핸들 처리는 계속됩니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. findIdleHandles(idleThreshold, batchSize) → [handle1, handle2, ...]
 * 2. For each handle: releaseIfIdle(handle, idleThreshold)
 * 3. 회수 개수 로깅
 * </pre>
 *
 * <p>스캔 주기는 호출자가 결정합니다. {@link UserResourceFactory#start()}가
 * {@link ReaperConfig#scanIntervalMs()} 간격으로 스케줄합니다.</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public final class IdleHandleReaper {

    private static final Logger log = LoggerFactory.getLogger(IdleHandleReaper.class);

    private final IdleHandleRegistry registry;
    private final ReaperConfig config;
    private final long idleThresholdMs;

    /**
     * 생성자.
     *
     * @param registry 핸들 레지스트리
     * @param config 설정
     * @param idleThresholdMs 유휴 기준 (밀리초, 양수)
     * @throws IllegalArgumentException 의존성이 null이거나 기준이 양수가 아닌 경우
     */
    public IdleHandleReaper(IdleHandleRegistry registry, ReaperConfig config, long idleThresholdMs) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (idleThresholdMs <= 0) {
            throw new IllegalArgumentException(
                "idleThresholdMs must be positive (current: " + idleThresholdMs + ")"
            );
        }
        this.registry = registry;
        this.config = config;
        this.idleThresholdMs = idleThresholdMs;
    }

    /**
     * 유휴 핸들 스캔 및 회수.
     *
     * @return 회수된 핸들 수
     */
    public int scan() {
        List<ResourceHandle> idle = registry.findIdleHandles(idleThresholdMs, config.batchSize());

        int reclaimed = 0;
        for (ResourceHandle handle : idle) {
            if (tryReclaim(handle)) {
                reclaimed++;
            }
        }

        if (!idle.isEmpty()) {
            log.info("Idle handle scan completed: {} reclaimed out of {} idle", reclaimed, idle.size());
        }
        return reclaimed;
    }

    private boolean tryReclaim(ResourceHandle handle) {
        try {
            boolean released = registry.releaseIfIdle(handle, idleThresholdMs);
            if (released) {
                log.debug("Reclaimed idle handle {}", handle);
            }
            return released;
        } catch (Exception e) {
            log.error("Failed to reclaim idle handle {}", handle, e);
            return false;
        }
    }
}
