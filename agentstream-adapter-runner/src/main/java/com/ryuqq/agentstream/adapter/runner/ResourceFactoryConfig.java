package com.ryuqq.agentstream.adapter.runner;

/**
 * UserResourceFactory 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxClientsPerUser: 사용자별 live 핸들 한도 (기본 20)</li>
 *   <li>maxTotalHandles: 전체 live 핸들 한도 (기본 1000)</li>
 *   <li>clientTtlMs: 이 시간 이상 사용되지 않은 핸들은 IdleHandleReaper가 회수 (기본 1800000ms = 30분)</li>
 *   <li>quotaSweepIdleMs: 한도 도달 시 즉시 정리할 유휴 기준 (기본 10000ms)</li>
 * </ul>
 *
 * @author AgentStream Team
 * @since 1.0.0
 * @param maxClientsPerUser 사용자별 한도 (양수)
 * @param maxTotalHandles 전체 한도 (maxClientsPerUser 이상)
 * @param clientTtlMs 유휴 TTL (밀리초, 양수)
 * @param quotaSweepIdleMs 한도 초과 시 정리 기준 (밀리초, 양수)
 */
public record ResourceFactoryConfig(
    int maxClientsPerUser,
    int maxTotalHandles,
    long clientTtlMs,
    long quotaSweepIdleMs
) {

    public ResourceFactoryConfig() {
        this(20, 1000, 1_800_000L, 10_000L);
    }

    public ResourceFactoryConfig {
        if (maxClientsPerUser <= 0) {
            throw new IllegalArgumentException(
                "maxClientsPerUser must be positive (current: " + maxClientsPerUser + ")"
            );
        }
        if (maxTotalHandles < maxClientsPerUser) {
            throw new IllegalArgumentException(
                "maxTotalHandles must be >= maxClientsPerUser (perUser: " + maxClientsPerUser
                    + ", total: " + maxTotalHandles + ")"
            );
        }
        if (clientTtlMs <= 0) {
            throw new IllegalArgumentException(
                "clientTtlMs must be positive (current: " + clientTtlMs + ")"
            );
        }
        if (quotaSweepIdleMs <= 0) {
            throw new IllegalArgumentException(
                "quotaSweepIdleMs must be positive (current: " + quotaSweepIdleMs + ")"
            );
        }
    }

    public ResourceFactoryConfig withMaxClientsPerUser(int maxClientsPerUser) {
        return new ResourceFactoryConfig(maxClientsPerUser, maxTotalHandles, clientTtlMs, quotaSweepIdleMs);
    }

    public ResourceFactoryConfig withMaxTotalHandles(int maxTotalHandles) {
        return new ResourceFactoryConfig(maxClientsPerUser, maxTotalHandles, clientTtlMs, quotaSweepIdleMs);
    }

    public ResourceFactoryConfig withClientTtlMs(long clientTtlMs) {
        return new ResourceFactoryConfig(maxClientsPerUser, maxTotalHandles, clientTtlMs, quotaSweepIdleMs);
    }

    public ResourceFactoryConfig withQuotaSweepIdleMs(long quotaSweepIdleMs) {
        return new ResourceFactoryConfig(maxClientsPerUser, maxTotalHandles, clientTtlMs, quotaSweepIdleMs);
    }
}
