package com.ryuqq.agentstream.adapter.runner;

/**
 * IdleHandleReaper 설정 (불변 record).
 *
 * <p>유휴 판정 기준은 {@link ResourceFactoryConfig#clientTtlMs()}를 따릅니다.</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수, 기본 60000)
 * @param batchSize 한 번의 스캔에서 회수할 최대 핸들 수 (양수, 기본 100)
 */
public record ReaperConfig(long scanIntervalMs, int batchSize) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=60000ms (1분), batchSize=100</p>
     */
    public ReaperConfig() {
        this(60_000L, 100);
    }

    public ReaperConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
    }

    public ReaperConfig withScanIntervalMs(long scanIntervalMs) {
        return new ReaperConfig(scanIntervalMs, batchSize);
    }

    public ReaperConfig withBatchSize(int batchSize) {
        return new ReaperConfig(scanIntervalMs, batchSize);
    }
}
