package com.ryuqq.agentstream.adapter.inmemory.store;

/**
 * InMemoryStateStore 설정 (불변 record).
 *
 * @author AgentStream Team
 * @since 1.0.0
 * @param snapshotTtlMs 스냅샷 보존 기간 (밀리초, 양수여야 함)
 */
public record StateStoreConfig(long snapshotTtlMs) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: snapshotTtlMs=86400000ms (24시간)</p>
     */
    public StateStoreConfig() {
        this(86_400_000L);
    }

    public StateStoreConfig {
        if (snapshotTtlMs <= 0) {
            throw new IllegalArgumentException(
                "snapshotTtlMs must be positive (current: " + snapshotTtlMs + ")"
            );
        }
    }

    /**
     * snapshotTtlMs만 변경한 새 인스턴스 생성.
     */
    public StateStoreConfig withSnapshotTtlMs(long snapshotTtlMs) {
        return new StateStoreConfig(snapshotTtlMs);
    }
}
