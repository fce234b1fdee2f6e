package com.ryuqq.agentstream.core.state;

/**
 * 개별 Stage 처리 결과.
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public enum StageStatus {
    COMPLETED,
    SKIPPED,
    FAILED
}
