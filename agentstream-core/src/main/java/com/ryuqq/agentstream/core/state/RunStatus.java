package com.ryuqq.agentstream.core.state;

/**
 * Run 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <pre>
 * PENDING → RUNNING → COMPLETED
 *                   → FAILED
 * </pre>
 *
 * <p>COMPLETED/FAILED는 종료 상태이며, 종료 상태의 스냅샷은 재실행 없이 그대로 반환됩니다.</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public enum RunStatus {

    /**
     * 생성되었으나 아직 Stage를 실행하지 않은 상태.
     */
    PENDING,

    /**
     * Stage 파이프라인 실행 중. 스냅샷이 이 상태로 남아 있으면 재개 대상입니다.
     */
    RUNNING,

    /**
     * 모든 Stage 처리 완료 (종료 상태).
     */
    COMPLETED,

    /**
     * Stage 실패(halt 정책), 타임아웃 또는 리소스 오류로 종료 (종료 상태).
     */
    FAILED;

    /**
     * 종료 상태 여부.
     *
     * @return COMPLETED 또는 FAILED이면 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
