package com.ryuqq.agentstream.adapter.runner;

/**
 * PipelineOrchestrator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxRetries: Stage 하나당 첫 시도 이후 추가 재시도 횟수 (기본 2)</li>
 *   <li>haltOnStageFailure: Stage가 최종 실패하면 run을 FAILED로 종료할지 여부 (기본 true).
 *       false이면 실패를 기록하고 다음 Stage로 진행</li>
 *   <li>concurrency: submit()에 사용되는 워커 스레드 수 (기본 8)</li>
 *   <li>defaultRunTimeoutMs: 인바운드 메시지로 제출된 run의 deadline (기본 25000ms)</li>
 * </ul>
 *
 * @author AgentStream Team
 * @since 1.0.0
 * @param maxRetries 재시도 횟수 (0 이상)
 * @param haltOnStageFailure Stage 실패 시 run 중단 여부
 * @param concurrency 워커 스레드 수 (양수)
 * @param defaultRunTimeoutMs 기본 run deadline (밀리초, 양수)
 */
public record OrchestratorConfig(
    int maxRetries,
    boolean haltOnStageFailure,
    int concurrency,
    long defaultRunTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxRetries=2, haltOnStageFailure=true, concurrency=8, defaultRunTimeoutMs=25000</p>
     */
    public OrchestratorConfig() {
        this(2, true, 8, 25_000L);
    }

    public OrchestratorConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException(
                "maxRetries must not be negative (current: " + maxRetries + ")"
            );
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (defaultRunTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "defaultRunTimeoutMs must be positive (current: " + defaultRunTimeoutMs + ")"
            );
        }
    }

    public OrchestratorConfig withMaxRetries(int maxRetries) {
        return new OrchestratorConfig(maxRetries, haltOnStageFailure, concurrency, defaultRunTimeoutMs);
    }

    public OrchestratorConfig withHaltOnStageFailure(boolean haltOnStageFailure) {
        return new OrchestratorConfig(maxRetries, haltOnStageFailure, concurrency, defaultRunTimeoutMs);
    }

    public OrchestratorConfig withConcurrency(int concurrency) {
        return new OrchestratorConfig(maxRetries, haltOnStageFailure, concurrency, defaultRunTimeoutMs);
    }

    public OrchestratorConfig withDefaultRunTimeoutMs(long defaultRunTimeoutMs) {
        return new OrchestratorConfig(maxRetries, haltOnStageFailure, concurrency, defaultRunTimeoutMs);
    }
}
