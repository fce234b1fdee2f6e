package com.ryuqq.agentstream.core.state;

/**
 * 하나의 Stage가 run에 남긴 결과.
 *
 * @author AgentStream Team
 * @since 1.0.0
 * @param stageName Stage 이름
 * @param status 처리 결과
 * @param attempts 실행 시도 횟수 (SKIPPED이면 0)
 * @param output Stage 출력 요약 (nullable)
 * @param errorMessage 실패 사유 (FAILED일 때만, nullable)
 * @param completedAt 결과 기록 시각 (epoch millis)
 */
public record StageResult(
    String stageName,
    StageStatus status,
    int attempts,
    String output,
    String errorMessage,
    long completedAt
) {

    public StageResult {
        if (stageName == null || stageName.isBlank()) {
            throw new IllegalArgumentException("stageName cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must not be negative (current: " + attempts + ")");
        }
        if (status == StageStatus.SKIPPED && attempts != 0) {
            throw new IllegalArgumentException("skipped stage must have 0 attempts (current: " + attempts + ")");
        }
    }

    /**
     * Stage가 출력 요약을 남기는 속성 키.
     *
     * <p>Stage가 이 키로 속성을 기록하면 Orchestrator는 그 값을 {@link #output()}에 담습니다.</p>
     *
     * @param stageName Stage 이름
     * @return 속성 키 (예: triage.output)
     */
    public static String outputAttribute(String stageName) {
        return stageName + ".output";
    }

    public static StageResult completed(String stageName, int attempts, String output, long completedAt) {
        return new StageResult(stageName, StageStatus.COMPLETED, attempts, output, null, completedAt);
    }

    public static StageResult skipped(String stageName, long completedAt) {
        return new StageResult(stageName, StageStatus.SKIPPED, 0, null, null, completedAt);
    }

    public static StageResult failed(String stageName, int attempts, String errorMessage, long completedAt) {
        return new StageResult(stageName, StageStatus.FAILED, attempts, null, errorMessage, completedAt);
    }
}
