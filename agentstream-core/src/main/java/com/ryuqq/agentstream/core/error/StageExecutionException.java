package com.ryuqq.agentstream.core.error;

/**
 * Worker stage 자체 로직 실패.
 *
 * <p>Stage 구현체는 재시도해도 성공할 수 없는 실패(잘못된 입력 데이터 등)를
 * {@code retryable = false}로 알릴 수 있습니다. 그 외 예외는 일시적 실패로 간주되어
 * 설정된 maxRetries까지 재시도됩니다.</p>
 *
 * <p>이 예외는 실행 중인 run 밖으로 전파되지 않고, {@code error} 이벤트로 변환된 뒤
 * halt/continue 정책에 따라 처리됩니다.</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public class StageExecutionException extends AgentStreamException {

    private static final long serialVersionUID = 1L;

    public static final String ERROR_CODE = "STAGE_FAILED";

    private final String stageName;
    private final boolean retryable;

    public StageExecutionException(String stageName, String message, boolean retryable) {
        this(stageName, message, retryable, null);
    }

    public StageExecutionException(String stageName, String message, boolean retryable, Throwable cause) {
        super(ERROR_CODE, message, cause);
        this.stageName = stageName;
        this.retryable = retryable;
    }

    /**
     * 일시적 실패 생성 (재시도 가능).
     *
     * @param stageName Stage 이름
     * @param message 실패 사유
     * @return StageExecutionException
     */
    public static StageExecutionException transientFailure(String stageName, String message) {
        return new StageExecutionException(stageName, message, true);
    }

    /**
     * 영구 실패 생성 (재시도 불가).
     *
     * @param stageName Stage 이름
     * @param message 실패 사유
     * @return StageExecutionException
     */
    public static StageExecutionException permanentFailure(String stageName, String message) {
        return new StageExecutionException(stageName, message, false);
    }

    public String getStageName() {
        return stageName;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
