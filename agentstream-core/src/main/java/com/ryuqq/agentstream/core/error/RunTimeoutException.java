package com.ryuqq.agentstream.core.error;

/**
 * Run이 외부에서 부여한 deadline을 초과한 경우.
 *
 * <p>Run은 취소되고 terminal {@code error} 이벤트가 발행된 뒤 이 예외가 호출자에게 전달됩니다.
 * 이미 수행된 부분 부작용은 롤백되지 않습니다.</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public class RunTimeoutException extends AgentStreamException {

    private static final long serialVersionUID = 1L;

    public static final String ERROR_CODE = "RUN_TIMEOUT";

    private final String runId;
    private final long timeoutMs;

    public RunTimeoutException(String runId, long timeoutMs) {
        super(ERROR_CODE, "Run " + runId + " timed out after " + timeoutMs + "ms", null);
        this.runId = runId;
        this.timeoutMs = timeoutMs;
    }

    public String getRunId() {
        return runId;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
