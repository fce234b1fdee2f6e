package com.ryuqq.agentstream.core.error;

/**
 * AgentStream 런타임 오류의 공통 상위 타입.
 *
 * <p>모든 하위 예외는 클라이언트에게 {@code error} 이벤트로 전달할 수 있는
 * 안정적인 오류 코드를 가집니다.</p>
 *
 * <p><strong>하위 타입:</strong></p>
 * <ul>
 *   <li>{@link ResourceConnectionException}: 하위 리소스 연결 불가 (RESOURCE_UNAVAILABLE)</li>
 *   <li>{@link QuotaExceededException}: 사용자별 리소스 한도 초과 (QUOTA_EXCEEDED)</li>
 *   <li>{@link StageExecutionException}: Stage 자체 로직 실패 (STAGE_FAILED)</li>
 *   <li>{@link RunTimeoutException}: 외부 deadline 초과 (RUN_TIMEOUT)</li>
 *   <li>{@link TransportException}: 이벤트 전송 실패 (TRANSPORT_FAILED)</li>
 * </ul>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public abstract class AgentStreamException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String errorCode;

    protected AgentStreamException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드 (예: QUOTA_EXCEEDED)
     */
    public String getErrorCode() {
        return errorCode;
    }
}
