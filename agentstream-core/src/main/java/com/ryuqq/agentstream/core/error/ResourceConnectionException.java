package com.ryuqq.agentstream.core.error;

/**
 * 하위 리소스(클라이언트)에 연결할 수 없거나 health check가 실패한 경우.
 *
 * <p>원인 예외를 감싸며, 해당 핸들 작업을 요청한 호출자에게만 전달됩니다.
 * 핸들은 초기화되지 않은 상태로 남으므로 호출자는 재시도할 수 있습니다.</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public class ResourceConnectionException extends AgentStreamException {

    private static final long serialVersionUID = 1L;

    public static final String ERROR_CODE = "RESOURCE_UNAVAILABLE";

    public ResourceConnectionException(String message) {
        super(ERROR_CODE, message, null);
    }

    public ResourceConnectionException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
