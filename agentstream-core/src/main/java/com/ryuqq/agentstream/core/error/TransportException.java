package com.ryuqq.agentstream.core.error;

/**
 * 이벤트 전송 실패 (연결 없음, 연결 끊김, 전송 계층 오류).
 *
 * <p>{@link com.ryuqq.agentstream.core.spi.EventTransport} 구현체가 던지며,
 * Event Notifier 밖으로는 전파되지 않습니다.</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public class TransportException extends AgentStreamException {

    private static final long serialVersionUID = 1L;

    public static final String ERROR_CODE = "TRANSPORT_FAILED";

    public TransportException(String message) {
        super(ERROR_CODE, message, null);
    }

    public TransportException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
