package com.ryuqq.agentstream.core.error;

/**
 * 잘못된 입력 (식별자, 요청 본문, 설정 값 등).
 *
 * <p>Orchestrator와 Resource Factory는 입력 검증에 실패하면 즉시 이 예외를 던지며,
 * 이 예외는 절대 재시도되지 않습니다.</p>
 *
 * <p>{@link IllegalArgumentException}을 상속하므로 기존 precondition 검사와 같은 방식으로
 * 처리할 수 있습니다.</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public class ValidationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 생성자.
     *
     * @param message 사람이 읽을 수 있는 검증 실패 사유
     */
    public ValidationException(String message) {
        super(message);
    }
}
