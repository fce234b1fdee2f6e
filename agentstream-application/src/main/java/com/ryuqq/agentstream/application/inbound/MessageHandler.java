package com.ryuqq.agentstream.application.inbound;

import com.ryuqq.agentstream.core.model.ThreadId;
import com.ryuqq.agentstream.core.model.UserId;

/**
 * 클라이언트 연결에서 들어오는 메시지 처리.
 *
 * <p>메시지 형식: {@code {"type": "...", "payload": {...}}}</p>
 * <ul>
 *   <li>형식 오류: {@code error} 이벤트 (사람이 읽을 수 있는 사유 포함)</li>
 *   <li>{@code ping}: {@code pong}</li>
 *   <li>{@code chat_message} / {@code user_message} (payload.text 필수): run 제출</li>
 *   <li>그 외: 원본 메시지를 그대로 {@code echo}</li>
 * </ul>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public interface MessageHandler {

    /**
     * 연결 수립 알림. {@code connection_established} 이벤트를 발행합니다.
     *
     * @param userId 사용자
     * @param threadId 스레드
     */
    void onConnect(UserId userId, ThreadId threadId);

    /**
     * 수신 메시지 처리. 예외를 던지지 않습니다.
     *
     * @param userId 사용자
     * @param threadId 스레드
     * @param rawMessage 원본 JSON 문자열
     * @return 처리 결과
     */
    InboundResult handle(UserId userId, ThreadId threadId, String rawMessage);
}
