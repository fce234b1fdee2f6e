package com.ryuqq.agentstream.core.spi;

import com.ryuqq.agentstream.core.error.TransportException;
import com.ryuqq.agentstream.core.event.AgentEvent;
import com.ryuqq.agentstream.core.model.ThreadId;

/**
 * 사용자 연결로 이벤트를 내보내는 전송 계층 SPI.
 *
 * <p>WebSocket 등 실제 연결 관리는 구현체 책임입니다. Event Notifier는
 * 스레드 단위 lock 안에서 이 메서드를 호출하므로, 같은 스레드의 send는
 * 동시에 호출되지 않습니다.</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public interface EventTransport {

    /**
     * 이벤트 전송.
     *
     * @param event 전송할 이벤트
     * @throws TransportException 연결이 없거나 전송에 실패한 경우
     */
    void send(AgentEvent event) throws TransportException;

    /**
     * 스레드에 살아있는 연결이 있는지 확인.
     *
     * @param threadId 스레드 식별자
     * @return 연결되어 있으면 true
     */
    boolean isConnected(ThreadId threadId);
}
