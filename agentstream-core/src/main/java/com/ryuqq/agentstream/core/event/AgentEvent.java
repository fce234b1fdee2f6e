package com.ryuqq.agentstream.core.event;

import com.ryuqq.agentstream.core.model.ThreadId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 스레드 하나로 전송되는 이벤트 (저장되지 않음).
 *
 * <p>{@code sequenceNumber}는 스레드마다 1부터 시작하여 단조 증가하며,
 * 클라이언트는 이 값으로 순서를 검증할 수 있습니다.</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 * @param type 이벤트 종류
 * @param threadId 대상 스레드
 * @param payload 이벤트 본문 (문자열 키)
 * @param timestamp 생성 시각 (epoch millis)
 * @param sequenceNumber 스레드 내 순번 (1 이상)
 */
public record AgentEvent(
    EventType type,
    ThreadId threadId,
    Map<String, Object> payload,
    long timestamp,
    long sequenceNumber
) {

    public AgentEvent {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (threadId == null) {
            throw new IllegalArgumentException("threadId cannot be null");
        }
        if (sequenceNumber < 1) {
            throw new IllegalArgumentException(
                "sequenceNumber must be positive (current: " + sequenceNumber + ")"
            );
        }
        payload = payload == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * payload 값 조회.
     *
     * @param key 키
     * @return 값 (없으면 null)
     */
    public Object get(String key) {
        return payload.get(key);
    }
}
