package com.ryuqq.agentstream.core.event;

import java.util.Optional;

/**
 * 클라이언트로 스트리밍되는 이벤트 종류.
 *
 * <p><strong>Critical 이벤트</strong> (run 진행 상황을 사용자에게 알리는 5종):</p>
 * <ul>
 *   <li>agent_started: run 시작</li>
 *   <li>agent_thinking: Stage 진입 (추론 진행)</li>
 *   <li>tool_executing: 도구 실행 시작</li>
 *   <li>tool_completed: 도구 실행 종료 (성공/실패 무관)</li>
 *   <li>agent_completed: run 정상 종료 (최종 결과 + 사용량)</li>
 * </ul>
 *
 * <p><strong>보조 이벤트:</strong> error, pong, echo, connection_established</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public enum EventType {

    AGENT_STARTED("agent_started", true),
    AGENT_THINKING("agent_thinking", true),
    TOOL_EXECUTING("tool_executing", true),
    TOOL_COMPLETED("tool_completed", true),
    AGENT_COMPLETED("agent_completed", true),
    ERROR("error", false),
    PONG("pong", false),
    ECHO("echo", false),
    CONNECTION_ESTABLISHED("connection_established", false);

    private final String wireName;
    private final boolean critical;

    EventType(String wireName, boolean critical) {
        this.wireName = wireName;
        this.critical = critical;
    }

    /**
     * 전송 시 사용되는 이름.
     *
     * @return wire name (예: agent_started)
     */
    public String wireName() {
        return wireName;
    }

    public boolean isCritical() {
        return critical;
    }

    /**
     * wire name으로 조회.
     *
     * @param wireName 전송 이름
     * @return 해당 EventType (없으면 empty)
     */
    public static Optional<EventType> fromWireName(String wireName) {
        for (EventType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
