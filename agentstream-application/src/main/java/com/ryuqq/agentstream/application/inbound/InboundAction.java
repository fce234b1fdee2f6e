package com.ryuqq.agentstream.application.inbound;

/**
 * 수신 메시지에 대해 수행된 동작.
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public enum InboundAction {
    PONG,
    ECHO,
    REJECTED,
    RUN_SUBMITTED
}
