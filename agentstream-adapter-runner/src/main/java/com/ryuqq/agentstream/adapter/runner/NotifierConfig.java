package com.ryuqq.agentstream.adapter.runner;

/**
 * OrderedEventNotifier 설정 (불변 record).
 *
 * @author AgentStream Team
 * @since 1.0.0
 * @param maxSendAttempts 이벤트 하나당 최대 전송 시도 횟수 (양수, 기본 2)
 * @param retryDelayMs 전송 재시도 간격 (밀리초, 0 이상, 기본 5)
 */
public record NotifierConfig(int maxSendAttempts, long retryDelayMs) {

    public NotifierConfig() {
        this(2, 5L);
    }

    public NotifierConfig {
        if (maxSendAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxSendAttempts must be positive (current: " + maxSendAttempts + ")"
            );
        }
        if (retryDelayMs < 0) {
            throw new IllegalArgumentException(
                "retryDelayMs must not be negative (current: " + retryDelayMs + ")"
            );
        }
    }

    public NotifierConfig withMaxSendAttempts(int maxSendAttempts) {
        return new NotifierConfig(maxSendAttempts, retryDelayMs);
    }

    public NotifierConfig withRetryDelayMs(long retryDelayMs) {
        return new NotifierConfig(maxSendAttempts, retryDelayMs);
    }
}
