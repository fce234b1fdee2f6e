package com.ryuqq.agentstream.adapter.runner;

/**
 * Stage 재시도 간격 계산 (Exponential Backoff with Jitter).
 *
 * <pre>
 * exponential = min(baseDelay * 2^(attempt-1), maxDelay)
 * delay = min(exponential + random(0, exponential * jitterFactor), maxDelay)
 * </pre>
 *
 * <p><strong>예시 (기본값 baseDelay=100ms, maxDelay=2000ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attempt=1: 100-110ms</li>
 *   <li>attempt=2: 200-220ms</li>
 *   <li>attempt=6: 2000ms (capped)</li>
 * </ul>
 *
 * @author AgentStream Team
 * @since 1.0.0
 * @param baseDelayMs 기본 지연 (밀리초, 0 이상. 0이면 재시도 사이에 대기하지 않음)
 * @param maxDelayMs 최대 지연 (밀리초, baseDelayMs 이상)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 */
public record RetryBackoff(long baseDelayMs, long maxDelayMs, double jitterFactor) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: baseDelayMs=100, maxDelayMs=2000, jitterFactor=0.1</p>
     */
    public RetryBackoff() {
        this(100L, 2_000L, 0.1);
    }

    public RetryBackoff {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must not be negative (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    /**
     * 대기 없는 재시도 (테스트용).
     *
     * @return 지연 0의 RetryBackoff
     */
    public static RetryBackoff none() {
        return new RetryBackoff(0L, 0L, 0.0);
    }

    /**
     * 재시도 지연 계산.
     *
     * @param attempt 실패한 시도 번호 (1부터 시작)
     * @return 다음 시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException attempt가 양수가 아닌 경우
     */
    public long delayFor(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException(
                "attempt must be positive (current: " + attempt + ")"
            );
        }
        if (baseDelayMs == 0) {
            return 0L;
        }

        int shift = Math.min(attempt - 1, 30);
        long exponential = Math.min(baseDelayMs * (1L << shift), maxDelayMs);
        long jitter = (long) (exponential * jitterFactor * Math.random());
        return Math.min(exponential + jitter, maxDelayMs);
    }

    public RetryBackoff withBaseDelayMs(long baseDelayMs) {
        return new RetryBackoff(baseDelayMs, maxDelayMs, jitterFactor);
    }

    public RetryBackoff withMaxDelayMs(long maxDelayMs) {
        return new RetryBackoff(baseDelayMs, maxDelayMs, jitterFactor);
    }

    public RetryBackoff withJitterFactor(double jitterFactor) {
        return new RetryBackoff(baseDelayMs, maxDelayMs, jitterFactor);
    }
}
