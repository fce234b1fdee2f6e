package com.ryuqq.agentstream.application.notifier;

/**
 * 이벤트 하나의 전달 결과.
 *
 * @author AgentStream Team
 * @since 1.0.0
 * @param delivered 전달 성공 여부
 * @param sequenceNumber 할당된 스레드 내 순번
 * @param attempts 전송 시도 횟수
 * @param failureReason 실패 사유 (성공 시 null)
 */
public record DeliveryResult(boolean delivered, long sequenceNumber, int attempts, String failureReason) {

    public DeliveryResult {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be positive (current: " + attempts + ")");
        }
        if (delivered && failureReason != null) {
            throw new IllegalArgumentException("delivered result cannot carry a failureReason");
        }
    }

    public static DeliveryResult delivered(long sequenceNumber, int attempts) {
        return new DeliveryResult(true, sequenceNumber, attempts, null);
    }

    public static DeliveryResult dropped(long sequenceNumber, int attempts, String failureReason) {
        return new DeliveryResult(false, sequenceNumber, attempts, failureReason);
    }
}
