package com.ryuqq.agentstream.application.notifier;

import com.ryuqq.agentstream.core.event.EventType;
import com.ryuqq.agentstream.core.model.ThreadId;

import java.util.Map;

/**
 * Stage 진행 상황을 스레드별 순서가 보장된 이벤트 스트림으로 변환.
 *
 * <p><strong>전달 보장:</strong></p>
 * <ul>
 *   <li>같은 스레드의 이벤트는 생성 순서대로 전달 (순번 할당과 전송이 스레드별 lock 안에서 수행)</li>
 *   <li>병합(coalescing) 없음</li>
 *   <li>물리 연결 기준 at-most-once: 재시도 후에도 실패하면 버려지고 실패 카운터 증가</li>
 *   <li>전송 실패는 예외로 전파되지 않음</li>
 * </ul>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public interface EventNotifier {

    /**
     * 이벤트 발행.
     *
     * @param threadId 대상 스레드
     * @param type 이벤트 종류
     * @param payload 이벤트 본문
     * @return 전달 결과 (전송 실패 시에도 예외 대신 결과 반환)
     */
    DeliveryResult emit(ThreadId threadId, EventType type, Map<String, Object> payload);

    /**
     * 전달에 성공한 이벤트 수.
     */
    long deliveredCount();

    /**
     * 재시도 후에도 버려진 이벤트 수.
     */
    long failureCount();

    /**
     * 스레드의 순번 상태 제거. 이후 이벤트는 다시 1번부터 시작합니다.
     *
     * @param threadId 스레드
     */
    void resetThread(ThreadId threadId);
}
