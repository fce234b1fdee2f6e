package com.ryuqq.agentstream.core.stage;

import com.ryuqq.agentstream.core.model.RunId;
import com.ryuqq.agentstream.core.model.ThreadId;
import com.ryuqq.agentstream.core.model.UserId;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Stage 실행 중 제공되는 run 컨텍스트.
 *
 * <p>컨텍스트는 run 하나에 묶여 있으며, 여기서 발행되는 이벤트는 모두 해당 run의 스레드로,
 * 리소스 명령은 모두 해당 run의 리소스 핸들로 전달됩니다.</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public interface StageContext {

    RunId runId();

    UserId userId();

    ThreadId threadId();

    /**
     * 현재 시도 번호.
     *
     * @return 1부터 시작하는 시도 번호
     */
    int attempt();

    /**
     * 추론 진행 상황을 {@code agent_thinking} 이벤트로 발행.
     *
     * @param thought 진행 상황 설명
     */
    void thinking(String thought);

    /**
     * 도구 실행.
     *
     * <p>실행 전 {@code tool_executing}, 실행 후 같은 {@code tool_id}를 가진
     * {@code tool_completed}를 정확히 한 번 발행합니다. 도구가 실패해도
     * {@code tool_completed}(status=error)가 발행된 뒤 예외가 다시 던져집니다.</p>
     *
     * <p>도구 실행 중 run이 취소(deadline 만료)되면 {@code tool_completed}는 발행되지 않습니다.
     * 취소된 run의 마지막 이벤트는 terminal error이며, 그 뒤로는 아무것도 발행되지 않습니다.</p>
     *
     * @param toolName 도구 이름
     * @param action 도구 동작
     * @param <T> 결과 타입
     * @return 도구 결과
     * @throws Exception 도구 실패
     */
    <T> T executeTool(String toolName, Callable<T> action) throws Exception;

    /**
     * run의 리소스 핸들을 통해 명령 실행. 명령은 run 소유자의 userId로 태깅됩니다.
     *
     * @param operation 연산 이름
     * @param parameters 연산 파라미터
     * @return 실행 결과
     * @throws Exception 연결 또는 실행 실패
     */
    Object callResource(String operation, Map<String, Object> parameters) throws Exception;
}
