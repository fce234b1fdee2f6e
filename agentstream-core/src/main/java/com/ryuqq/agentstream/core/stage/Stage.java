package com.ryuqq.agentstream.core.stage;

import com.ryuqq.agentstream.core.state.RequestState;

/**
 * 파이프라인의 Worker stage.
 *
 * <p>Stage는 상태를 가지지 않으며, 입력 RequestState를 변경하지 않고
 * 새 RequestState를 반환합니다. 같은 run 안에서 Stage들은 등록 순서대로
 * 하나씩 실행됩니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>{@link #execute}는 재시도될 수 있으므로 멱등해야 함</li>
 *   <li>인터럽트에 응답해야 함 (run 타임아웃은 인터럽트로 취소됨)</li>
 *   <li>재시도해도 소용없는 실패는
 *       {@link com.ryuqq.agentstream.core.error.StageExecutionException#permanentFailure}로 알림</li>
 * </ul>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public interface Stage {

    /**
     * Stage 이름. 레지스트리 안에서 유일해야 합니다.
     *
     * @return Stage 이름
     */
    String name();

    /**
     * 진입 조건 확인.
     *
     * @param state 현재 상태
     * @return false이면 Stage는 SKIPPED로 기록되고 상태는 변경되지 않음
     */
    boolean checkEntryConditions(RequestState state);

    /**
     * Stage 실행.
     *
     * @param state 현재 상태
     * @param context run 컨텍스트 (이벤트 발행, 도구 실행, 리소스 접근)
     * @return 갱신된 상태
     * @throws Exception Stage 실패
     */
    RequestState execute(RequestState state, StageContext context) throws Exception;
}
