package com.ryuqq.agentstream.application.inbound;

import com.ryuqq.agentstream.core.model.RunId;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InboundResult 테스트.
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
class InboundResultTest {

    @Test
    void RUN_SUBMITTED는_runId와_Future가_필요() {
        assertThatThrownBy(() -> new InboundResult(InboundAction.RUN_SUBMITTED, null, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void submitted_결과에서_Future_조회() {
        // given
        CompletableFuture<com.ryuqq.agentstream.core.state.RequestState> future = new CompletableFuture<>();

        // when
        InboundResult result = InboundResult.submitted(RunId.of("run-1"), future);

        // then
        assertThat(result.action()).isEqualTo(InboundAction.RUN_SUBMITTED);
        assertThat(result.findRun()).containsSame(future);
    }

    @Test
    void pong_결과에는_run_없음() {
        assertThat(InboundResult.of(InboundAction.PONG).findRun()).isEmpty();
    }
}
