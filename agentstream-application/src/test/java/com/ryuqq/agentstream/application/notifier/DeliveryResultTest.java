package com.ryuqq.agentstream.application.notifier;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DeliveryResult 테스트.
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
class DeliveryResultTest {

    @Test
    void delivered_결과는_실패_사유_없음() {
        // when
        DeliveryResult result = DeliveryResult.delivered(3, 1);

        // then
        assertThat(result.delivered()).isTrue();
        assertThat(result.sequenceNumber()).isEqualTo(3);
        assertThat(result.failureReason()).isNull();
    }

    @Test
    void dropped_결과는_실패_사유_포함() {
        // when
        DeliveryResult result = DeliveryResult.dropped(4, 2, "no connection");

        // then
        assertThat(result.delivered()).isFalse();
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(result.failureReason()).isEqualTo("no connection");
    }

    @Test
    void 시도_횟수는_1_이상() {
        assertThatThrownBy(() -> new DeliveryResult(true, 1, 0, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("attempts must be positive");
    }
}
