package com.ryuqq.agentstream.adapter.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.agentstream.application.inbound.InboundAction;
import com.ryuqq.agentstream.application.inbound.InboundResult;
import com.ryuqq.agentstream.application.notifier.EventNotifier;
import com.ryuqq.agentstream.application.orchestrator.Orchestrator;
import com.ryuqq.agentstream.application.orchestrator.RunRequest;
import com.ryuqq.agentstream.core.error.ValidationException;
import com.ryuqq.agentstream.core.event.EventType;
import com.ryuqq.agentstream.core.model.RunId;
import com.ryuqq.agentstream.core.model.ThreadId;
import com.ryuqq.agentstream.core.model.UserId;
import com.ryuqq.agentstream.core.state.RequestState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * InboundMessageRouter 유닛 테스트.
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class InboundMessageRouterTest {

    private static final UserId USER = UserId.of("user-1");
    private static final ThreadId THREAD = ThreadId.of("thread-1");

    @Mock
    private Orchestrator orchestrator;

    @Mock
    private EventNotifier notifier;

    private InboundMessageRouter router;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.ofEpochMilli(42L), ZoneOffset.UTC);
        router = new InboundMessageRouter(orchestrator, notifier, new ObjectMapper(), clock);
    }

    // ============================================================
    // 1. 연결
    // ============================================================

    @Test
    void onConnect_connection_established_발행() {
        // when
        router.onConnect(USER, THREAD);

        // then
        verify(notifier).emit(THREAD, EventType.CONNECTION_ESTABLISHED,
            Map.of("user_id", "user-1", "thread_id", "thread-1", "timestamp", 42L));
    }

    // ============================================================
    // 2. 즉시 응답
    // ============================================================

    @Test
    void ping이면_pong() {
        // when
        InboundResult result = router.handle(USER, THREAD, "{\"type\":\"ping\"}");

        // then
        assertThat(result.action()).isEqualTo(InboundAction.PONG);
        verify(notifier).emit(eq(THREAD), eq(EventType.PONG), anyMap());
        verify(orchestrator, never()).submit(any());
    }

    @Test
    void 알_수_없는_타입은_원본_그대로_echo() {
        // when
        InboundResult result = router.handle(USER, THREAD,
            "{\"type\":\"custom\",\"payload\":{\"a\":1,\"nested\":{\"b\":\"c\"}}}");

        // then
        assertThat(result.action()).isEqualTo(InboundAction.ECHO);
        verify(notifier).emit(THREAD, EventType.ECHO,
            Map.of("type", "custom", "payload", Map.of("a", 1, "nested", Map.of("b", "c"))));
    }

    // ============================================================
    // 3. 형식 오류
    // ============================================================

    @Test
    void JSON이_아니면_REJECTED와_error() {
        // when
        InboundResult result = router.handle(USER, THREAD, "not json {");

        // then
        assertThat(result.action()).isEqualTo(InboundAction.REJECTED);
        assertThat(errorPayload())
            .containsEntry("error_code", "INVALID_MESSAGE")
            .hasEntrySatisfying("message", message -> assertThat((String) message).contains("not valid JSON"));
    }

    @Test
    void 객체가_아닌_JSON은_거부() {
        // when
        InboundResult result = router.handle(USER, THREAD, "[1, 2, 3]");

        // then
        assertThat(result.action()).isEqualTo(InboundAction.REJECTED);
        assertThat(errorPayload()).containsEntry("message", "Message must be a JSON object");
    }

    @Test
    void type이_없으면_거부() {
        // when
        InboundResult result = router.handle(USER, THREAD, "{\"payload\":{}}");

        // then
        assertThat(result.action()).isEqualTo(InboundAction.REJECTED);
        assertThat(errorPayload()).containsEntry("message", "Message has no 'type' field");
    }

    @Test
    void 빈_메시지는_거부() {
        assertThat(router.handle(USER, THREAD, "  ").action()).isEqualTo(InboundAction.REJECTED);
        assertThat(router.handle(USER, THREAD, null).action()).isEqualTo(InboundAction.REJECTED);
    }

    // ============================================================
    // 4. run 제출
    // ============================================================

    @Test
    void chat_message는_run_id를_사용해_제출() {
        // given
        CompletableFuture<RequestState> future = new CompletableFuture<>();
        when(orchestrator.submit(any())).thenReturn(future);

        // when
        InboundResult result = router.handle(USER, THREAD,
            "{\"type\":\"chat_message\",\"payload\":{\"text\":\"Optimize my GPU utilization\",\"run_id\":\"run-7\"}}");

        // then
        ArgumentCaptor<RunRequest> captor = ArgumentCaptor.forClass(RunRequest.class);
        verify(orchestrator).submit(captor.capture());
        RunRequest submitted = captor.getValue();
        assertThat(submitted.userRequest()).isEqualTo("Optimize my GPU utilization");
        assertThat(submitted.userId()).isEqualTo(USER);
        assertThat(submitted.threadId()).isEqualTo(THREAD);
        assertThat(submitted.runId()).isEqualTo(RunId.of("run-7"));

        assertThat(result.action()).isEqualTo(InboundAction.RUN_SUBMITTED);
        assertThat(result.runId()).isEqualTo(RunId.of("run-7"));
        assertThat(result.findRun()).containsSame(future);
    }

    @Test
    void user_message에_run_id가_없으면_생성() {
        // given
        when(orchestrator.submit(any())).thenReturn(new CompletableFuture<>());

        // when
        InboundResult result = router.handle(USER, THREAD, "{\"type\":\"user_message\",\"payload\":{\"text\":\"hi\"}}");

        // then
        assertThat(result.action()).isEqualTo(InboundAction.RUN_SUBMITTED);
        assertThat(result.runId().getValue()).startsWith("run-");
    }

    @Test
    void text가_없는_chat_message는_거부() {
        // when
        InboundResult result = router.handle(USER, THREAD, "{\"type\":\"chat_message\",\"payload\":{}}");

        // then
        assertThat(result.action()).isEqualTo(InboundAction.REJECTED);
        verify(orchestrator, never()).submit(any());
    }

    @Test
    void 잘못된_run_id는_거부() {
        // when
        InboundResult result = router.handle(USER, THREAD,
            "{\"type\":\"chat_message\",\"payload\":{\"text\":\"hi\",\"run_id\":\"bad id!\"}}");

        // then
        assertThat(result.action()).isEqualTo(InboundAction.REJECTED);
        verify(orchestrator, never()).submit(any());
    }

    @Test
    void 제출_검증_실패는_error로_변환() {
        // given
        when(orchestrator.submit(any())).thenThrow(new ValidationException("timeoutMs must be positive (current: 0)"));

        // when
        InboundResult result = router.handle(USER, THREAD, "{\"type\":\"chat_message\",\"payload\":{\"text\":\"hi\"}}");

        // then
        assertThat(result.action()).isEqualTo(InboundAction.REJECTED);
        assertThat(errorPayload()).containsEntry("message", "timeoutMs must be positive (current: 0)");
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> errorPayload() {
        ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
        verify(notifier).emit(eq(THREAD), eq(EventType.ERROR), captor.capture());
        return captor.getValue();
    }
}
