package com.ryuqq.agentstream.testkit.contract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.agentstream.adapter.runner.InboundMessageRouter;
import com.ryuqq.agentstream.adapter.runner.OrchestratorConfig;
import com.ryuqq.agentstream.adapter.runner.PipelineOrchestrator;
import com.ryuqq.agentstream.application.inbound.InboundAction;
import com.ryuqq.agentstream.application.inbound.InboundResult;
import com.ryuqq.agentstream.core.event.AgentEvent;
import com.ryuqq.agentstream.core.event.EventType;
import com.ryuqq.agentstream.core.state.RequestState;
import com.ryuqq.agentstream.core.state.RunStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract Test for inbound client messages routed over the real notifier and orchestrator.
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
class InboundContractTest extends AbstractContractTest {

    private InboundMessageRouter router;

    @BeforeEach
    void setUpRouter() {
        PipelineOrchestrator orchestrator = newOrchestrator(new OrchestratorConfig(), standardStages());
        router = new InboundMessageRouter(orchestrator, notifier, new ObjectMapper(), clock);
        connect(USER_A, THREAD_A);
    }

    @Test
    void testInbound_Connect_EmitsConnectionEstablished() {
        // When
        router.onConnect(USER_A, THREAD_A);

        // Then
        AgentEvent event = eventsOf(THREAD_A).get(0);
        assertEquals(EventType.CONNECTION_ESTABLISHED, event.type());
        assertEquals("user-a", event.get("user_id"));
        assertEquals("thread-a", event.get("thread_id"));
    }

    @Test
    void testInbound_Ping_PongDelivered() {
        // When
        InboundResult result = router.handle(USER_A, THREAD_A, "{\"type\":\"ping\"}");

        // Then
        assertEquals(InboundAction.PONG, result.action());
        assertLastEvent(THREAD_A, EventType.PONG);
        assertEquals(clock.millis(), eventsOf(THREAD_A).get(0).get("timestamp"));
    }

    @Test
    void testInbound_ChatMessage_RunCompletes() throws Exception {
        // When
        InboundResult result = router.handle(USER_A, THREAD_A,
            "{\"type\":\"chat_message\",\"payload\":{\"text\":\"Optimize my GPU utilization\",\"run_id\":\"run-in\"}}");

        // Then
        assertEquals(InboundAction.RUN_SUBMITTED, result.action());
        assertEquals("run-in", result.runId().getValue());
        RequestState state = result.run().get(10, TimeUnit.SECONDS);
        assertEquals(RunStatus.COMPLETED, state.getStatus());
        assertEquals("Optimize my GPU utilization", state.getUserRequest());
        assertLastEvent(THREAD_A, EventType.AGENT_COMPLETED);
        assertSequenceIncreasing(THREAD_A);
    }

    @Test
    void testInbound_MalformedMessage_ErrorDeliveredAndNoRun() {
        // When
        InboundResult result = router.handle(USER_A, THREAD_A, "{not json");

        // Then
        assertEquals(InboundAction.REJECTED, result.action());
        List<AgentEvent> events = eventsOf(THREAD_A);
        assertEquals(1, events.size());
        assertEquals(EventType.ERROR, events.get(0).type());
        assertEquals("INVALID_MESSAGE", events.get(0).get("error_code"));
        assertTrue(executionLog.isEmpty());
    }

    @Test
    void testInbound_UnknownType_Echoed() {
        // When
        InboundResult result = router.handle(USER_A, THREAD_A, "{\"type\":\"hello\",\"value\":1}");

        // Then
        assertEquals(InboundAction.ECHO, result.action());
        AgentEvent echo = eventsOf(THREAD_A).get(0);
        assertEquals(EventType.ECHO, echo.type());
        assertEquals("hello", echo.get("type"));
    }
}
