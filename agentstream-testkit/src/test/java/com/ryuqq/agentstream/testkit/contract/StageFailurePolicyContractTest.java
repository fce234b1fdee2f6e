package com.ryuqq.agentstream.testkit.contract;

import com.ryuqq.agentstream.adapter.runner.OrchestratorConfig;
import com.ryuqq.agentstream.adapter.runner.PipelineOrchestrator;
import com.ryuqq.agentstream.core.event.AgentEvent;
import com.ryuqq.agentstream.core.event.EventType;
import com.ryuqq.agentstream.core.model.RunId;
import com.ryuqq.agentstream.core.state.RequestState;
import com.ryuqq.agentstream.core.state.RunStatus;
import com.ryuqq.agentstream.core.state.StageResult;
import com.ryuqq.agentstream.core.state.StageStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract Test for retries and the halt / continue policy.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>transient failures within the retry budget → stage completes</li>
 *   <li>exhausted retries with halt → run FAILED, later stages not run, terminal error last</li>
 *   <li>exhausted retries with continue → run COMPLETED with a FAILED stage result</li>
 *   <li>entry condition false → SKIPPED with zero attempts</li>
 * </ul>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
class StageFailurePolicyContractTest extends AbstractContractTest {

    @Test
    void testRetry_TransientFailuresWithinBudget_StageCompletes() {
        // Given
        ScriptedStage flaky = ScriptedStage.named("data").recordingTo(executionLog).failingTransiently(2).build();
        PipelineOrchestrator orchestrator = newOrchestrator(new OrchestratorConfig().withMaxRetries(2), List.of(flaky));
        connect(USER_A, THREAD_A);

        // When
        RequestState result = orchestrator.run(request("hello", THREAD_A, USER_A, "run-1"));

        // Then
        StageResult data = result.findStageResult("data").orElseThrow();
        assertEquals(StageStatus.COMPLETED, data.status());
        assertEquals(3, data.attempts());
        assertEquals("data finished for hello", data.output());
        assertEquals(RunStatus.COMPLETED, result.getStatus());
        assertFalse(eventTypesOf(THREAD_A).contains(EventType.ERROR));
    }

    @Test
    void testHalt_RetriesExhausted_RunFailsWithPartialState() {
        // Given
        ScriptedStage triage = ScriptedStage.named("triage").recordingTo(executionLog).build();
        ScriptedStage data = ScriptedStage.named("data").recordingTo(executionLog).failingTransiently(10).build();
        ScriptedStage reporting = ScriptedStage.named("reporting").recordingTo(executionLog).build();
        PipelineOrchestrator orchestrator = newOrchestrator(
            new OrchestratorConfig().withMaxRetries(2), List.of(triage, data, reporting));
        connect(USER_A, THREAD_A);

        // When
        RequestState result = orchestrator.run(request("hello", THREAD_A, USER_A, "run-1"));

        // Then
        assertEquals(RunStatus.FAILED, result.getStatus());
        assertEquals(List.of("triage", "data", "data", "data"), executionLog);
        assertEquals(StageStatus.FAILED, result.findStageResult("data").orElseThrow().status());
        assertEquals(3, result.findStageResult("data").orElseThrow().attempts());
        assertFalse(result.hasResultFor("reporting"));
        assertTrue(result.getFailureReason().contains("data"));

        List<AgentEvent> errors = eventsOf(THREAD_A).stream().filter(e -> e.type() == EventType.ERROR).toList();
        assertEquals(2, errors.size());
        assertEquals("STAGE_FAILED", errors.get(0).get("error_code"));
        assertEquals(false, errors.get(0).get("terminal"));
        assertEquals(true, errors.get(1).get("terminal"));
        assertLastEvent(THREAD_A, EventType.ERROR);
        assertEquals(0L, countEvents(THREAD_A, EventType.AGENT_COMPLETED));
        assertEquals(RunStatus.FAILED, stateStore.load(RunId.of("run-1")).orElseThrow().getStatus());
    }

    @Test
    void testContinue_RetriesExhausted_NextStageRuns() {
        // Given
        ScriptedStage data = ScriptedStage.named("data").recordingTo(executionLog).failingPermanently().build();
        ScriptedStage reporting = ScriptedStage.named("reporting").recordingTo(executionLog).build();
        PipelineOrchestrator orchestrator = newOrchestrator(
            new OrchestratorConfig().withHaltOnStageFailure(false), List.of(data, reporting));
        connect(USER_A, THREAD_A);

        // When
        RequestState result = orchestrator.run(request("hello", THREAD_A, USER_A, "run-1"));

        // Then
        assertEquals(RunStatus.COMPLETED, result.getStatus());
        assertEquals(List.of("data", "reporting"), executionLog);
        assertEquals(1, data.attempts());
        assertEquals(StageStatus.FAILED, result.findStageResult("data").orElseThrow().status());
        assertEquals(StageStatus.COMPLETED, result.findStageResult("reporting").orElseThrow().status());
        assertLastEvent(THREAD_A, EventType.AGENT_COMPLETED);
    }

    @Test
    void testEntryCondition_False_StageSkippedWithZeroAttempts() {
        // Given
        ScriptedStage corpus = ScriptedStage.named("corpus_admin")
            .recordingTo(executionLog)
            .enteringWhen(state -> state.getUserRequest().contains("corpus"))
            .build();
        ScriptedStage reporting = ScriptedStage.named("reporting").recordingTo(executionLog).build();
        PipelineOrchestrator orchestrator = newOrchestrator(new OrchestratorConfig(), List.of(corpus, reporting));
        connect(USER_A, THREAD_A);

        // When
        RequestState result = orchestrator.run(request("Optimize my GPU utilization", THREAD_A, USER_A, "run-1"));

        // Then
        StageResult skipped = result.findStageResult("corpus_admin").orElseThrow();
        assertEquals(StageStatus.SKIPPED, skipped.status());
        assertEquals(0, skipped.attempts());
        assertEquals(List.of("reporting"), executionLog);
        assertFalse(result.findAttribute("corpus_admin.output").isPresent());
    }
}
