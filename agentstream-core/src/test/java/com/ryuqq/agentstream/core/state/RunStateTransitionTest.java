package com.ryuqq.agentstream.core.state;

import org.junit.jupiter.api.Test;

import static com.ryuqq.agentstream.core.state.RunStatus.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * RunStateTransition 테스트.
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
class RunStateTransitionTest {

    // ========== 정상 전이 ==========

    @Test
    void validate_PendingToRunning_Succeeds() {
        assertDoesNotThrow(() -> RunStateTransition.validate(PENDING, RUNNING));
    }

    @Test
    void validate_PendingToFailed_Succeeds() {
        assertDoesNotThrow(() -> RunStateTransition.validate(PENDING, FAILED));
    }

    @Test
    void transition_NormalFlowToCompleted_Succeeds() {
        // Given
        RunStatus status = PENDING;

        // When
        status = RunStateTransition.transition(status, RUNNING);
        status = RunStateTransition.transition(status, COMPLETED);

        // Then
        assertEquals(COMPLETED, status);
        assertTrue(status.isTerminal());
    }

    // ========== 불법 전이 ==========

    @Test
    void validate_CompletedToRunning_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> RunStateTransition.validate(COMPLETED, RUNNING)
        );
        assertTrue(exception.getMessage().contains("Cannot transition from terminal state"));
    }

    @Test
    void validate_FailedToCompleted_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> RunStateTransition.validate(FAILED, COMPLETED));
    }

    @Test
    void validate_PendingToCompleted_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> RunStateTransition.validate(PENDING, COMPLETED)
        );
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @Test
    void validate_RunningToPending_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> RunStateTransition.validate(RUNNING, PENDING));
    }

    @Test
    void validate_NullState_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> RunStateTransition.validate(null, RUNNING));
    }

    @Test
    void isTerminal_OnlyCompletedAndFailed() {
        assertFalse(PENDING.isTerminal());
        assertFalse(RUNNING.isTerminal());
        assertTrue(COMPLETED.isTerminal());
        assertTrue(FAILED.isTerminal());
    }
}
