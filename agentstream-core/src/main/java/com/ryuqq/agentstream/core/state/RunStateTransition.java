package com.ryuqq.agentstream.core.state;

/**
 * RunStatus 전이 검증.
 *
 * <p>허용되는 전이:</p>
 * <ul>
 *   <li>PENDING → RUNNING</li>
 *   <li>PENDING → FAILED (run 시작 전 리소스 획득 실패)</li>
 *   <li>RUNNING → COMPLETED</li>
 *   <li>RUNNING → FAILED</li>
 * </ul>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public final class RunStateTransition {

    private RunStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전이 유효성 검증.
     *
     * @param from 현재 상태
     * @param to 다음 상태
     * @throws IllegalArgumentException 상태가 null인 경우
     * @throws IllegalStateException 허용되지 않은 전이인 경우
     */
    public static void validate(RunStatus from, RunStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case PENDING -> to == RunStatus.RUNNING || to == RunStatus.FAILED;
            case RUNNING -> to == RunStatus.COMPLETED || to == RunStatus.FAILED;
            case COMPLETED, FAILED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 전이 수행.
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 검증된 다음 상태
     */
    public static RunStatus transition(RunStatus current, RunStatus next) {
        validate(current, next);
        return next;
    }
}
