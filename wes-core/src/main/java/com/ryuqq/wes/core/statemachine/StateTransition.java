package com.ryuqq.wes.core.statemachine;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p>Run 상태는 전진 방향으로만 이동합니다. 각 상태에 순위(rank)를 부여하고
 * 순위가 높아지는 전이만 허용합니다.</p>
 *
 * <p><strong>순위:</strong></p>
 * <pre>
 * QUEUED(0) → INITIALIZING(1) → RUNNING = PAUSED(2) → CANCELING(3) → 종료 상태(4)
 * </pre>
 *
 * <p><strong>예외 규칙:</strong></p>
 * <ul>
 *   <li>RUNNING ⇄ PAUSED는 같은 순위이지만 상호 전이 허용</li>
 *   <li>CANCELING에서는 종료 상태로만 전이 가능</li>
 *   <li>UNKNOWN은 전이 대상이 될 수 없음</li>
 *   <li>종료 상태에서는 어떤 상태로도 전이 불가</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * from → to 전이가 전진 방향인지 확인.
     *
     * <p>Provider가 보고한 상태를 반영할지 판단할 때 사용합니다.
     * 같은 상태로의 이동은 전이가 아니므로 false입니다.</p>
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용된 전진 전이인 경우 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isForward(RunState from, RunState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal() || to == RunState.UNKNOWN || from == to) {
            return false;
        }
        if (from == RunState.CANCELING) {
            return to.isTerminal();
        }
        if (isPauseToggle(from, to)) {
            return true;
        }
        return rank(to) > rank(from);
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(RunState from, RunState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        if (!isForward(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static RunState transition(RunState current, RunState next) {
        validate(current, next);
        return next;
    }

    private static boolean isPauseToggle(RunState from, RunState to) {
        return (from == RunState.RUNNING && to == RunState.PAUSED)
            || (from == RunState.PAUSED && to == RunState.RUNNING);
    }

    private static int rank(RunState state) {
        return switch (state) {
            case QUEUED -> 0;
            case INITIALIZING -> 1;
            case RUNNING, PAUSED -> 2;
            case CANCELING -> 3;
            case COMPLETE, EXECUTOR_ERROR, SYSTEM_ERROR, CANCELED -> 4;
            case UNKNOWN -> -1; // 어떤 저장 상태보다 낮게 취급
        };
    }
}
