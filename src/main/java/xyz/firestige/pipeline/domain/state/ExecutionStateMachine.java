package xyz.firestige.pipeline.domain.state;

import xyz.firestige.pipeline.domain.run.ExecutionStatus;
import xyz.firestige.pipeline.domain.shared.exception.IllegalStateTransitionException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 运行 / Stage 状态机
 * <p>
 * 运行：PENDING → RUNNING → {SUCCESS, FAILURE, UNSTABLE, ABORTED}，未开始即被取消时 PENDING → ABORTED。
 * Stage / Step：PENDING → RUNNING → 终态，或 PENDING → SKIPPED。终态不可再迁移。
 */
public class ExecutionStateMachine {

    private static final Set<ExecutionStatus> OUTCOMES = EnumSet.of(
            ExecutionStatus.SUCCESS, ExecutionStatus.FAILURE, ExecutionStatus.UNSTABLE, ExecutionStatus.ABORTED);

    private final String subject;
    private ExecutionStatus current = ExecutionStatus.PENDING;
    private final Map<ExecutionStatus, Set<ExecutionStatus>> rules = new EnumMap<>(ExecutionStatus.class);

    private ExecutionStateMachine(String subject) {
        this.subject = subject;
    }

    public static ExecutionStateMachine forRun(String runId) {
        ExecutionStateMachine machine = new ExecutionStateMachine("run " + runId);
        machine.rules.put(ExecutionStatus.PENDING, EnumSet.of(ExecutionStatus.RUNNING, ExecutionStatus.ABORTED));
        machine.rules.put(ExecutionStatus.RUNNING, OUTCOMES);
        return machine;
    }

    public static ExecutionStateMachine forStage(String path) {
        ExecutionStateMachine machine = new ExecutionStateMachine("stage " + path);
        machine.rules.put(ExecutionStatus.PENDING, EnumSet.of(ExecutionStatus.RUNNING, ExecutionStatus.SKIPPED));
        machine.rules.put(ExecutionStatus.RUNNING, OUTCOMES);
        return machine;
    }

    public synchronized boolean canTransition(ExecutionStatus to) {
        return rules.getOrDefault(current, Collections.emptySet()).contains(to);
    }

    /**
     * @throws IllegalStateTransitionException 迁移不合法
     */
    public synchronized ExecutionStatus transitionTo(ExecutionStatus to) {
        if (!canTransition(to)) {
            throw new IllegalStateTransitionException(subject, current, to);
        }
        current = to;
        return current;
    }

    public synchronized ExecutionStatus getCurrent() {
        return current;
    }
}
