package xyz.firestige.pipeline.domain.run;

/**
 * 运行 / Stage / Step 的执行状态
 */
public enum ExecutionStatus {

    PENDING(false),
    RUNNING(false),
    SUCCESS(true),
    UNSTABLE(true),
    FAILURE(true),
    ABORTED(true),

    /**
     * 守卫不满足，或前序失败 / 中止导致未开始
     */
    SKIPPED(true);

    private final boolean terminal;

    ExecutionStatus(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * SUCCESS 与 UNSTABLE 都视为“完成”，不会阻断后续 Stage
     */
    public boolean isCompleted() {
        return this == SUCCESS || this == UNSTABLE;
    }

    /**
     * 合并两个子结果，优先级 FAILURE > ABORTED > UNSTABLE > SUCCESS；SKIPPED 不影响结果
     */
    public static ExecutionStatus worst(ExecutionStatus a, ExecutionStatus b) {
        return rank(a) >= rank(b) ? a : b;
    }

    private static int rank(ExecutionStatus status) {
        if (status == null) {
            return -1;
        }
        switch (status) {
            case FAILURE:
                return 4;
            case ABORTED:
                return 3;
            case UNSTABLE:
                return 2;
            case SUCCESS:
                return 1;
            default:
                return 0;
        }
    }
}
