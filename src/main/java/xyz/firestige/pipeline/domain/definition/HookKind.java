package xyz.firestige.pipeline.domain.definition;

import xyz.firestige.pipeline.domain.run.ExecutionStatus;

/**
 * 后置钩子类型
 */
public enum HookKind {
    ALWAYS,
    SUCCESS,
    UNSTABLE,
    FAILURE,
    ABORTED;

    /**
     * 按执行结果选出对应的钩子；SKIPPED / 非终态没有对应钩子
     */
    public static HookKind forOutcome(ExecutionStatus status) {
        if (status == null) {
            return null;
        }
        switch (status) {
            case SUCCESS:
                return SUCCESS;
            case UNSTABLE:
                return UNSTABLE;
            case FAILURE:
                return FAILURE;
            case ABORTED:
                return ABORTED;
            default:
                return null;
        }
    }
}
