package xyz.firestige.pipeline.domain.run;

/**
 * 取消原因
 */
public enum CancelReason {

    /**
     * 运行超过全局超时
     */
    RUN_TIMEOUT,

    /**
     * 外部取消请求
     */
    CANCELLED,

    /**
     * 单个步骤超过自身时限（只作用于该步骤）
     */
    STEP_TIMEOUT
}
