package xyz.firestige.pipeline.domain.shared.exception;

/**
 * 错误类型枚举
 * 用于分类流水线执行过程中的不同错误，决定重试与传播行为
 */
public enum ErrorType {

    /**
     * 定义校验错误（执行前失败）
     */
    VALIDATION_ERROR("校验错误", false),

    /**
     * 步骤失败（非零退出码或动作异常）
     */
    STEP_FAILURE("步骤失败", true),

    /**
     * 超时错误（步骤或运行超过时限）
     */
    TIMEOUT_ERROR("超时错误", true),

    /**
     * 凭据解析失败（重试通常无意义）
     */
    CREDENTIAL_ERROR("凭据解析失败", false),

    /**
     * 命名资源锁等待超时
     */
    LOCK_CONTENTION("资源锁冲突", false),

    /**
     * 运行被中止（全局超时或外部取消）
     */
    ABORTED("已中止", false),

    /**
     * 系统错误
     */
    SYSTEM_ERROR("系统错误", false);

    private final String description;
    private final boolean retryable;

    ErrorType(String description, boolean retryable) {
        this.description = description;
        this.retryable = retryable;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 该类错误默认是否可以重试
     */
    public boolean isRetryable() {
        return retryable;
    }
}
