package xyz.firestige.pipeline.infrastructure.execution.action;

/**
 * 步骤动作接口
 * <p>
 * 构建、发布、部署等外部能力都通过该接口接入。实现需要协作式地响应取消：
 * 在有界的时间间隔内检查 {@link ActionRequest#getCancellationToken()}，
 * 被取消后尽快结束并回收自己启动的外部进程。
 */
public interface StepAction {

    /**
     * 动作 ID，对应定义中的 {@code action} 字段
     */
    String getActionId();

    /**
     * 执行动作
     *
     * @return 执行结果，退出码 0 表示成功
     * @throws Exception 动作执行异常，按步骤失败处理
     */
    ActionOutcome invoke(ActionRequest request) throws Exception;
}
