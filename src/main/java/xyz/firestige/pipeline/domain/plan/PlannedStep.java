package xyz.firestige.pipeline.domain.plan;

import xyz.firestige.pipeline.domain.definition.StepDefinition;

import java.time.Duration;

/**
 * 已解析的步骤：定义 + 路径 + 生效的超时
 */
public final class PlannedStep {

    private final String path;
    private final StepDefinition definition;
    private final Duration timeout;

    public PlannedStep(String path, StepDefinition definition, Duration timeout) {
        this.path = path;
        this.definition = definition;
        this.timeout = timeout;
    }

    public String getPath() {
        return path;
    }

    public String getName() {
        return definition.getName();
    }

    public StepDefinition getDefinition() {
        return definition;
    }

    /**
     * 步骤自身的 timeout，否则继承流水线 defaultStepTimeout，再否则取全局配置
     */
    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public String toString() {
        return "PlannedStep{" + path + ", timeout=" + timeout + '}';
    }
}
