package xyz.firestige.pipeline.domain.plan;

import xyz.firestige.pipeline.domain.definition.PipelineDefinition;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 执行计划：校验通过的定义 + 本次运行参数（含默认值）+ 求值后的 Stage 树
 * <p>
 * 不可变，由 {@code StageGraphResolver} 生成，交给引擎执行。
 */
public final class ExecutionPlan {

    private final PipelineDefinition definition;
    private final Map<String, String> parameters;
    private final List<PlannedStage> stages;
    private final PlannedHooks hooks;
    private final int concurrencyLimit;
    private final int retention;
    private final Duration timeout;
    private final boolean disableConcurrentBuilds;

    public ExecutionPlan(PipelineDefinition definition, Map<String, String> parameters,
                         List<PlannedStage> stages, PlannedHooks hooks,
                         int concurrencyLimit, int retention, Duration timeout,
                         boolean disableConcurrentBuilds) {
        this.definition = definition;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.stages = List.copyOf(stages);
        this.hooks = hooks;
        this.concurrencyLimit = concurrencyLimit;
        this.retention = retention;
        this.timeout = timeout;
        this.disableConcurrentBuilds = disableConcurrentBuilds;
    }

    public String getPipelineName() {
        return definition.getName();
    }

    public PipelineDefinition getDefinition() {
        return definition;
    }

    public Map<String, String> getParameters() {
        return parameters;
    }

    public Map<String, String> getEnvironment() {
        return definition.getEnvironment();
    }

    public List<PlannedStage> getStages() {
        return stages;
    }

    public PlannedHooks getHooks() {
        return hooks;
    }

    public int getConcurrencyLimit() {
        return concurrencyLimit;
    }

    public int getRetention() {
        return retention;
    }

    /**
     * 全局超时，null 表示不限
     */
    public Duration getTimeout() {
        return timeout;
    }

    public boolean isDisableConcurrentBuilds() {
        return disableConcurrentBuilds;
    }
}
