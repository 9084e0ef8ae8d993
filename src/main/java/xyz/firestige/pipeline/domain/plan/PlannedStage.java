package xyz.firestige.pipeline.domain.plan;

import xyz.firestige.pipeline.domain.definition.StageDefinition;
import xyz.firestige.pipeline.domain.definition.StageKind;

import java.time.Duration;
import java.util.List;

/**
 * 执行计划中的 Stage 节点
 * <p>
 * {@code enabled} 为守卫求值结果；未启用的 Stage 及其子树在运行时整体 SKIPPED。
 */
public final class PlannedStage {

    private final String path;
    private final StageDefinition definition;
    private final boolean enabled;
    private final List<PlannedStep> steps;
    private final List<PlannedStage> branches;
    private final PlannedHooks hooks;

    public PlannedStage(String path, StageDefinition definition, boolean enabled,
                        List<PlannedStep> steps, List<PlannedStage> branches, PlannedHooks hooks) {
        this.path = path;
        this.definition = definition;
        this.enabled = enabled;
        this.steps = List.copyOf(steps);
        this.branches = List.copyOf(branches);
        this.hooks = hooks;
    }

    public String getPath() {
        return path;
    }

    public String getName() {
        return definition.getName();
    }

    public StageKind getKind() {
        return definition.kind();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isBestEffort() {
        return definition.isBestEffort();
    }

    public String getLock() {
        return definition.getLock();
    }

    public Duration getLockTimeout() {
        return definition.getLockTimeout();
    }

    public List<PlannedStep> getSteps() {
        return steps;
    }

    public List<PlannedStage> getBranches() {
        return branches;
    }

    public PlannedHooks getHooks() {
        return hooks;
    }

    public StageDefinition getDefinition() {
        return definition;
    }

    @Override
    public String toString() {
        return "PlannedStage{" + path + ", kind=" + getKind() + ", enabled=" + enabled + '}';
    }
}
