package xyz.firestige.pipeline.domain.run;

import xyz.firestige.pipeline.domain.definition.HookKind;

import java.util.ArrayList;
import java.util.List;

/**
 * 一组后置钩子的执行记录，按实际执行顺序追加到运行报告
 */
public class HookOutput {

    /**
     * 所属范围：Stage 路径，流水线级钩子为 {@link #PIPELINE_SCOPE}
     */
    public static final String PIPELINE_SCOPE = "<pipeline>";

    private String scope;
    private HookKind kind;
    private ExecutionStatus status;
    private List<ExecutionResult> steps = new ArrayList<>();

    public HookOutput() {
    }

    public HookOutput(String scope, HookKind kind) {
        this.scope = scope;
        this.kind = kind;
    }

    public String getScope() {
        return scope;
    }

    public void setScope(String scope) {
        this.scope = scope;
    }

    public HookKind getKind() {
        return kind;
    }

    public void setKind(HookKind kind) {
        this.kind = kind;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public void setStatus(ExecutionStatus status) {
        this.status = status;
    }

    public List<ExecutionResult> getSteps() {
        return steps;
    }

    public void setSteps(List<ExecutionResult> steps) {
        this.steps = steps;
    }

    @Override
    public String toString() {
        return "HookOutput{scope='" + scope + "', kind=" + kind + ", status=" + status + '}';
    }
}
