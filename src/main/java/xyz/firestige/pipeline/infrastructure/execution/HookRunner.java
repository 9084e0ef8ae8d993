package xyz.firestige.pipeline.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.domain.definition.HookKind;
import xyz.firestige.pipeline.domain.plan.PlannedHooks;
import xyz.firestige.pipeline.domain.plan.PlannedStep;
import xyz.firestige.pipeline.domain.run.CancellationToken;
import xyz.firestige.pipeline.domain.run.ExecutionResult;
import xyz.firestige.pipeline.domain.run.ExecutionStatus;
import xyz.firestige.pipeline.domain.run.HookOutput;
import xyz.firestige.pipeline.domain.run.ResultType;
import xyz.firestige.pipeline.domain.run.RunReport;

import java.util.List;

/**
 * 后置钩子执行器
 * <p>
 * 顺序：先 always，再与结局对应的一组（success / unstable / failure / aborted）。
 * 钩子使用独立的取消令牌，运行中止后仍会执行；钩子失败只记录，不改变所属范围的结局。
 */
public class HookRunner {

    private static final Logger log = LoggerFactory.getLogger(HookRunner.class);

    private final StepRunner stepRunner;

    public HookRunner(StepRunner stepRunner) {
        this.stepRunner = stepRunner;
    }

    /**
     * @param scope   Stage 路径或 {@link HookOutput#PIPELINE_SCOPE}
     * @param outcome 所属范围的结局
     */
    public void run(String scope, PlannedHooks hooks, ExecutionStatus outcome, RunExecution run) {
        if (hooks.isEmpty()) {
            return;
        }
        runGroup(scope, HookKind.ALWAYS, hooks.get(HookKind.ALWAYS), run);
        HookKind kind = HookKind.forOutcome(outcome);
        if (kind != null) {
            runGroup(scope, kind, hooks.get(kind), run);
        }
    }

    private void runGroup(String scope, HookKind kind, List<PlannedStep> steps, RunExecution run) {
        if (steps.isEmpty()) {
            return;
        }
        log.info("执行后置钩子: scope={}, kind={}", scope, kind);
        RunReport report = run.getReport();
        HookOutput output = new HookOutput(scope, kind);
        CancellationToken token = CancellationToken.create();
        ExecutionStatus status = ExecutionStatus.SUCCESS;
        boolean stopped = false;

        for (PlannedStep step : steps) {
            if (stopped) {
                output.getSteps().add(ExecutionResult.skipped(step.getPath(), step.getName(), ResultType.STEP));
                continue;
            }
            ExecutionResult result = stepRunner.run(step, run.getContext(), token,
                    run.getConcurrencyPermits(), report::addArtifact);
            output.getSteps().add(result);
            status = ExecutionStatus.worst(status, result.getStatus());
            if (result.getStatus() == ExecutionStatus.FAILURE || result.getStatus() == ExecutionStatus.ABORTED) {
                log.warn("后置钩子步骤失败（不影响结局）: step={}, reason={}", step.getPath(),
                        result.getFailureInfo() != null ? result.getFailureInfo().getErrorMessage() : null);
                stopped = true;
            }
        }
        output.setStatus(status);
        report.addHook(output);
    }
}
