package xyz.firestige.pipeline.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.domain.definition.StepDefinition;
import xyz.firestige.pipeline.domain.plan.PlannedStep;
import xyz.firestige.pipeline.domain.run.CancellationToken;
import xyz.firestige.pipeline.domain.run.ExecutionResult;
import xyz.firestige.pipeline.domain.run.ResultType;
import xyz.firestige.pipeline.domain.run.RunContext;
import xyz.firestige.pipeline.domain.run.StepAttempt;
import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.FailureInfo;
import xyz.firestige.pipeline.domain.shared.exception.PipelineException;
import xyz.firestige.pipeline.infrastructure.credential.CredentialResolutionException;
import xyz.firestige.pipeline.infrastructure.credential.CredentialScopeManager;
import xyz.firestige.pipeline.infrastructure.execution.retry.RetryPolicy;
import xyz.firestige.pipeline.infrastructure.execution.retry.RetryingStepExecutor;

import java.util.concurrent.Semaphore;
import java.util.function.Consumer;

/**
 * 步骤运行链：凭据作用域 → 重试 → 步骤执行器
 * <p>
 * 凭据在所有尝试之外解析一次，作用域覆盖整个重试链。
 * 链中抛出的异常转为 FAILURE 结果（消息已在凭据作用域内遮蔽），不会越出步骤。
 */
public class StepRunner {

    private static final Logger log = LoggerFactory.getLogger(StepRunner.class);

    private final StepExecutor stepExecutor;
    private final RetryingStepExecutor retryingStepExecutor;
    private final CredentialScopeManager credentialScopeManager;

    public StepRunner(StepExecutor stepExecutor, RetryingStepExecutor retryingStepExecutor,
                      CredentialScopeManager credentialScopeManager) {
        this.stepExecutor = stepExecutor;
        this.retryingStepExecutor = retryingStepExecutor;
        this.credentialScopeManager = credentialScopeManager;
    }

    public ExecutionResult run(PlannedStep step, RunContext context, CancellationToken token,
                               Semaphore permits, Consumer<String> artifactSink) {
        StepDefinition definition = step.getDefinition();
        try {
            return credentialScopeManager.withCredentials(definition.getCredentials(), context.getEnvironment(),
                    scope -> {
                        StepEnvironment env = new StepEnvironment(context, scope.getEnvironment(),
                                scope.getMasker(), token, permits, artifactSink, 1);
                        return retryingStepExecutor.withRetry(RetryPolicy.of(definition), token,
                                attempt -> stepExecutor.execute(step, env.withAttempt(attempt)));
                    });
        } catch (CredentialResolutionException e) {
            log.error("凭据解析失败，步骤不执行: step={}, credentialId={}", step.getPath(), e.getCredentialId());
            return failed(step, e.toFailureInfo(step.getPath()));
        } catch (PipelineException e) {
            log.error("步骤执行异常: {}", step.getPath(), e);
            return failed(step, e.toFailureInfo(step.getPath()));
        } catch (RuntimeException e) {
            log.error("步骤执行异常: {}", step.getPath(), e);
            return failed(step, FailureInfo.fromException(e, ErrorType.SYSTEM_ERROR, step.getPath()));
        }
    }

    private ExecutionResult failed(PlannedStep step, FailureInfo failureInfo) {
        ExecutionResult result = ExecutionResult.pending(step.getPath(), step.getName(), ResultType.STEP);
        result.start();
        result.failure(failureInfo);
        result.addAttempt(StepAttempt.of(1, result));
        return result;
    }
}
