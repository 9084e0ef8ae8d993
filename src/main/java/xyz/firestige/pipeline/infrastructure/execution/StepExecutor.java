package xyz.firestige.pipeline.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import xyz.firestige.pipeline.domain.definition.StepDefinition;
import xyz.firestige.pipeline.domain.plan.PlannedStep;
import xyz.firestige.pipeline.domain.run.CancelReason;
import xyz.firestige.pipeline.domain.run.CancellationToken;
import xyz.firestige.pipeline.domain.run.ExecutionResult;
import xyz.firestige.pipeline.domain.run.ExecutionStatus;
import xyz.firestige.pipeline.domain.run.ResultType;
import xyz.firestige.pipeline.domain.run.RunContext;
import xyz.firestige.pipeline.domain.shared.DurationLimits;
import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.FailureInfo;
import xyz.firestige.pipeline.domain.shared.exception.PipelineException;
import xyz.firestige.pipeline.infrastructure.execution.action.ActionOutcome;
import xyz.firestige.pipeline.infrastructure.execution.action.ActionRegistry;
import xyz.firestige.pipeline.infrastructure.execution.action.ActionRequest;
import xyz.firestige.pipeline.infrastructure.execution.action.StepAction;
import xyz.firestige.pipeline.infrastructure.execution.output.OutputCapture;
import xyz.firestige.pipeline.infrastructure.template.TemplateResolver;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 步骤执行器
 * <p>
 * 职责：
 * 1. 在并发许可内把动作提交到 worker 线程池执行
 * 2. 硬超时：到期后以 STEP_TIMEOUT 取消步骤令牌，宽限期后中断 worker
 * 3. 按退出码与取消原因映射执行状态，捕获输出写入日志文件
 * <p>
 * 调用线程只等待自己的步骤，不占用引擎的调度线程。
 */
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    private final ActionRegistry actionRegistry;
    private final TemplateResolver templateResolver;
    private final ExecutorService workerPool;
    private final Duration pollInterval;
    private final Duration killGracePeriod;

    public StepExecutor(ActionRegistry actionRegistry, TemplateResolver templateResolver,
                        ExecutorService workerPool, Duration pollInterval, Duration killGracePeriod) {
        this.actionRegistry = actionRegistry;
        this.templateResolver = templateResolver;
        this.workerPool = workerPool;
        this.pollInterval = pollInterval;
        this.killGracePeriod = killGracePeriod;
    }

    public ExecutionResult execute(PlannedStep step, StepEnvironment env) {
        ExecutionResult result = ExecutionResult.pending(step.getPath(), step.getName(), ResultType.STEP);
        result.start();

        CancellationToken parentToken = env.getCancellationToken();
        CancellationToken token = parentToken.child();
        RunContext context = env.getRunContext();
        String outputRef = "logs/" + step.getPath() + "/attempt-" + env.getAttempt() + ".log";

        try (OutputCapture output = OutputCapture.open(context.getRunDirectory(), outputRef, env.getMasker())) {
            result.setOutputRef(outputRef);
            Semaphore permits = env.getConcurrencyPermits();
            if (!acquirePermit(permits, token)) {
                result.complete(ExecutionStatus.ABORTED,
                        FailureInfo.of(ErrorType.ABORTED, "运行已中止，步骤未开始: " + token.getReason(), step.getPath()));
                return result;
            }
            try {
                ActionRequest request = buildRequest(step, env, output, token);
                log.info("步骤开始: {} (attempt {}, timeout {})", step.getPath(), env.getAttempt(), step.getTimeout());
                Invocation invocation = invoke(actionRegistry.get(step.getDefinition().getEffectiveActionId()),
                        request, token, step.getTimeout());
                applyOutcome(result, step, invocation, output, env);
            } finally {
                permits.release();
            }
        } catch (PipelineException e) {
            log.error("步骤执行异常: {}", step.getPath(), e);
            completeIfRunning(result, ExecutionStatus.FAILURE, e.toFailureInfo(step.getPath()));
        } finally {
            parentToken.detach(token);
        }
        log.info("步骤结束: {} -> {} ({})", step.getPath(), result.getStatus(), result.getDuration());
        return result;
    }

    private boolean acquirePermit(Semaphore permits, CancellationToken token) {
        try {
            while (!token.isCancelled()) {
                if (permits.tryAcquire(pollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private ActionRequest buildRequest(PlannedStep step, StepEnvironment env, OutputCapture output,
                                       CancellationToken token) {
        StepDefinition definition = step.getDefinition();
        RunContext context = env.getRunContext();
        Map<String, String> variables = context.getEnvironment();

        Path workingDirectory = context.getWorkspace();
        if (definition.getDir() != null) {
            workingDirectory = workingDirectory.resolve(templateResolver.resolve(definition.getDir(), variables));
        }
        try {
            Files.createDirectories(workingDirectory);
        } catch (IOException e) {
            throw new PipelineException(ErrorType.SYSTEM_ERROR, "无法创建工作目录: " + workingDirectory, e);
        }

        return new ActionRequest(
                step.getPath(),
                templateResolver.resolve(definition.getCommand(), variables),
                templateResolver.resolveAll(definition.getArguments(), variables),
                env.getEnvironment(),
                workingDirectory,
                output,
                token,
                context);
    }

    private Invocation invoke(StepAction action, ActionRequest request, CancellationToken token, Duration timeout) {
        long timeoutNanos = DurationLimits.toNanosSaturated(timeout);
        long pollNanos = pollInterval.toNanos();
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        long startedAt = System.nanoTime();
        Future<ActionOutcome> future = workerPool.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return action.invoke(request);
            } finally {
                MDC.clear();
            }
        });

        try {
            while (true) {
                long remaining = timeoutNanos - (System.nanoTime() - startedAt);
                long wait = Math.max(1L, Math.min(pollNanos, remaining));
                try {
                    return Invocation.completed(future.get(wait, TimeUnit.NANOSECONDS));
                } catch (TimeoutException e) {
                    if (System.nanoTime() - startedAt >= timeoutNanos) {
                        token.cancel(CancelReason.STEP_TIMEOUT);
                    }
                    if (token.isCancelled()) {
                        return awaitTermination(future, token);
                    }
                }
            }
        } catch (ExecutionException e) {
            return Invocation.failed(e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            future.cancel(true);
            token.cancel(CancelReason.CANCELLED);
            Thread.currentThread().interrupt();
            return Invocation.cancelled(token.getReason());
        }
    }

    /**
     * 令牌已取消：给动作一个宽限期自行退出，超时后中断 worker 线程
     */
    private Invocation awaitTermination(Future<ActionOutcome> future, CancellationToken token)
            throws InterruptedException {
        try {
            future.get(killGracePeriod.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("动作未在宽限期内响应取消，强制中断: reason={}", token.getReason());
            future.cancel(true);
        } catch (ExecutionException e) {
            log.debug("动作在取消后异常结束: {}", String.valueOf(e.getCause()));
        }
        return Invocation.cancelled(token.getReason());
    }

    private void applyOutcome(ExecutionResult result, PlannedStep step, Invocation invocation,
                              OutputCapture output, StepEnvironment env) {
        String path = step.getPath();
        if (invocation.cancelReason == CancelReason.STEP_TIMEOUT) {
            output.line("[pipeline] 步骤超时，已终止 (" + step.getTimeout() + ")");
            result.failure(new StepTimeoutException(path, step.getTimeout()).toFailureInfo(path));
            return;
        }
        if (invocation.cancelReason != null) {
            output.line("[pipeline] 运行已中止: " + invocation.cancelReason);
            result.complete(ExecutionStatus.ABORTED,
                    FailureInfo.of(ErrorType.ABORTED, "运行已中止: " + invocation.cancelReason, path));
            return;
        }
        if (invocation.error != null) {
            String message = invocation.error.getMessage() != null
                    ? invocation.error.getMessage()
                    : invocation.error.getClass().getSimpleName();
            output.line("[pipeline] 动作异常: " + message);
            result.failure(FailureInfo.of(ErrorType.STEP_FAILURE, env.getMasker().mask(message), path));
            return;
        }

        ActionOutcome outcome = invocation.outcome;
        if (outcome == null) {
            result.failure(FailureInfo.of(ErrorType.SYSTEM_ERROR, "动作未返回结果", path));
            return;
        }
        result.setExitCode(outcome.getExitCode());
        outcome.getArtifacts().forEach(env.getArtifactSink());
        if (outcome.getExitCode() == 0) {
            result.success();
        } else if (step.getDefinition().getUnstableExitCodes().contains(outcome.getExitCode())) {
            result.complete(ExecutionStatus.UNSTABLE, null);
        } else {
            result.failure(FailureInfo.of(ErrorType.STEP_FAILURE,
                    env.getMasker().mask(failureMessage(outcome, output)), path));
        }
    }

    private String failureMessage(ActionOutcome outcome, OutputCapture output) {
        StringBuilder message = new StringBuilder("退出码 ").append(outcome.getExitCode());
        if (outcome.getMessage() != null) {
            message.append(": ").append(outcome.getMessage());
        }
        List<String> tail = output.tail();
        if (!tail.isEmpty()) {
            message.append(" | ").append(tail.get(tail.size() - 1));
        }
        return message.toString();
    }

    private void completeIfRunning(ExecutionResult result, ExecutionStatus status, FailureInfo failureInfo) {
        if (result.getStatus() == ExecutionStatus.RUNNING) {
            result.complete(status, failureInfo);
        }
    }

    /**
     * 一次动作调用的结局：正常返回、抛出异常或被取消
     */
    private static final class Invocation {
        private final ActionOutcome outcome;
        private final Throwable error;
        private final CancelReason cancelReason;

        private Invocation(ActionOutcome outcome, Throwable error, CancelReason cancelReason) {
            this.outcome = outcome;
            this.error = error;
            this.cancelReason = cancelReason;
        }

        static Invocation completed(ActionOutcome outcome) {
            return new Invocation(outcome, null, null);
        }

        static Invocation failed(Throwable error) {
            return new Invocation(null, error, null);
        }

        static Invocation cancelled(CancelReason reason) {
            return new Invocation(null, null, reason);
        }
    }
}
