package xyz.firestige.pipeline.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.domain.definition.StageKind;
import xyz.firestige.pipeline.domain.plan.PlannedStage;
import xyz.firestige.pipeline.domain.plan.PlannedStep;
import xyz.firestige.pipeline.domain.run.CancellationToken;
import xyz.firestige.pipeline.domain.run.ExecutionResult;
import xyz.firestige.pipeline.domain.run.ExecutionStatus;
import xyz.firestige.pipeline.domain.run.ResultType;
import xyz.firestige.pipeline.domain.run.RunContext;
import xyz.firestige.pipeline.domain.run.event.StageCompletedEvent;
import xyz.firestige.pipeline.domain.run.event.StageStartedEvent;
import xyz.firestige.pipeline.domain.shared.event.DomainEventPublisher;
import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.FailureInfo;
import xyz.firestige.pipeline.infrastructure.lock.LockContentionException;
import xyz.firestige.pipeline.infrastructure.lock.ResourceLockManager;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Stage 执行器
 * <p>
 * 顺序 Stage：依次执行步骤，遇到 FAILURE / ABORTED 停止，其余步骤记为 SKIPPED。
 * 并行 Stage：所有分支同时启动并全部等待完成，一个分支失败不取消兄弟分支。
 * 分组状态取分支中最差的状态，best-effort 分支的失败按 UNSTABLE 计。
 * <p>
 * 声明了资源锁的 Stage 在锁内执行主体与后置钩子，退出时释放。
 * 锁未获得（超时或等待中被取消）时主体不执行，Stage 已有终态，后置钩子照常执行但不持有锁。
 * 主体抛出的异常使 Stage 以 SYSTEM_ERROR 失败，后置钩子仍然执行。
 */
public class StageRunner {

    private static final Logger log = LoggerFactory.getLogger(StageRunner.class);

    private final StepRunner stepRunner;
    private final HookRunner hookRunner;
    private final ResourceLockManager lockManager;
    private final DomainEventPublisher eventPublisher;
    private final ExecutorService branchPool;
    private final EngineSettings settings;

    public StageRunner(StepRunner stepRunner, HookRunner hookRunner, ResourceLockManager lockManager,
                       DomainEventPublisher eventPublisher, ExecutorService branchPool, EngineSettings settings) {
        this.stepRunner = stepRunner;
        this.hookRunner = hookRunner;
        this.lockManager = lockManager;
        this.eventPublisher = eventPublisher;
        this.branchPool = branchPool;
        this.settings = settings;
    }

    public ExecutionResult run(PlannedStage stage, RunExecution run) {
        if (!stage.isEnabled()) {
            log.info("Stage 条件不满足，跳过: {}", stage.getPath());
            return skip(stage, run);
        }
        if (run.getCancellationToken().isCancelled()) {
            return skip(stage, run);
        }

        RunContext context = run.getContext();
        context.injectMdc(stage.getPath());
        ExecutionResult result = newResult(stage);
        result.start();
        eventPublisher.publish(new StageStartedEvent(run.getRunId(), stage.getPath()));
        log.info("开始执行 Stage: {}", stage.getPath());

        String lock = stage.getLock();
        String lockOwner = run.getOwner() + ":" + stage.getPath();
        boolean locked = false;
        try {
            if (lock != null) {
                locked = acquireLock(stage, result, run, lockOwner);
            }
            if (lock == null || locked) {
                runBody(stage, result, run);
            } else {
                skipChildren(stage, result);
                log.info("未获得资源锁，后置钩子在锁外执行: {} ({})", stage.getPath(), lock);
            }
            log.info("Stage 结束: {} -> {}", stage.getPath(), result.getStatus());
            context.injectMdc(stage.getPath());
            hookRunner.run(stage.getPath(), stage.getHooks(), result.getStatus(), run);
        } finally {
            if (locked) {
                run.getLockKeeper().drop(lock);
                lockManager.release(lock, lockOwner);
                log.info("释放资源锁: {} (stage {})", lock, stage.getPath());
            }
        }

        eventPublisher.publish(new StageCompletedEvent(run.getRunId(), stage.getPath(),
                result.getStatus(), result.getDuration()));
        return result;
    }

    private void runBody(PlannedStage stage, ExecutionResult result, RunExecution run) {
        try {
            Outcome outcome = stage.getKind() == StageKind.PARALLEL
                    ? runBranches(stage, result, run)
                    : runSteps(stage, result, run);
            result.complete(outcome.status, outcome.failure);
        } catch (RuntimeException e) {
            log.error("Stage 执行异常: {}", stage.getPath(), e);
            if (result.getStatus() == ExecutionStatus.RUNNING) {
                result.failure(FailureInfo.fromException(e, ErrorType.SYSTEM_ERROR, stage.getPath()));
            }
        }
    }

    /**
     * 整棵子树记为 SKIPPED
     */
    public ExecutionResult skip(PlannedStage stage, RunExecution run) {
        ExecutionResult result = newResult(stage);
        result.skip();
        skipChildren(stage, result);
        eventPublisher.publish(new StageCompletedEvent(run.getRunId(), stage.getPath(), ExecutionStatus.SKIPPED, null));
        return result;
    }

    private ExecutionResult newResult(PlannedStage stage) {
        ResultType type = stage.getKind() == StageKind.PARALLEL ? ResultType.PARALLEL : ResultType.STAGE;
        ExecutionResult result = ExecutionResult.pending(stage.getPath(), stage.getName(), type);
        result.setBestEffort(stage.isBestEffort());
        return result;
    }

    private void skipChildren(PlannedStage stage, ExecutionResult result) {
        for (PlannedStep step : stage.getSteps()) {
            result.addChild(ExecutionResult.skipped(step.getPath(), step.getName(), ResultType.STEP));
        }
        for (PlannedStage branch : stage.getBranches()) {
            ExecutionResult child = newResult(branch);
            child.skip();
            skipChildren(branch, child);
            result.addChild(child);
        }
    }

    /**
     * 获取失败时把 Stage 结果置为终态并返回 false
     */
    private boolean acquireLock(PlannedStage stage, ExecutionResult result, RunExecution run, String owner) {
        String lock = stage.getLock();
        log.info("等待资源锁: {} (timeout {})", lock, stage.getLockTimeout());
        try {
            boolean acquired = lockManager.acquire(lock, owner, settings.lockTtl(), stage.getLockTimeout(),
                    run.getCancellationToken(), settings.lockPollInterval());
            if (acquired) {
                run.getLockKeeper().hold(lock, owner);
                log.info("获取资源锁: {}", lock);
                return true;
            }
            result.complete(ExecutionStatus.ABORTED,
                    FailureInfo.of(ErrorType.ABORTED, "等待资源锁期间运行被取消: " + lock, stage.getPath()));
        } catch (LockContentionException e) {
            log.warn("资源锁获取超时: {}", lock);
            result.failure(e.toFailureInfo(stage.getPath()));
        } catch (RuntimeException e) {
            log.error("获取资源锁失败: {}", lock, e);
            result.failure(FailureInfo.fromException(e, ErrorType.SYSTEM_ERROR, stage.getPath()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result.complete(ExecutionStatus.ABORTED,
                    FailureInfo.of(ErrorType.ABORTED, "等待资源锁时被中断: " + lock, stage.getPath()));
        }
        return false;
    }

    private Outcome runSteps(PlannedStage stage, ExecutionResult result, RunExecution run) {
        CancellationToken token = run.getCancellationToken();
        ExecutionStatus status = ExecutionStatus.SUCCESS;
        FailureInfo failure = null;
        boolean stopped = false;

        for (PlannedStep step : stage.getSteps()) {
            if (stopped) {
                result.addChild(ExecutionResult.skipped(step.getPath(), step.getName(), ResultType.STEP));
                continue;
            }
            if (token.isCancelled()) {
                status = ExecutionStatus.worst(status, ExecutionStatus.ABORTED);
                failure = FailureInfo.of(ErrorType.ABORTED, "运行已中止: " + token.getReason(), step.getPath());
                result.addChild(ExecutionResult.skipped(step.getPath(), step.getName(), ResultType.STEP));
                stopped = true;
                continue;
            }
            ExecutionResult stepResult = stepRunner.run(step, run.getContext(), token,
                    run.getConcurrencyPermits(), run.getReport()::addArtifact);
            result.addChild(stepResult);
            status = ExecutionStatus.worst(status, stepResult.getStatus());
            if (stepResult.getStatus() == ExecutionStatus.FAILURE || stepResult.getStatus() == ExecutionStatus.ABORTED) {
                failure = stepResult.getFailureInfo();
                stopped = true;
            }
        }
        return new Outcome(status, failure);
    }

    private Outcome runBranches(PlannedStage stage, ExecutionResult result, RunExecution run) {
        List<CompletableFuture<ExecutionResult>> futures = new ArrayList<>();
        for (PlannedStage branch : stage.getBranches()) {
            futures.add(CompletableFuture.supplyAsync(() -> runBranch(branch, run), branchPool));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        ExecutionStatus status = ExecutionStatus.SUCCESS;
        FailureInfo failure = null;
        for (CompletableFuture<ExecutionResult> future : futures) {
            ExecutionResult branchResult = future.join();
            result.addChild(branchResult);
            ExecutionStatus effective = branchResult.getStatus();
            if (effective == ExecutionStatus.FAILURE && branchResult.isBestEffort()) {
                log.warn("best-effort 分支失败，按 UNSTABLE 计: {}", branchResult.getId());
                effective = ExecutionStatus.UNSTABLE;
            }
            if (effective == ExecutionStatus.SKIPPED) {
                continue;
            }
            if ((effective == ExecutionStatus.FAILURE || effective == ExecutionStatus.ABORTED) && failure == null) {
                failure = branchResult.getFailureInfo();
            }
            status = ExecutionStatus.worst(status, effective);
        }
        return new Outcome(status, failure);
    }

    private ExecutionResult runBranch(PlannedStage branch, RunExecution run) {
        RunContext context = run.getContext();
        context.injectMdc(branch.getPath());
        try {
            return run(branch, run);
        } catch (RuntimeException e) {
            log.error("分支执行异常: {}", branch.getPath(), e);
            ExecutionResult result = newResult(branch);
            result.start();
            result.failure(FailureInfo.fromException(e, ErrorType.SYSTEM_ERROR, branch.getPath()));
            return result;
        } finally {
            context.clearMdc();
        }
    }

    private static final class Outcome {
        private final ExecutionStatus status;
        private final FailureInfo failure;

        private Outcome(ExecutionStatus status, FailureInfo failure) {
            this.status = status;
            this.failure = failure;
        }
    }
}
