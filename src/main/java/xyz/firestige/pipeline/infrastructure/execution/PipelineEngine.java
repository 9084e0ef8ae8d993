package xyz.firestige.pipeline.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.domain.plan.ExecutionPlan;
import xyz.firestige.pipeline.domain.plan.PlannedStage;
import xyz.firestige.pipeline.domain.run.CancelReason;
import xyz.firestige.pipeline.domain.run.ExecutionResult;
import xyz.firestige.pipeline.domain.run.ExecutionStatus;
import xyz.firestige.pipeline.domain.run.HookOutput;
import xyz.firestige.pipeline.domain.run.RunContext;
import xyz.firestige.pipeline.domain.run.RunReport;
import xyz.firestige.pipeline.domain.run.event.RunCompletedEvent;
import xyz.firestige.pipeline.domain.run.event.RunStartedEvent;
import xyz.firestige.pipeline.domain.shared.event.DomainEventPublisher;
import xyz.firestige.pipeline.domain.shared.exception.ConcurrentRunException;
import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.FailureInfo;
import xyz.firestige.pipeline.domain.shared.exception.PipelineException;
import xyz.firestige.pipeline.domain.shared.exception.RunNotFoundException;
import xyz.firestige.pipeline.domain.shared.vo.RunId;
import xyz.firestige.pipeline.infrastructure.lock.ResourceLockManager;
import xyz.firestige.pipeline.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.pipeline.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.pipeline.infrastructure.persistence.RunArchive;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 流水线引擎
 * <p>
 * 职责：
 * <ul>
 *   <li>运行互斥：disableConcurrentBuilds 时同一流水线只允许一个运行</li>
 *   <li>按顺序编排顶层 Stage，失败后剩余 Stage 记为 SKIPPED</li>
 *   <li>全局超时：到期取消运行令牌，结局为 ABORTED</li>
 *   <li>流水线级后置钩子、运行报告归档与保留策略</li>
 * </ul>
 * 无论结局如何，运行结束时释放运行锁与所有遗留的资源锁。
 */
public class PipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(PipelineEngine.class);

    private final StageRunner stageRunner;
    private final HookRunner hookRunner;
    private final ResourceLockManager lockManager;
    private final RunArchive runArchive;
    private final DomainEventPublisher eventPublisher;
    private final ScheduledExecutorService scheduler;
    private final EngineSettings settings;
    private final MetricsRegistry metrics;

    private final Map<RunId, RunExecution> activeRuns = new ConcurrentHashMap<>();

    public PipelineEngine(StageRunner stageRunner, HookRunner hookRunner, ResourceLockManager lockManager,
                          RunArchive runArchive, DomainEventPublisher eventPublisher,
                          ScheduledExecutorService scheduler, EngineSettings settings, MetricsRegistry metrics) {
        this.stageRunner = stageRunner;
        this.hookRunner = hookRunner;
        this.lockManager = lockManager;
        this.runArchive = runArchive;
        this.eventPublisher = eventPublisher;
        this.scheduler = scheduler;
        this.settings = settings;
        this.metrics = metrics != null ? metrics : new NoopMetricsRegistry();
    }

    /**
     * 同步执行：准备并运行到结束
     */
    public RunReport run(ExecutionPlan plan) {
        return execute(prepare(plan));
    }

    /**
     * 准备运行：获取运行锁、分配运行编号、创建运行目录与上下文
     *
     * @throws ConcurrentRunException 同一流水线已有运行且禁止并发
     */
    public RunExecution prepare(ExecutionPlan plan) {
        String pipelineName = plan.getPipelineName();
        String owner = UUID.randomUUID().toString();
        String runLock = null;
        if (plan.isDisableConcurrentBuilds()) {
            runLock = ResourceLockManager.runLockName(pipelineName);
            if (!lockManager.tryAcquire(runLock, owner, settings.lockTtl())) {
                log.warn("拒绝并发运行: {}", pipelineName);
                metrics.runRejected(pipelineName);
                throw new ConcurrentRunException(pipelineName);
            }
        }

        try {
            RunId runId = RunId.of(pipelineName, runArchive.nextRunNumber(pipelineName));
            Path runDirectory = runArchive.runDirectory(runId);
            Path workspace = settings.workspaceRoot().resolve(pipelineName);
            Files.createDirectories(workspace);

            RunContext context = new RunContext(runId, plan.getParameters(), plan.getEnvironment(),
                    workspace, runDirectory);
            RunReport report = new RunReport(runId, plan.getParameters());
            LockKeeper lockKeeper = new LockKeeper(lockManager, scheduler, settings.lockTtl());
            if (runLock != null) {
                lockKeeper.hold(runLock, owner);
            }
            RunExecution execution = new RunExecution(plan, context, report, owner, runLock, lockKeeper);
            activeRuns.put(runId, execution);
            log.info("运行已创建: {}", runId);
            return execution;
        } catch (IOException e) {
            releaseRunLock(runLock, owner);
            throw new PipelineException(ErrorType.SYSTEM_ERROR, "无法创建工作区: " + pipelineName, e);
        } catch (RuntimeException e) {
            releaseRunLock(runLock, owner);
            throw e;
        }
    }

    /**
     * 执行已准备的运行，返回终态报告
     */
    public RunReport execute(RunExecution execution) {
        ExecutionPlan plan = execution.getPlan();
        RunContext context = execution.getContext();
        RunReport report = execution.getReport();
        ScheduledFuture<?> watchdog = null;

        context.injectMdc(null);
        try {
            report.start();
            metrics.runStarted(plan.getPipelineName());
            metrics.activeRuns(activeRuns.size());
            eventPublisher.publish(new RunStartedEvent(execution.getRunId(), plan.getParameters()));
            log.info("开始执行运行: {}, stages={}, parameters={}", execution.getRunId(),
                    plan.getStages().size(), plan.getParameters().keySet());

            execution.getLockKeeper().start();
            watchdog = scheduleTimeout(execution);

            Outcome outcome = runStages(execution);
            ExecutionStatus finalStatus = outcome.status;
            FailureInfo failure = outcome.failure;
            if (execution.getCancellationToken().isCancelled()) {
                CancelReason reason = execution.getCancellationToken().getReason();
                report.setCancelReason(reason);
                finalStatus = ExecutionStatus.ABORTED;
                failure = FailureInfo.of(ErrorType.ABORTED, "运行已中止: " + reason);
            }

            context.injectMdc(null);
            hookRunner.run(HookOutput.PIPELINE_SCOPE, plan.getHooks(), finalStatus, execution);
            report.complete(finalStatus, failure);
        } catch (RuntimeException e) {
            log.error("运行执行异常: {}", execution.getRunId(), e);
            FailureInfo failure = FailureInfo.fromException(e, ErrorType.SYSTEM_ERROR, null);
            if (report.getStatus() == ExecutionStatus.RUNNING) {
                report.complete(ExecutionStatus.FAILURE, failure);
            } else if (!report.isFinished()) {
                report.complete(ExecutionStatus.ABORTED, failure);
            }
        } finally {
            if (watchdog != null) {
                watchdog.cancel(false);
            }
            finish(execution);
        }
        return report;
    }

    private Outcome runStages(RunExecution execution) {
        RunContext context = execution.getContext();
        RunReport report = execution.getReport();
        ExecutionStatus status = ExecutionStatus.SUCCESS;
        FailureInfo failure = null;
        boolean stopped = false;

        for (PlannedStage stage : execution.getPlan().getStages()) {
            if (stopped || execution.getCancellationToken().isCancelled()) {
                report.addStage(stageRunner.skip(stage, execution));
                continue;
            }
            ExecutionResult result = stageRunner.run(stage, execution);
            report.addStage(result);
            context.injectMdc(null);

            switch (result.getStatus()) {
                case FAILURE:
                    if (stage.isBestEffort()) {
                        log.warn("best-effort Stage 失败，运行继续: {}", stage.getPath());
                        status = ExecutionStatus.worst(status, ExecutionStatus.UNSTABLE);
                    } else {
                        log.error("Stage 失败，后续 Stage 跳过: {}", stage.getPath());
                        status = ExecutionStatus.FAILURE;
                        failure = result.getFailureInfo();
                        stopped = true;
                    }
                    break;
                case ABORTED:
                    status = ExecutionStatus.worst(status, ExecutionStatus.ABORTED);
                    if (failure == null) {
                        failure = result.getFailureInfo();
                    }
                    stopped = true;
                    break;
                case UNSTABLE:
                    status = ExecutionStatus.worst(status, ExecutionStatus.UNSTABLE);
                    break;
                default:
                    break;
            }
        }
        return new Outcome(status, failure);
    }

    private ScheduledFuture<?> scheduleTimeout(RunExecution execution) {
        if (execution.getPlan().getTimeout() == null) {
            return null;
        }
        long timeoutMillis = execution.getPlan().getTimeout().toMillis();
        return scheduler.schedule(() -> {
            if (execution.cancel(CancelReason.RUN_TIMEOUT)) {
                log.warn("运行超时，取消执行: {} ({})", execution.getRunId(), execution.getPlan().getTimeout());
            }
        }, timeoutMillis, TimeUnit.MILLISECONDS);
    }

    private void finish(RunExecution execution) {
        RunReport report = execution.getReport();
        RunId runId = execution.getRunId();
        try {
            execution.getLockKeeper().stop();
            if (execution.getRunLockName() != null) {
                execution.getLockKeeper().drop(execution.getRunLockName());
            }
            execution.getLockKeeper().releaseAll();
            archive(report, execution.getPlan().getRetention());
        } finally {
            releaseRunLock(execution.getRunLockName(), execution.getOwner());
            activeRuns.remove(runId);
            metrics.runFinished(report.getPipelineName(), report.getStatus(), report.getDuration());
            metrics.activeRuns(activeRuns.size());
            log.info("运行结束: {} -> {} ({})", runId, report.getStatus(), report.getDuration());
            eventPublisher.publish(new RunCompletedEvent(report));
            execution.getCompletion().complete(report);
            execution.getContext().clearMdc();
        }
    }

    private void archive(RunReport report, int retention) {
        try {
            runArchive.save(report);
            runArchive.purgeBeyond(report.getPipelineName(), retention);
        } catch (PipelineException e) {
            log.error("运行归档失败: {}", report.getRunId(), e);
            metrics.archiveFailed(report.getPipelineName());
        }
    }

    private void releaseRunLock(String runLock, String owner) {
        if (runLock != null && lockManager.release(runLock, owner)) {
            log.debug("释放运行锁: {}", runLock);
        }
    }

    /**
     * 取消运行中的执行
     *
     * @return true 表示本次调用触发了取消
     * @throws RunNotFoundException 运行不在执行中
     */
    public boolean cancel(RunId runId) {
        RunExecution execution = activeRuns.get(runId);
        if (execution == null) {
            throw new RunNotFoundException(runId);
        }
        log.info("取消运行: {}", runId);
        return execution.cancel(CancelReason.CANCELLED);
    }

    public Optional<RunExecution> activeRun(RunId runId) {
        return Optional.ofNullable(activeRuns.get(runId));
    }

    /**
     * 查找运行报告：执行中的返回实时报告，否则查归档
     */
    public Optional<RunReport> findReport(RunId runId) {
        RunExecution execution = activeRuns.get(runId);
        if (execution != null) {
            return Optional.of(execution.getReport());
        }
        return runArchive.find(runId);
    }

    public int activeRunCount() {
        return activeRuns.size();
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
