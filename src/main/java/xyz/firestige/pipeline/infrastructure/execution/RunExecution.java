package xyz.firestige.pipeline.infrastructure.execution;

import xyz.firestige.pipeline.domain.plan.ExecutionPlan;
import xyz.firestige.pipeline.domain.run.CancelReason;
import xyz.firestige.pipeline.domain.run.CancellationToken;
import xyz.firestige.pipeline.domain.run.RunContext;
import xyz.firestige.pipeline.domain.run.RunReport;
import xyz.firestige.pipeline.domain.shared.vo.RunId;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;

/**
 * 一次运行的执行句柄：计划、上下文、报告、取消令牌、并发许可与持有的锁
 */
public class RunExecution {

    private final ExecutionPlan plan;
    private final RunContext context;
    private final RunReport report;
    private final String owner;
    private final String runLockName;
    private final CancellationToken cancellationToken = CancellationToken.create();
    private final Semaphore concurrencyPermits;
    private final LockKeeper lockKeeper;
    private final CompletableFuture<RunReport> completion = new CompletableFuture<>();

    public RunExecution(ExecutionPlan plan, RunContext context, RunReport report, String owner,
                        String runLockName, LockKeeper lockKeeper) {
        this.plan = plan;
        this.context = context;
        this.report = report;
        this.owner = owner;
        this.runLockName = runLockName;
        this.concurrencyPermits = new Semaphore(plan.getConcurrencyLimit(), true);
        this.lockKeeper = lockKeeper;
    }

    /**
     * @return true 表示本次调用触发了取消
     */
    public boolean cancel(CancelReason reason) {
        return cancellationToken.cancel(reason);
    }

    public RunId getRunId() {
        return context.getRunId();
    }

    public ExecutionPlan getPlan() {
        return plan;
    }

    public RunContext getContext() {
        return context;
    }

    public RunReport getReport() {
        return report;
    }

    /**
     * 运行内锁持有者标识的前缀
     */
    public String getOwner() {
        return owner;
    }

    /**
     * 运行互斥锁名，允许并发运行时为 null
     */
    public String getRunLockName() {
        return runLockName;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public Semaphore getConcurrencyPermits() {
        return concurrencyPermits;
    }

    public LockKeeper getLockKeeper() {
        return lockKeeper;
    }

    public CompletableFuture<RunReport> getCompletion() {
        return completion;
    }
}
