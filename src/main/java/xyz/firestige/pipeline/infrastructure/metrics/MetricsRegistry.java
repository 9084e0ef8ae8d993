package xyz.firestige.pipeline.infrastructure.metrics;

import xyz.firestige.pipeline.domain.run.ExecutionStatus;

import java.time.Duration;

/**
 * 引擎运行指标
 * <p>
 * 所有指标按流水线名打标签；实现不得抛出异常影响运行。
 */
public interface MetricsRegistry {

    void runRejected(String pipelineName);

    void runStarted(String pipelineName);

    /**
     * 运行进入终态
     */
    void runFinished(String pipelineName, ExecutionStatus status, Duration duration);

    void archiveFailed(String pipelineName);

    /**
     * 当前引擎内未结束的运行数
     */
    void activeRuns(int count);
}
