package xyz.firestige.pipeline.infrastructure.metrics;

import xyz.firestige.pipeline.domain.run.ExecutionStatus;

import java.time.Duration;

public class NoopMetricsRegistry implements MetricsRegistry {
    @Override
    public void runRejected(String pipelineName) { }

    @Override
    public void runStarted(String pipelineName) { }

    @Override
    public void runFinished(String pipelineName, ExecutionStatus status, Duration duration) { }

    @Override
    public void archiveFailed(String pipelineName) { }

    @Override
    public void activeRuns(int count) { }
}
