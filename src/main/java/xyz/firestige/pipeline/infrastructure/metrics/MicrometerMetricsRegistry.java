package xyz.firestige.pipeline.infrastructure.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import xyz.firestige.pipeline.domain.run.ExecutionStatus;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer 指标实现
 * <p>
 * 计数器：pipeline.runs.rejected / pipeline.runs.started / pipeline.archive.failures，标签 pipeline；
 * 计时器：pipeline.run.duration，标签 pipeline、status；
 * 仪表：pipeline.runs.active。
 */
public class MicrometerMetricsRegistry implements MetricsRegistry {

    static final String TAG_PIPELINE = "pipeline";
    static final String TAG_STATUS = "status";

    private final MeterRegistry registry;
    private final AtomicInteger active;

    public MicrometerMetricsRegistry(MeterRegistry registry) {
        this.registry = registry;
        this.active = registry.gauge("pipeline.runs.active", new AtomicInteger());
    }

    @Override
    public void runRejected(String pipelineName) {
        registry.counter("pipeline.runs.rejected", TAG_PIPELINE, pipelineName).increment();
    }

    @Override
    public void runStarted(String pipelineName) {
        registry.counter("pipeline.runs.started", TAG_PIPELINE, pipelineName).increment();
    }

    @Override
    public void runFinished(String pipelineName, ExecutionStatus status, Duration duration) {
        Timer.builder("pipeline.run.duration")
                .tag(TAG_PIPELINE, pipelineName)
                .tag(TAG_STATUS, status.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .record(duration != null ? duration : Duration.ZERO);
    }

    @Override
    public void archiveFailed(String pipelineName) {
        registry.counter("pipeline.archive.failures", TAG_PIPELINE, pipelineName).increment();
    }

    @Override
    public void activeRuns(int count) {
        active.set(count);
    }
}
