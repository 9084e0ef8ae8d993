package xyz.firestige.pipeline.domain.run.event;

import xyz.firestige.pipeline.domain.run.ExecutionStatus;
import xyz.firestige.pipeline.domain.shared.vo.RunId;

import java.time.Duration;

/**
 * Stage 结束事件（含 SKIPPED）
 */
public class StageCompletedEvent extends PipelineRunEvent {

    private final String stagePath;
    private final Duration duration;

    public StageCompletedEvent(RunId runId, String stagePath, ExecutionStatus status, Duration duration) {
        super(runId, status);
        this.stagePath = stagePath;
        this.duration = duration;
    }

    public String getStagePath() {
        return stagePath;
    }

    public Duration getDuration() {
        return duration;
    }
}
