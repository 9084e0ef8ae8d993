package xyz.firestige.pipeline.domain.run.event;

import xyz.firestige.pipeline.domain.run.ExecutionStatus;
import xyz.firestige.pipeline.domain.shared.vo.RunId;

/**
 * Stage 开始事件
 */
public class StageStartedEvent extends PipelineRunEvent {

    private final String stagePath;

    public StageStartedEvent(RunId runId, String stagePath) {
        super(runId, ExecutionStatus.RUNNING);
        this.stagePath = stagePath;
    }

    public String getStagePath() {
        return stagePath;
    }
}
