package xyz.firestige.pipeline.domain.run.event;

import xyz.firestige.pipeline.domain.run.ExecutionStatus;
import xyz.firestige.pipeline.domain.shared.vo.RunId;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 运行生命周期事件基类
 */
public abstract class PipelineRunEvent {

    /**
     * 事件 ID
     */
    private final String eventId;

    /**
     * 运行 ID
     */
    private final RunId runId;

    /**
     * 事件发生时的状态
     */
    private final ExecutionStatus status;

    /**
     * 事件时间戳
     */
    private final LocalDateTime timestamp;

    protected PipelineRunEvent(RunId runId, ExecutionStatus status) {
        this.eventId = UUID.randomUUID().toString();
        this.runId = runId;
        this.status = status;
        this.timestamp = LocalDateTime.now();
    }

    public String getEventId() {
        return eventId;
    }

    public RunId getRunId() {
        return runId;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{runId=" + runId + ", status=" + status + '}';
    }
}
