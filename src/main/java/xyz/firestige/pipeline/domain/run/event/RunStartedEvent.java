package xyz.firestige.pipeline.domain.run.event;

import xyz.firestige.pipeline.domain.run.ExecutionStatus;
import xyz.firestige.pipeline.domain.shared.vo.RunId;

import java.util.Map;

/**
 * 运行开始事件
 */
public class RunStartedEvent extends PipelineRunEvent {

    private final Map<String, String> parameters;

    public RunStartedEvent(RunId runId, Map<String, String> parameters) {
        super(runId, ExecutionStatus.RUNNING);
        this.parameters = Map.copyOf(parameters);
    }

    public Map<String, String> getParameters() {
        return parameters;
    }
}
