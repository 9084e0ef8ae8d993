package xyz.firestige.pipeline.domain.shared.exception;

import xyz.firestige.pipeline.domain.shared.vo.RunId;

/**
 * 运行不存在（或已被保留策略清理）
 */
public class RunNotFoundException extends PipelineException {

    private final RunId runId;

    public RunNotFoundException(RunId runId) {
        super(ErrorType.SYSTEM_ERROR, "运行不存在或已被清理: " + runId);
        this.runId = runId;
    }

    public RunId getRunId() {
        return runId;
    }
}
