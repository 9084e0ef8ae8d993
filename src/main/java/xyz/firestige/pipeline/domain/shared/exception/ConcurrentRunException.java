package xyz.firestige.pipeline.domain.shared.exception;

/**
 * 同一流水线已有运行在执行中（disableConcurrentBuilds）
 */
public class ConcurrentRunException extends PipelineException {

    private final String pipelineName;

    public ConcurrentRunException(String pipelineName) {
        super(ErrorType.LOCK_CONTENTION, "流水线已有运行在执行中，拒绝启动新运行: " + pipelineName);
        this.pipelineName = pipelineName;
    }

    public String getPipelineName() {
        return pipelineName;
    }
}
