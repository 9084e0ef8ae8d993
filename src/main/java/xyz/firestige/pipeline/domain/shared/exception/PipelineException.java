package xyz.firestige.pipeline.domain.shared.exception;

/**
 * 流水线引擎异常基类
 * <p>
 * 所有引擎抛出的异常均为非受检异常，并携带 {@link ErrorType} 以便调用方分类处理。
 */
public class PipelineException extends RuntimeException {

    private final ErrorType errorType;

    public PipelineException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public PipelineException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public FailureInfo toFailureInfo(String failedAt) {
        return FailureInfo.of(errorType, getMessage(), failedAt);
    }
}
