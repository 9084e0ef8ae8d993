package xyz.firestige.pipeline.infrastructure.execution;

import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.PipelineException;

import java.time.Duration;

/**
 * 步骤超过时限被强制终止
 */
public class StepTimeoutException extends PipelineException {

    private final Duration timeout;

    public StepTimeoutException(String stepPath, Duration timeout) {
        super(ErrorType.TIMEOUT_ERROR, "步骤执行超时 (" + timeout + "): " + stepPath);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
