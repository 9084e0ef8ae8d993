package xyz.firestige.pipeline.infrastructure.lock;

import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.PipelineException;

import java.time.Duration;

/**
 * 命名资源锁在 lockTimeout 内未能获取
 */
public class LockContentionException extends PipelineException {

    private final String lockName;

    public LockContentionException(String lockName, Duration waited) {
        super(ErrorType.LOCK_CONTENTION, "资源锁等待超时 (" + waited + "): " + lockName);
        this.lockName = lockName;
    }

    public String getLockName() {
        return lockName;
    }
}
