package xyz.firestige.pipeline.infrastructure.lock;

import xyz.firestige.pipeline.domain.run.CancellationToken;
import xyz.firestige.pipeline.domain.shared.DurationLimits;

import java.time.Duration;

/**
 * 命名资源锁管理器
 * <p>
 * 同时用于 Stage 声明的资源锁与运行互斥（键 {@code run:<pipeline>}）。
 * 释放时校验持有者，避免误删他人的锁。
 */
public interface ResourceLockManager {

    /**
     * 运行互斥锁的键
     */
    static String runLockName(String pipelineName) {
        return "run:" + pipelineName;
    }

    /**
     * 非阻塞获取
     *
     * @param name  锁名称
     * @param owner 持有者标识
     * @param ttl   过期时间（分布式实现防止崩溃后泄漏）
     * @return true 获取成功
     */
    boolean tryAcquire(String name, String owner, Duration ttl);

    /**
     * 释放锁；不是持有者时不做任何事
     *
     * @return true 确实释放了
     */
    boolean release(String name, String owner);

    /**
     * 续期
     */
    boolean renew(String name, String owner, Duration ttl);

    boolean isLocked(String name);

    /**
     * 阻塞获取：按轮询间隔重试，期间响应取消
     *
     * @param timeout 最长等待时间，null 表示一直等待
     * @return true 获取成功；false 等待期间运行被取消
     * @throws LockContentionException 超过 timeout 仍未获取
     */
    default boolean acquire(String name, String owner, Duration ttl, Duration timeout,
                            CancellationToken token, Duration pollInterval) throws InterruptedException {
        long timeoutNanos = timeout != null ? DurationLimits.toNanosSaturated(timeout) : Long.MAX_VALUE;
        long startedAt = System.nanoTime();
        while (!token.isCancelled()) {
            if (tryAcquire(name, owner, ttl)) {
                return true;
            }
            if (System.nanoTime() - startedAt >= timeoutNanos) {
                throw new LockContentionException(name, timeout);
            }
            token.sleepUnlessCancelled(pollInterval);
        }
        return false;
    }
}
