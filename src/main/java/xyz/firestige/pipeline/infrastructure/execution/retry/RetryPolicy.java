package xyz.firestige.pipeline.infrastructure.execution.retry;

import xyz.firestige.pipeline.domain.definition.StepDefinition;

import java.time.Duration;
import java.util.Objects;

/**
 * 重试策略值对象
 * <p>
 * maxRetries 为失败后的额外尝试次数，0 表示只执行一次；backoff 为两次尝试间的固定间隔。
 */
public final class RetryPolicy {

    public static final RetryPolicy NONE = new RetryPolicy(0, Duration.ZERO);

    private final int maxRetries;
    private final Duration backoff;

    private RetryPolicy(int maxRetries, Duration backoff) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries 不能为负数");
        }
        if (backoff == null || backoff.isNegative()) {
            throw new IllegalArgumentException("backoff 不能为负数");
        }
        this.maxRetries = maxRetries;
        this.backoff = backoff;
    }

    public static RetryPolicy of(int maxRetries, Duration backoff) {
        return new RetryPolicy(maxRetries, backoff != null ? backoff : Duration.ZERO);
    }

    public static RetryPolicy of(StepDefinition step) {
        return of(step.getRetry(), step.getRetryBackoff());
    }

    /**
     * 第 attempt 次尝试失败后的等待时间
     *
     * @param attempt 已完成的尝试次数（从 1 开始）
     * @return 等待时间，null 表示不再重试
     */
    public Duration nextDelay(int attempt) {
        if (attempt > maxRetries) {
            return null;
        }
        return backoff;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public int getMaxAttempts() {
        return maxRetries + 1;
    }

    public Duration getBackoff() {
        return backoff;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RetryPolicy that = (RetryPolicy) o;
        return maxRetries == that.maxRetries && Objects.equals(backoff, that.backoff);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxRetries, backoff);
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxRetries=" + maxRetries + ", backoff=" + backoff + '}';
    }
}
