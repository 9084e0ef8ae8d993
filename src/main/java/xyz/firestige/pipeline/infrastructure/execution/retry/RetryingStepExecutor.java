package xyz.firestige.pipeline.infrastructure.execution.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.domain.run.CancellationToken;
import xyz.firestige.pipeline.domain.run.ExecutionResult;
import xyz.firestige.pipeline.domain.run.ExecutionStatus;
import xyz.firestige.pipeline.domain.run.StepAttempt;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/**
 * 重试包装
 * <p>
 * 失败后最多再尝试 maxRetries 次；第一次非 FAILURE 的结果即返回；全部失败时返回最后一次的失败。
 * 不可重试的失败（如凭据错误）与中止不再重试。每次尝试都记录到结果的重试链中。
 */
public class RetryingStepExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryingStepExecutor.class);

    /**
     * @param policy  重试策略
     * @param token   运行取消令牌，等待重试间隔时响应取消
     * @param attempt 按尝试序号（从 1 开始）执行一次
     */
    public ExecutionResult withRetry(RetryPolicy policy, CancellationToken token, IntFunction<ExecutionResult> attempt) {
        List<StepAttempt> chain = new ArrayList<>();
        ExecutionResult last = null;
        for (int number = 1; number <= policy.getMaxAttempts(); number++) {
            last = attempt.apply(number);
            chain.add(StepAttempt.of(number, last));

            if (last.getStatus() != ExecutionStatus.FAILURE) {
                break;
            }
            if (last.getFailureInfo() != null && !last.getFailureInfo().isRetryable()) {
                log.info("失败不可重试: step={}, reason={}", last.getId(), last.getFailureInfo().getErrorType());
                break;
            }
            Duration delay = policy.nextDelay(number);
            if (delay == null || token.isCancelled()) {
                break;
            }
            log.warn("步骤失败，准备第 {}/{} 次重试: step={}, delay={}",
                    number, policy.getMaxRetries(), last.getId(), delay);
            if (!awaitBackoff(token, delay)) {
                break;
            }
        }
        last.setAttempts(chain);
        if (chain.size() > 1) {
            log.info("步骤重试结束: step={}, attempts={}, status={}", last.getId(), chain.size(), last.getStatus());
        }
        return last;
    }

    private boolean awaitBackoff(CancellationToken token, Duration delay) {
        try {
            return token.sleepUnlessCancelled(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
