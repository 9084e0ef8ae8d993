package xyz.firestige.pipeline.domain.run;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 协作式取消令牌
 * <p>
 * 第一次 cancel 生效，之后的调用被忽略。子令牌随父令牌一起取消，
 * 但子令牌单独取消（步骤超时）不影响父令牌。
 */
public class CancellationToken {

    private final AtomicReference<CancelReason> reason = new AtomicReference<>();
    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<CancellationToken> children = new CopyOnWriteArrayList<>();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * @return true 表示本次调用触发了取消
     */
    public boolean cancel(CancelReason cancelReason) {
        if (!reason.compareAndSet(null, cancelReason)) {
            return false;
        }
        latch.countDown();
        children.forEach(child -> child.cancel(cancelReason));
        return true;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public CancelReason getReason() {
        return reason.get();
    }

    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        children.add(child);
        CancelReason current = reason.get();
        if (current != null) {
            child.cancel(current);
        }
        return child;
    }

    /**
     * 解除子令牌关联，避免长运行中累积
     */
    public void detach(CancellationToken child) {
        children.remove(child);
    }

    /**
     * 等待指定时长，期间被取消则提前返回
     *
     * @return true 表示完整等待了 duration；false 表示被取消
     */
    public boolean sleepUnlessCancelled(Duration duration) throws InterruptedException {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return !isCancelled();
        }
        return !latch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }
}
