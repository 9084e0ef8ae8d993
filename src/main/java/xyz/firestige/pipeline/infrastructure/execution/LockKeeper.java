package xyz.firestige.pipeline.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.infrastructure.lock.ResourceLockManager;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 锁续期调度器：运行期间定期为持有的锁续期，防止长 Stage 超过 TTL 后锁被他人抢占
 */
public class LockKeeper {

    private static final Logger log = LoggerFactory.getLogger(LockKeeper.class);

    private final ResourceLockManager lockManager;
    private final ScheduledExecutorService scheduler;
    private final Duration ttl;
    private final Map<String, String> held = new ConcurrentHashMap<>();
    private ScheduledFuture<?> future;
    private volatile boolean started;

    public LockKeeper(ResourceLockManager lockManager, ScheduledExecutorService scheduler, Duration ttl) {
        this.lockManager = lockManager;
        this.scheduler = scheduler;
        this.ttl = ttl;
    }

    public synchronized void start() {
        if (started) return;
        started = true;
        long interval = Math.max(1L, ttl.toMillis() / 3);
        future = scheduler.scheduleAtFixedRate(this::renewAll, interval, interval, TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        started = false;
        if (future != null) future.cancel(false);
    }

    public void hold(String name, String owner) {
        held.put(name, owner);
    }

    public void drop(String name) {
        held.remove(name);
    }

    /**
     * 释放仍登记为持有的全部锁
     */
    public void releaseAll() {
        held.forEach((name, owner) -> {
            if (lockManager.release(name, owner)) {
                log.info("释放遗留锁: {}", name);
            }
        });
        held.clear();
    }

    public boolean isHolding(String name) {
        return held.containsKey(name);
    }

    private void renewAll() {
        held.forEach((name, owner) -> {
            try {
                if (!lockManager.renew(name, owner, ttl)) {
                    log.warn("锁续期失败（可能已过期）: {}", name);
                }
            } catch (RuntimeException e) {
                log.warn("锁续期异常: {}", name, e);
            }
        });
    }
}
