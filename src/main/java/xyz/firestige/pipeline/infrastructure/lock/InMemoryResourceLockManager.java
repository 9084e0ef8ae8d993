package xyz.firestige.pipeline.infrastructure.lock;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 内存锁实现（单进程，默认后备）
 * <p>
 * 进程内有效，忽略 TTL。
 */
public class InMemoryResourceLockManager implements ResourceLockManager {

    private final ConcurrentMap<String, String> locks = new ConcurrentHashMap<>();

    @Override
    public boolean tryAcquire(String name, String owner, Duration ttl) {
        if (name == null || owner == null) {
            return false;
        }
        String existing = locks.putIfAbsent(name, owner);
        return existing == null || existing.equals(owner);
    }

    @Override
    public boolean release(String name, String owner) {
        if (name == null || owner == null) {
            return false;
        }
        return locks.remove(name, owner);
    }

    @Override
    public boolean renew(String name, String owner, Duration ttl) {
        return owner != null && owner.equals(locks.get(name));
    }

    @Override
    public boolean isLocked(String name) {
        return name != null && locks.containsKey(name);
    }

    public String getOwner(String name) {
        return locks.get(name);
    }
}
