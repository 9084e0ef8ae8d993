package xyz.firestige.pipeline.infrastructure.lock.redis;

import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import xyz.firestige.pipeline.infrastructure.lock.ResourceLockManager;

import java.time.Duration;
import java.util.List;

/**
 * 资源锁 Redis 实现（分布式锁）
 * <p>
 * 使用 Redis SET NX 原子获取锁，TTL 自动释放防止崩溃后泄漏；
 * 释放与续期通过 Lua 脚本比较持有者后再执行。
 */
public class RedisResourceLockManager implements ResourceLockManager {

    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private static final RedisScript<Long> RENEW_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('pexpire', KEYS[1], ARGV[2]) else return 0 end",
            Long.class);

    private final RedisTemplate<String, String> redisTemplate;
    private final String keyPrefix;

    public RedisResourceLockManager(RedisTemplate<String, String> redisTemplate, String namespace) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = namespace + ":lock:";
    }

    @Override
    public boolean tryAcquire(String name, String owner, Duration ttl) {
        if (name == null || owner == null || ttl == null) {
            return false;
        }
        String key = key(name);
        Boolean success = redisTemplate.opsForValue().setIfAbsent(key, owner, ttl);
        if (Boolean.TRUE.equals(success)) {
            return true;
        }
        return owner.equals(redisTemplate.opsForValue().get(key));
    }

    @Override
    public boolean release(String name, String owner) {
        if (name == null || owner == null) {
            return false;
        }
        Long deleted = redisTemplate.execute(RELEASE_SCRIPT, List.of(key(name)), owner);
        return deleted != null && deleted > 0;
    }

    @Override
    public boolean renew(String name, String owner, Duration ttl) {
        if (name == null || owner == null || ttl == null) {
            return false;
        }
        Long renewed = redisTemplate.execute(RENEW_SCRIPT, List.of(key(name)), owner, String.valueOf(ttl.toMillis()));
        return renewed != null && renewed > 0;
    }

    @Override
    public boolean isLocked(String name) {
        if (name == null) {
            return false;
        }
        return Boolean.TRUE.equals(redisTemplate.hasKey(key(name)));
    }

    String key(String name) {
        return keyPrefix + name;
    }
}
