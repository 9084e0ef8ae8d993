package xyz.firestige.pipeline.infrastructure.lock.redis;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * RedisResourceLockManager 单元测试（mock RedisTemplate）
 */
@DisplayName("RedisResourceLockManager 单元测试")
class RedisResourceLockManagerTest {

    private static final Duration TTL = Duration.ofSeconds(30);

    private RedisTemplate<String, String> redisTemplate;
    private ValueOperations<String, String> valueOperations;
    private RedisResourceLockManager manager;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(RedisTemplate.class);
        valueOperations = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        manager = new RedisResourceLockManager(redisTemplate, "pipeline");
    }

    @Test
    @DisplayName("键带命名空间前缀")
    void keyIsNamespaced() {
        assertThat(manager.key("run:web-app")).isEqualTo("pipeline:lock:run:web-app");
    }

    @Test
    @DisplayName("SET NX 成功即获取锁")
    void acquireWithSetIfAbsent() {
        when(valueOperations.setIfAbsent("pipeline:lock:prod-env", "owner-1", TTL)).thenReturn(true);

        assertThat(manager.tryAcquire("prod-env", "owner-1", TTL)).isTrue();
        verify(valueOperations, never()).get(any());
    }

    @Test
    @DisplayName("锁已存在时，只有持有者本人可重入")
    void existingLockIsReentrantForOwnerOnly() {
        when(valueOperations.setIfAbsent(eq("pipeline:lock:prod-env"), any(), eq(TTL))).thenReturn(false);
        when(valueOperations.get("pipeline:lock:prod-env")).thenReturn("owner-1");

        assertThat(manager.tryAcquire("prod-env", "owner-1", TTL)).isTrue();
        assertThat(manager.tryAcquire("prod-env", "owner-2", TTL)).isFalse();
    }

    @Test
    @DisplayName("释放与续期通过脚本比较持有者")
    @SuppressWarnings("unchecked")
    void releaseAndRenewUseScripts() {
        when(redisTemplate.execute(any(RedisScript.class), eq(List.of("pipeline:lock:prod-env")), eq("owner-1")))
                .thenReturn(1L);
        when(redisTemplate.execute(any(RedisScript.class), eq(List.of("pipeline:lock:prod-env")),
                eq("owner-1"), eq("30000"))).thenReturn(1L);

        assertThat(manager.release("prod-env", "owner-1")).isTrue();
        assertThat(manager.renew("prod-env", "owner-1", TTL)).isTrue();
    }

    @Test
    @DisplayName("脚本返回 0 表示不是持有者")
    @SuppressWarnings("unchecked")
    void foreignOwnerCannotRelease() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any())).thenReturn(0L);

        assertThat(manager.release("prod-env", "intruder")).isFalse();
    }

    @Test
    @DisplayName("参数为空时直接返回 false，不访问 Redis")
    void nullArgumentsShortCircuit() {
        assertThat(manager.tryAcquire(null, "o", TTL)).isFalse();
        assertThat(manager.release("x", null)).isFalse();
        assertThat(manager.isLocked(null)).isFalse();
        verify(valueOperations, never()).setIfAbsent(any(), any(), any(Duration.class));
    }

    @Test
    void isLockedChecksKey() {
        when(redisTemplate.hasKey("pipeline:lock:prod-env")).thenReturn(true);

        assertThat(manager.isLocked("prod-env")).isTrue();
        assertThat(manager.isLocked("other")).isFalse();
    }
}
