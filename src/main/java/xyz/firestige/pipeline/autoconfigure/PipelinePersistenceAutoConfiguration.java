package xyz.firestige.pipeline.autoconfigure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import xyz.firestige.pipeline.config.properties.PipelinePersistenceProperties;
import xyz.firestige.pipeline.infrastructure.lock.InMemoryResourceLockManager;
import xyz.firestige.pipeline.infrastructure.lock.ResourceLockManager;
import xyz.firestige.pipeline.infrastructure.lock.redis.RedisResourceLockManager;

/**
 * 锁存储自动配置
 * <p>
 * {@code pipeline.persistence.store-type=redis} 时装配 Redis 分布式锁，多个引擎实例共享运行互斥与资源锁；
 * 否则回退到进程内实现（仅支持单实例）。
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration")
@EnableConfigurationProperties(PipelinePersistenceProperties.class)
public class PipelinePersistenceAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(PipelinePersistenceAutoConfiguration.class);

    @Bean(name = "pipelineLockRedisTemplate")
    @ConditionalOnClass(RedisConnectionFactory.class)
    @ConditionalOnMissingBean(name = "pipelineLockRedisTemplate")
    @ConditionalOnProperty(prefix = "pipeline.persistence", name = "store-type", havingValue = "redis")
    public RedisTemplate<String, String> pipelineLockRedisTemplate(RedisConnectionFactory factory) {
        logger.info("[AutoConfig] 创建 Redis Template for Pipeline Locks");
        StringRedisTemplate template = new StringRedisTemplate();
        template.setConnectionFactory(factory);
        template.afterPropertiesSet();
        return template;
    }

    /**
     * Redis 资源锁管理器（分布式锁）
     */
    @Bean
    @ConditionalOnClass(RedisTemplate.class)
    @ConditionalOnMissingBean(ResourceLockManager.class)
    @ConditionalOnProperty(prefix = "pipeline.persistence", name = "store-type", havingValue = "redis")
    public ResourceLockManager redisResourceLockManager(RedisTemplate<String, String> pipelineLockRedisTemplate,
                                                        PipelinePersistenceProperties properties) {
        logger.info("[AutoConfig] 装配 Redis 资源锁管理器（namespace={}）", properties.getNamespace());
        return new RedisResourceLockManager(pipelineLockRedisTemplate, properties.getNamespace());
    }

    /**
     * 内存资源锁管理器（Fallback，仅支持单实例）
     */
    @Bean
    @ConditionalOnMissingBean(ResourceLockManager.class)
    public ResourceLockManager inMemoryResourceLockManager() {
        logger.warn("[AutoConfig] 装配 InMemory 资源锁管理器（Fallback，仅支持单实例）");
        return new InMemoryResourceLockManager();
    }
}
