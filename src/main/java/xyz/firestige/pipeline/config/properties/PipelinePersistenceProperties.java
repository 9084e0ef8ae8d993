package xyz.firestige.pipeline.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 锁存储配置
 * <pre>
 * pipeline:
 *   persistence:
 *     store-type: redis   # redis 或 memory，默认 memory
 *     namespace: pipeline # Redis Key 前缀
 *     lock-ttl: 5m        # 锁 TTL，运行期间按 TTL/3 续期
 * </pre>
 */
@ConfigurationProperties(prefix = "pipeline.persistence")
public class PipelinePersistenceProperties {

    private StoreType storeType = StoreType.MEMORY;
    private String namespace = "pipeline";
    private Duration lockTtl = Duration.ofMinutes(5);

    public enum StoreType {
        MEMORY,
        REDIS
    }

    public StoreType getStoreType() { return storeType; }
    public void setStoreType(StoreType storeType) { this.storeType = storeType; }

    public String getNamespace() { return namespace; }
    public void setNamespace(String namespace) { this.namespace = namespace; }

    public Duration getLockTtl() { return lockTtl; }
    public void setLockTtl(Duration lockTtl) { this.lockTtl = lockTtl; }
}
