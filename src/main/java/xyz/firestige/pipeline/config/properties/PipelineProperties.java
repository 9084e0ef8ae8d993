package xyz.firestige.pipeline.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 流水线引擎配置
 * <p>
 * 配置示例（application.yml）：
 * <pre>
 * pipeline:
 *   workspace-root: ./work/workspace
 *   archive-root: ./work/runs
 *   default-step-timeout: 1h
 *   concurrency-limit: 4
 *   retention: 10
 *   secret-source: properties   # properties 或 environment
 *   credentials:
 *     deploy-token:
 *       secret: s3cr3t
 * </pre>
 * 定义中的 options 优先于这里的默认值。
 */
@Validated
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    @NotNull
    private Path workspaceRoot = Path.of("work", "workspace");

    @NotNull
    private Path archiveRoot = Path.of("work", "runs");

    /**
     * 默认流水线定义文件（CLI 未指定 --definition 时使用）
     */
    private String definitionLocation;

    @NotEmpty
    private List<String> shell = new ArrayList<>(List.of("/bin/sh", "-c"));

    @NotNull
    private Duration pollInterval = Duration.ofMillis(50);

    /**
     * 取消后等待进程自行退出的时间，超时强制杀死
     */
    @NotNull
    private Duration killGracePeriod = Duration.ofSeconds(5);

    @NotNull
    private Duration lockPollInterval = Duration.ofMillis(200);

    @NotNull
    private Duration defaultStepTimeout = Duration.ofHours(1);

    @Min(1)
    private int concurrencyLimit = 4;

    @Min(1)
    private int retention = 10;

    @NotNull
    private SecretSource secretSource = SecretSource.PROPERTIES;

    @Valid
    private Map<String, Credential> credentials = new LinkedHashMap<>();

    public enum SecretSource {
        /**
         * 取自 {@code pipeline.credentials}
         */
        PROPERTIES,
        /**
         * 取自进程环境变量 {@code CRED_<ID>}
         */
        ENVIRONMENT
    }

    public static class Credential {
        private String username;

        @NotNull
        private String secret;

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getSecret() { return secret; }
        public void setSecret(String secret) { this.secret = secret; }
    }

    public Path getWorkspaceRoot() { return workspaceRoot; }
    public void setWorkspaceRoot(Path workspaceRoot) { this.workspaceRoot = workspaceRoot; }

    public Path getArchiveRoot() { return archiveRoot; }
    public void setArchiveRoot(Path archiveRoot) { this.archiveRoot = archiveRoot; }

    public String getDefinitionLocation() { return definitionLocation; }
    public void setDefinitionLocation(String definitionLocation) { this.definitionLocation = definitionLocation; }

    public List<String> getShell() { return shell; }
    public void setShell(List<String> shell) { this.shell = shell; }

    public Duration getPollInterval() { return pollInterval; }
    public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }

    public Duration getKillGracePeriod() { return killGracePeriod; }
    public void setKillGracePeriod(Duration killGracePeriod) { this.killGracePeriod = killGracePeriod; }

    public Duration getLockPollInterval() { return lockPollInterval; }
    public void setLockPollInterval(Duration lockPollInterval) { this.lockPollInterval = lockPollInterval; }

    public Duration getDefaultStepTimeout() { return defaultStepTimeout; }
    public void setDefaultStepTimeout(Duration defaultStepTimeout) { this.defaultStepTimeout = defaultStepTimeout; }

    public int getConcurrencyLimit() { return concurrencyLimit; }
    public void setConcurrencyLimit(int concurrencyLimit) { this.concurrencyLimit = concurrencyLimit; }

    public int getRetention() { return retention; }
    public void setRetention(int retention) { this.retention = retention; }

    public SecretSource getSecretSource() { return secretSource; }
    public void setSecretSource(SecretSource secretSource) { this.secretSource = secretSource; }

    public Map<String, Credential> getCredentials() { return credentials; }
    public void setCredentials(Map<String, Credential> credentials) { this.credentials = credentials; }
}
