package xyz.firestige.pipeline.domain.definition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 步骤定义
 * <p>
 * 动作描述二选一：{@code command}（shell 命令模板）或 {@code action}（内置动作 ID，
 * 参数放在 {@code with} 中）。构造时不做校验，结构问题统一由校验链报告。
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"name", "command", "action", "with", "dir", "credentials",
        "retry", "retryBackoff", "timeout", "unstableExitCodes"})
public final class StepDefinition {

    /**
     * shell 动作 ID，{@code command} 形式的步骤都由它执行
     */
    public static final String SHELL_ACTION = "sh";

    private final String name;
    private final String command;
    private final String action;
    private final Map<String, String> arguments;
    private final String dir;
    private final List<CredentialBinding> credentials;
    private final int retry;
    private final Duration retryBackoff;
    private final Duration timeout;
    private final List<Integer> unstableExitCodes;

    @JsonCreator
    public StepDefinition(
            @JsonProperty("name") String name,
            @JsonProperty("command") String command,
            @JsonProperty("action") String action,
            @JsonProperty("with") Map<String, String> arguments,
            @JsonProperty("dir") String dir,
            @JsonProperty("credentials") List<CredentialBinding> credentials,
            @JsonProperty("retry") Integer retry,
            @JsonProperty("retryBackoff") Duration retryBackoff,
            @JsonProperty("timeout") Duration timeout,
            @JsonProperty("unstableExitCodes") List<Integer> unstableExitCodes) {
        this.name = name;
        this.command = command;
        this.action = action;
        this.arguments = arguments == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        this.dir = dir;
        this.credentials = credentials == null ? List.of() : List.copyOf(credentials);
        this.retry = retry == null ? 0 : retry;
        this.retryBackoff = retryBackoff;
        this.timeout = timeout;
        this.unstableExitCodes = unstableExitCodes == null ? List.of() : List.copyOf(unstableExitCodes);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public String getCommand() {
        return command;
    }

    public String getAction() {
        return action;
    }

    @JsonProperty("with")
    public Map<String, String> getArguments() {
        return arguments;
    }

    public String getDir() {
        return dir;
    }

    public List<CredentialBinding> getCredentials() {
        return credentials;
    }

    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    public int getRetry() {
        return retry;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public List<Integer> getUnstableExitCodes() {
        return unstableExitCodes;
    }

    /**
     * 实际执行的动作 ID：command 形式固定走 shell
     */
    @JsonIgnore
    public String getEffectiveActionId() {
        return command != null ? SHELL_ACTION : action;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepDefinition that = (StepDefinition) o;
        return retry == that.retry
                && Objects.equals(name, that.name)
                && Objects.equals(command, that.command)
                && Objects.equals(action, that.action)
                && Objects.equals(arguments, that.arguments)
                && Objects.equals(dir, that.dir)
                && Objects.equals(credentials, that.credentials)
                && Objects.equals(retryBackoff, that.retryBackoff)
                && Objects.equals(timeout, that.timeout)
                && Objects.equals(unstableExitCodes, that.unstableExitCodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, command, action, arguments, dir, credentials,
                retry, retryBackoff, timeout, unstableExitCodes);
    }

    @Override
    public String toString() {
        return "StepDefinition{name='" + name + "', action='" + getEffectiveActionId() + "', retry=" + retry + "}";
    }

    public static class Builder {
        private final String name;
        private String command;
        private String action;
        private final Map<String, String> arguments = new LinkedHashMap<>();
        private String dir;
        private final List<CredentialBinding> credentials = new ArrayList<>();
        private int retry;
        private Duration retryBackoff;
        private Duration timeout;
        private final List<Integer> unstableExitCodes = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder command(String command) {
            this.command = command;
            return this;
        }

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder with(String key, String value) {
            this.arguments.put(key, value);
            return this;
        }

        public Builder dir(String dir) {
            this.dir = dir;
            return this;
        }

        public Builder credential(CredentialBinding binding) {
            this.credentials.add(binding);
            return this;
        }

        public Builder retry(int retry) {
            this.retry = retry;
            return this;
        }

        public Builder retryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder unstableExitCodes(Integer... codes) {
            this.unstableExitCodes.addAll(List.of(codes));
            return this;
        }

        public StepDefinition build() {
            return new StepDefinition(name, command, action, arguments, dir, credentials,
                    retry, retryBackoff, timeout, unstableExitCodes);
        }
    }
}
