package xyz.firestige.pipeline.domain.definition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Duration;
import java.util.Objects;

/**
 * 流水线全局选项
 * <p>
 * 未给出的值为 null，由解析器结合 {@code pipeline.*} 配置补默认值。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"concurrencyLimit", "retention", "timeout", "defaultStepTimeout", "disableConcurrentBuilds"})
public final class PipelineOptions {

    public static final PipelineOptions DEFAULTS = new PipelineOptions(null, null, null, null, null);

    private final Integer concurrencyLimit;
    private final Integer retention;
    private final Duration timeout;
    private final Duration defaultStepTimeout;
    private final Boolean disableConcurrentBuilds;

    @JsonCreator
    public PipelineOptions(
            @JsonProperty("concurrencyLimit") Integer concurrencyLimit,
            @JsonProperty("retention") Integer retention,
            @JsonProperty("timeout") Duration timeout,
            @JsonProperty("defaultStepTimeout") Duration defaultStepTimeout,
            @JsonProperty("disableConcurrentBuilds") Boolean disableConcurrentBuilds) {
        this.concurrencyLimit = concurrencyLimit;
        this.retention = retention;
        this.timeout = timeout;
        this.defaultStepTimeout = defaultStepTimeout;
        this.disableConcurrentBuilds = disableConcurrentBuilds;
    }

    public Integer getConcurrencyLimit() {
        return concurrencyLimit;
    }

    public Integer getRetention() {
        return retention;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Duration getDefaultStepTimeout() {
        return defaultStepTimeout;
    }

    public Boolean getDisableConcurrentBuilds() {
        return disableConcurrentBuilds;
    }

    /**
     * 未显式关闭时默认拒绝同一流水线并发运行
     */
    public boolean concurrentBuildsDisabled() {
        return !Boolean.FALSE.equals(disableConcurrentBuilds);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PipelineOptions that = (PipelineOptions) o;
        return Objects.equals(concurrencyLimit, that.concurrencyLimit)
                && Objects.equals(retention, that.retention)
                && Objects.equals(timeout, that.timeout)
                && Objects.equals(defaultStepTimeout, that.defaultStepTimeout)
                && Objects.equals(disableConcurrentBuilds, that.disableConcurrentBuilds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(concurrencyLimit, retention, timeout, defaultStepTimeout, disableConcurrentBuilds);
    }

    @Override
    public String toString() {
        return "PipelineOptions{concurrencyLimit=" + concurrencyLimit + ", retention=" + retention
                + ", timeout=" + timeout + ", defaultStepTimeout=" + defaultStepTimeout
                + ", disableConcurrentBuilds=" + disableConcurrentBuilds + "}";
    }
}
