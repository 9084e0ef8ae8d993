package xyz.firestige.pipeline.domain.definition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 流水线定义（聚合根）
 * <p>
 * 每次运行解析一次，加载后不可变。名称即流水线身份，用于运行互斥和归档目录。
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"name", "description", "parameters", "options", "environment", "stages", "post"})
public final class PipelineDefinition {

    private final String name;
    private final String description;
    private final List<ParameterDefinition> parameters;
    private final PipelineOptions options;
    private final Map<String, String> environment;
    private final List<StageDefinition> stages;
    private final PostHooks post;

    @JsonCreator
    public PipelineDefinition(
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("parameters") List<ParameterDefinition> parameters,
            @JsonProperty("options") PipelineOptions options,
            @JsonProperty("environment") Map<String, String> environment,
            @JsonProperty("stages") List<StageDefinition> stages,
            @JsonProperty("post") PostHooks post) {
        this.name = name;
        this.description = description;
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.options = options == null ? PipelineOptions.DEFAULTS : options;
        this.environment = environment == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(environment));
        this.stages = stages == null ? List.of() : List.copyOf(stages);
        this.post = post == null ? PostHooks.NONE : post;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<ParameterDefinition> getParameters() {
        return parameters;
    }

    @JsonIgnore
    public PipelineOptions getOptions() {
        return options;
    }

    @JsonProperty("options")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    PipelineOptions getOptionsForSerialization() {
        return PipelineOptions.DEFAULTS.equals(options) ? null : options;
    }

    public Map<String, String> getEnvironment() {
        return environment;
    }

    public List<StageDefinition> getStages() {
        return stages;
    }

    @JsonIgnore
    public PostHooks getPost() {
        return post;
    }

    @JsonProperty("post")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    PostHooks getPostForSerialization() {
        return post.isEmpty() ? null : post;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PipelineDefinition that = (PipelineDefinition) o;
        return Objects.equals(name, that.name)
                && Objects.equals(description, that.description)
                && Objects.equals(parameters, that.parameters)
                && Objects.equals(options, that.options)
                && Objects.equals(environment, that.environment)
                && Objects.equals(stages, that.stages)
                && Objects.equals(post, that.post);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, parameters, options, environment, stages, post);
    }

    @Override
    public String toString() {
        return "PipelineDefinition{name='" + name + "', stages=" + stages.size() + "}";
    }

    public static class Builder {
        private final String name;
        private String description;
        private final List<ParameterDefinition> parameters = new ArrayList<>();
        private PipelineOptions options;
        private final Map<String, String> environment = new LinkedHashMap<>();
        private final List<StageDefinition> stages = new ArrayList<>();
        private PostHooks post;

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder parameter(ParameterDefinition parameter) {
            this.parameters.add(parameter);
            return this;
        }

        public Builder options(PipelineOptions options) {
            this.options = options;
            return this;
        }

        public Builder env(String key, String value) {
            this.environment.put(key, value);
            return this;
        }

        public Builder stage(StageDefinition stage) {
            this.stages.add(stage);
            return this;
        }

        public Builder post(PostHooks post) {
            this.post = post;
            return this;
        }

        public PipelineDefinition build() {
            return new PipelineDefinition(name, description, parameters, options, environment, stages, post);
        }
    }
}
