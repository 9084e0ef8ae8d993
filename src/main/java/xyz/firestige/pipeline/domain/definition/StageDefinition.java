package xyz.firestige.pipeline.domain.definition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Stage 定义：顺序步骤列表 或 并行分组（嵌套 Stage），二者互斥
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"name", "when", "lock", "lockTimeout", "bestEffort", "steps", "parallel", "post"})
public final class StageDefinition {

    private final String name;
    private final List<StepDefinition> steps;
    private final List<StageDefinition> parallel;
    private final GuardCondition when;
    private final PostHooks post;
    private final String lock;
    private final Duration lockTimeout;
    private final boolean bestEffort;

    @JsonCreator
    public StageDefinition(
            @JsonProperty("name") String name,
            @JsonProperty("steps") List<StepDefinition> steps,
            @JsonProperty("parallel") List<StageDefinition> parallel,
            @JsonProperty("when") GuardCondition when,
            @JsonProperty("post") PostHooks post,
            @JsonProperty("lock") String lock,
            @JsonProperty("lockTimeout") Duration lockTimeout,
            @JsonProperty("bestEffort") Boolean bestEffort) {
        this.name = name;
        this.steps = steps == null ? List.of() : List.copyOf(steps);
        this.parallel = parallel == null ? List.of() : List.copyOf(parallel);
        this.when = when;
        this.post = post == null ? PostHooks.NONE : post;
        this.lock = lock;
        this.lockTimeout = lockTimeout;
        this.bestEffort = Boolean.TRUE.equals(bestEffort);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public List<StepDefinition> getSteps() {
        return steps;
    }

    public List<StageDefinition> getParallel() {
        return parallel;
    }

    public GuardCondition getWhen() {
        return when;
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

    public String getLock() {
        return lock;
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    public boolean isBestEffort() {
        return bestEffort;
    }

    @JsonIgnore
    public StageKind kind() {
        return parallel.isEmpty() ? StageKind.STEPS : StageKind.PARALLEL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StageDefinition that = (StageDefinition) o;
        return bestEffort == that.bestEffort
                && Objects.equals(name, that.name)
                && Objects.equals(steps, that.steps)
                && Objects.equals(parallel, that.parallel)
                && Objects.equals(when, that.when)
                && Objects.equals(post, that.post)
                && Objects.equals(lock, that.lock)
                && Objects.equals(lockTimeout, that.lockTimeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, steps, parallel, when, post, lock, lockTimeout, bestEffort);
    }

    @Override
    public String toString() {
        return "StageDefinition{name='" + name + "', kind=" + kind() + "}";
    }

    public static class Builder {
        private final String name;
        private final List<StepDefinition> steps = new ArrayList<>();
        private final List<StageDefinition> parallel = new ArrayList<>();
        private GuardCondition when;
        private PostHooks post;
        private String lock;
        private Duration lockTimeout;
        private boolean bestEffort;

        private Builder(String name) {
            this.name = name;
        }

        public Builder step(StepDefinition step) {
            this.steps.add(step);
            return this;
        }

        public Builder branch(StageDefinition branch) {
            this.parallel.add(branch);
            return this;
        }

        public Builder when(GuardCondition when) {
            this.when = when;
            return this;
        }

        public Builder post(PostHooks post) {
            this.post = post;
            return this;
        }

        public Builder lock(String lock) {
            this.lock = lock;
            return this;
        }

        public Builder lockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
            return this;
        }

        public Builder bestEffort(boolean bestEffort) {
            this.bestEffort = bestEffort;
            return this;
        }

        public StageDefinition build() {
            return new StageDefinition(name, steps, parallel, when, post, lock, lockTimeout, bestEffort);
        }
    }
}
