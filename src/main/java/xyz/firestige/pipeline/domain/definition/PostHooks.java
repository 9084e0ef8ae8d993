package xyz.firestige.pipeline.domain.definition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 后置钩子：按结果分类的步骤列表
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"always", "success", "unstable", "failure", "aborted"})
public final class PostHooks {

    public static final PostHooks NONE = new PostHooks(null, null, null, null, null);

    private final Map<HookKind, List<StepDefinition>> hooks = new EnumMap<>(HookKind.class);

    @JsonCreator
    public PostHooks(
            @JsonProperty("always") List<StepDefinition> always,
            @JsonProperty("success") List<StepDefinition> success,
            @JsonProperty("unstable") List<StepDefinition> unstable,
            @JsonProperty("failure") List<StepDefinition> failure,
            @JsonProperty("aborted") List<StepDefinition> aborted) {
        hooks.put(HookKind.ALWAYS, copy(always));
        hooks.put(HookKind.SUCCESS, copy(success));
        hooks.put(HookKind.UNSTABLE, copy(unstable));
        hooks.put(HookKind.FAILURE, copy(failure));
        hooks.put(HookKind.ABORTED, copy(aborted));
    }

    private static List<StepDefinition> copy(List<StepDefinition> steps) {
        return steps == null ? List.of() : List.copyOf(steps);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<StepDefinition> get(HookKind kind) {
        return hooks.get(kind);
    }

    public List<StepDefinition> getAlways() {
        return hooks.get(HookKind.ALWAYS);
    }

    public List<StepDefinition> getSuccess() {
        return hooks.get(HookKind.SUCCESS);
    }

    public List<StepDefinition> getUnstable() {
        return hooks.get(HookKind.UNSTABLE);
    }

    public List<StepDefinition> getFailure() {
        return hooks.get(HookKind.FAILURE);
    }

    public List<StepDefinition> getAborted() {
        return hooks.get(HookKind.ABORTED);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return hooks.values().stream().allMatch(List::isEmpty);
    }

    /**
     * 所有钩子步骤（用于校验）
     */
    @JsonIgnore
    public List<StepDefinition> allSteps() {
        List<StepDefinition> all = new ArrayList<>();
        hooks.values().forEach(all::addAll);
        return all;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return hooks.equals(((PostHooks) o).hooks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hooks);
    }

    public static class Builder {
        private final Map<HookKind, List<StepDefinition>> hooks = new EnumMap<>(HookKind.class);

        public Builder on(HookKind kind, StepDefinition... steps) {
            hooks.computeIfAbsent(kind, k -> new ArrayList<>()).addAll(List.of(steps));
            return this;
        }

        public PostHooks build() {
            return new PostHooks(
                    hooks.get(HookKind.ALWAYS),
                    hooks.get(HookKind.SUCCESS),
                    hooks.get(HookKind.UNSTABLE),
                    hooks.get(HookKind.FAILURE),
                    hooks.get(HookKind.ABORTED));
        }
    }
}
