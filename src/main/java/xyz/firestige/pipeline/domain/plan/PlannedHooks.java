package xyz.firestige.pipeline.domain.plan;

import xyz.firestige.pipeline.domain.definition.HookKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 已解析的后置钩子
 */
public final class PlannedHooks {

    public static final PlannedHooks NONE = new PlannedHooks(new EnumMap<>(HookKind.class));

    private final Map<HookKind, List<PlannedStep>> hooks;

    public PlannedHooks(Map<HookKind, List<PlannedStep>> hooks) {
        EnumMap<HookKind, List<PlannedStep>> copy = new EnumMap<>(HookKind.class);
        hooks.forEach((kind, steps) -> copy.put(kind, List.copyOf(steps)));
        this.hooks = Collections.unmodifiableMap(copy);
    }

    public List<PlannedStep> get(HookKind kind) {
        return hooks.getOrDefault(kind, List.of());
    }

    public boolean isEmpty() {
        return hooks.values().stream().allMatch(List::isEmpty);
    }
}
