package xyz.firestige.pipeline.infrastructure.execution.action;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.PipelineException;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 动作注册表
 */
public class ActionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActionRegistry.class);

    private final Map<String, StepAction> actions = new ConcurrentHashMap<>();

    public ActionRegistry() {
    }

    public ActionRegistry(Collection<? extends StepAction> actions) {
        actions.forEach(this::register);
    }

    public ActionRegistry register(StepAction action) {
        StepAction previous = actions.put(action.getActionId(), action);
        if (previous != null) {
            log.warn("动作被覆盖: {} ({} -> {})", action.getActionId(),
                    previous.getClass().getSimpleName(), action.getClass().getSimpleName());
        }
        return this;
    }

    public StepAction get(String actionId) {
        StepAction action = actions.get(actionId);
        if (action == null) {
            throw new PipelineException(ErrorType.VALIDATION_ERROR, "未知的动作: " + actionId);
        }
        return action;
    }

    public boolean contains(String actionId) {
        return actions.containsKey(actionId);
    }

    public Set<String> getActionIds() {
        return new TreeSet<>(actions.keySet());
    }
}
