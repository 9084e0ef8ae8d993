package xyz.firestige.pipeline.application.plan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.domain.definition.GuardCondition;
import xyz.firestige.pipeline.domain.definition.HookKind;
import xyz.firestige.pipeline.domain.definition.ParameterDefinition;
import xyz.firestige.pipeline.domain.definition.PipelineDefinition;
import xyz.firestige.pipeline.domain.definition.PipelineOptions;
import xyz.firestige.pipeline.domain.definition.PostHooks;
import xyz.firestige.pipeline.domain.definition.StageDefinition;
import xyz.firestige.pipeline.domain.definition.StepDefinition;
import xyz.firestige.pipeline.domain.plan.ExecutionPlan;
import xyz.firestige.pipeline.domain.plan.PlannedHooks;
import xyz.firestige.pipeline.domain.plan.PlannedStage;
import xyz.firestige.pipeline.domain.plan.PlannedStep;
import xyz.firestige.pipeline.validation.PipelineValidationException;
import xyz.firestige.pipeline.validation.StageTreeWalker;
import xyz.firestige.pipeline.validation.ValidationChain;
import xyz.firestige.pipeline.validation.ValidationError;
import xyz.firestige.pipeline.validation.ValidationResult;
import xyz.firestige.pipeline.validation.ValidationWarning;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Stage 图解析器
 * <p>
 * 职责：
 * 1. 通过校验链收集定义中的全部问题，连同缺失的必填参数一次性抛出
 * 2. 合并参数默认值
 * 3. 对守卫求值，生成不可变的 {@link ExecutionPlan}
 */
public class StageGraphResolver {

    private static final Logger log = LoggerFactory.getLogger(StageGraphResolver.class);

    private final ValidationChain validationChain;
    private final PlanDefaults defaults;

    public StageGraphResolver(ValidationChain validationChain, PlanDefaults defaults) {
        this.validationChain = validationChain;
        this.defaults = defaults;
    }

    /**
     * @throws PipelineValidationException 定义或参数存在问题（包含全部错误）
     */
    public ExecutionPlan resolve(PipelineDefinition definition, Map<String, String> parameters) {
        Map<String, String> supplied = parameters != null ? parameters : Map.of();

        ValidationResult result = validationChain.validate(definition);
        result.merge(validateParameters(definition, supplied));

        for (ValidationWarning warning : result.getWarnings()) {
            log.warn("流水线定义警告 [{}]: {}", definition.getName(), warning);
        }
        if (result.hasErrors()) {
            log.error("流水线定义校验失败 [{}]: {} 个错误", definition.getName(), result.getErrors().size());
        }
        result.throwIfInvalid();

        Map<String, String> effective = new LinkedHashMap<>();
        for (ParameterDefinition parameter : definition.getParameters()) {
            if (parameter.getDefaultValue() != null) {
                effective.put(parameter.getName(), parameter.getDefaultValue());
            }
        }
        effective.putAll(supplied);

        PipelineOptions options = definition.getOptions();
        Duration stepTimeout = options.getDefaultStepTimeout() != null
                ? options.getDefaultStepTimeout()
                : defaults.stepTimeout();

        List<PlannedStage> stages = planStages(null, definition.getStages(), effective, true, stepTimeout);
        PlannedHooks hooks = planHooks("post", definition.getPost(), stepTimeout);

        ExecutionPlan plan = new ExecutionPlan(
                definition,
                effective,
                stages,
                hooks,
                options.getConcurrencyLimit() != null ? options.getConcurrencyLimit() : defaults.concurrencyLimit(),
                options.getRetention() != null ? options.getRetention() : defaults.retention(),
                options.getTimeout(),
                options.concurrentBuildsDisabled());
        log.debug("执行计划已生成: pipeline={}, stages={}, parameters={}",
                definition.getName(), stages.size(), effective.keySet());
        return plan;
    }

    private ValidationResult validateParameters(PipelineDefinition definition, Map<String, String> supplied) {
        ValidationResult result = new ValidationResult();
        for (ParameterDefinition parameter : definition.getParameters()) {
            if (parameter.isRequired() && !supplied.containsKey(parameter.getName())) {
                result.addError(ValidationError.of("parameters[" + parameter.getName() + "]",
                        "缺少必填参数", ValidationError.MISSING_PARAMETER, parameter.getName()));
            }
        }
        Set<String> declared = definition.getParameters().stream()
                .map(ParameterDefinition::getName)
                .collect(Collectors.toSet());
        supplied.keySet().stream()
                .filter(name -> !declared.contains(name))
                .forEach(name -> result.addWarning(ValidationWarning.of("parameters[" + name + "]", "参数未声明")));
        return result;
    }

    private List<PlannedStage> planStages(String parentPath, List<StageDefinition> definitions,
                                          Map<String, String> parameters, boolean parentEnabled,
                                          Duration stepTimeout) {
        List<PlannedStage> planned = new ArrayList<>();
        for (StageDefinition stage : definitions) {
            String path = StageTreeWalker.childPath(parentPath, stage.getName());
            GuardCondition when = stage.getWhen();
            boolean enabled = parentEnabled && (when == null || when.evaluate(parameters));
            if (parentEnabled && !enabled) {
                log.info("Stage 守卫不满足，将跳过: {} ({})", path, when);
            }

            List<PlannedStep> steps = new ArrayList<>();
            for (StepDefinition step : stage.getSteps()) {
                steps.add(planStep(path, step, stepTimeout));
            }
            List<PlannedStage> branches = planStages(path, stage.getParallel(), parameters, enabled, stepTimeout);
            planned.add(new PlannedStage(path, stage, enabled, steps, branches,
                    planHooks(path + "/post", stage.getPost(), stepTimeout)));
        }
        return planned;
    }

    private PlannedHooks planHooks(String scopePath, PostHooks hooks, Duration stepTimeout) {
        if (hooks.isEmpty()) {
            return PlannedHooks.NONE;
        }
        Map<HookKind, List<PlannedStep>> planned = new EnumMap<>(HookKind.class);
        for (HookKind kind : HookKind.values()) {
            List<PlannedStep> steps = new ArrayList<>();
            for (StepDefinition step : hooks.get(kind)) {
                steps.add(planStep(scopePath + "/" + kind.name().toLowerCase(), step, stepTimeout));
            }
            planned.put(kind, steps);
        }
        return new PlannedHooks(planned);
    }

    private PlannedStep planStep(String parentPath, StepDefinition step, Duration stepTimeout) {
        Duration timeout = step.getTimeout() != null ? step.getTimeout() : stepTimeout;
        return new PlannedStep(parentPath + "/" + step.getName(), step, timeout);
    }
}
