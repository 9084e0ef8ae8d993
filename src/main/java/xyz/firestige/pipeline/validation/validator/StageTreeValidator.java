package xyz.firestige.pipeline.validation.validator;

import xyz.firestige.pipeline.domain.definition.PipelineDefinition;
import xyz.firestige.pipeline.domain.definition.StageDefinition;
import xyz.firestige.pipeline.domain.definition.StepDefinition;
import xyz.firestige.pipeline.domain.shared.DurationLimits;
import xyz.firestige.pipeline.validation.DefinitionValidator;
import xyz.firestige.pipeline.validation.StageTreeWalker;
import xyz.firestige.pipeline.validation.ValidationError;
import xyz.firestige.pipeline.validation.ValidationResult;
import xyz.firestige.pipeline.validation.ValidationWarning;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Stage 树结构校验器
 * <p>
 * 检查流水线名称、Stage 名称全局唯一（每个重复名称单独报告）、
 * steps / parallel 互斥且非空、同一个 Stage 实例不能出现在树中多处、锁声明。
 * <p>
 * 锁按 Stage 持有，子 Stage 与祖先声明同名锁会等待自己，因此禁止；
 * {@code run:} 前缀保留给运行互斥锁。
 */
public class StageTreeValidator implements DefinitionValidator {

    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    static final String RESERVED_LOCK_PREFIX = "run:";

    @Override
    public ValidationResult validate(PipelineDefinition definition) {
        ValidationResult result = new ValidationResult();

        validatePipelineName(definition.getName(), result);

        if (definition.getStages().isEmpty()) {
            result.addError(ValidationError.of("stages", "流水线至少需要一个 Stage",
                    ValidationError.INVALID_STAGE_SHAPE));
            return result;
        }

        Map<String, List<String>> pathsByName = new LinkedHashMap<>();
        Map<StageDefinition, String> seen = new IdentityHashMap<>();
        Map<String, String> locksByPath = new HashMap<>();

        StageTreeWalker.walk(definition.getStages(), (path, stage) -> {
            String field = StageTreeWalker.field(path);

            String previous = seen.putIfAbsent(stage, path);
            if (previous != null) {
                result.addError(ValidationError.of(field,
                        "同一个 Stage 定义同时出现在 " + previous + " 与 " + path + "，Stage 图必须是树",
                        ValidationError.SHARED_STAGE_REFERENCE, stage.getName()));
            }

            if (stage.getName() == null || stage.getName().isBlank()) {
                result.addError(ValidationError.of(field, "Stage 名称不能为空", ValidationError.MISSING_NAME));
            } else {
                if (stage.getName().contains(StageTreeWalker.PATH_SEPARATOR)) {
                    result.addError(ValidationError.of(field, "Stage 名称不能包含 '/'",
                            ValidationError.INVALID_NAME, stage.getName()));
                }
                pathsByName.computeIfAbsent(stage.getName(), k -> new ArrayList<>()).add(path);
            }

            validateShape(field, stage, result);
            validateStepNames(field, stage, result);
            validateLock(field, stage, result);
            validateNestedLock(path, field, stage, locksByPath, result);
        });

        pathsByName.forEach((name, paths) -> {
            if (paths.size() > 1) {
                result.addError(ValidationError.of("stage[" + name + "]",
                        "Stage 名称重复 " + paths.size() + " 次: " + paths,
                        ValidationError.DUPLICATE_STAGE_NAME, name));
            }
        });

        return result;
    }

    private void validatePipelineName(String name, ValidationResult result) {
        if (name == null || name.isBlank()) {
            result.addError(ValidationError.of("name", "流水线名称不能为空", ValidationError.MISSING_NAME));
        } else if (!NAME_PATTERN.matcher(name).matches()) {
            result.addError(ValidationError.of("name",
                    "流水线名称只能包含字母、数字、'.'、'_'、'-'", ValidationError.INVALID_NAME, name));
        }
    }

    private void validateShape(String field, StageDefinition stage, ValidationResult result) {
        boolean hasSteps = !stage.getSteps().isEmpty();
        boolean hasParallel = !stage.getParallel().isEmpty();
        if (hasSteps && hasParallel) {
            result.addError(ValidationError.of(field, "steps 与 parallel 只能二选一",
                    ValidationError.INVALID_STAGE_SHAPE));
        } else if (!hasSteps && !hasParallel) {
            result.addError(ValidationError.of(field, "Stage 必须包含 steps 或 parallel",
                    ValidationError.INVALID_STAGE_SHAPE));
        }
    }

    private void validateStepNames(String field, StageDefinition stage, ValidationResult result) {
        Set<String> names = new HashSet<>();
        for (StepDefinition step : stage.getSteps()) {
            if (step.getName() == null || step.getName().isBlank()) {
                result.addError(ValidationError.of(field + ".step", "步骤名称不能为空", ValidationError.MISSING_NAME));
            } else if (!names.add(step.getName())) {
                result.addError(ValidationError.of(field + ".step[" + step.getName() + "]",
                        "同一 Stage 内步骤名称重复", ValidationError.DUPLICATE_STEP_NAME, step.getName()));
            }
        }
    }

    private void validateLock(String field, StageDefinition stage, ValidationResult result) {
        if (stage.getLock() != null && stage.getLock().isBlank()) {
            result.addError(ValidationError.of(field + ".lock", "锁名称不能为空字符串", ValidationError.INVALID_NAME));
        } else if (stage.getLock() != null && stage.getLock().startsWith(RESERVED_LOCK_PREFIX)) {
            result.addError(ValidationError.of(field + ".lock", "锁名称不能以 '" + RESERVED_LOCK_PREFIX + "' 开头",
                    ValidationError.INVALID_NAME, stage.getLock()));
        }
        if (stage.getLockTimeout() != null) {
            if (stage.getLockTimeout().isNegative() || stage.getLockTimeout().isZero()) {
                result.addError(ValidationError.of(field + ".lockTimeout", "锁等待超时必须为正数",
                        ValidationError.INVALID_DURATION, stage.getLockTimeout()));
            } else if (!DurationLimits.isRepresentable(stage.getLockTimeout())) {
                result.addError(ValidationError.of(field + ".lockTimeout", "锁等待超时超出可表示范围（最长约 292 年）",
                        ValidationError.INVALID_DURATION, stage.getLockTimeout()));
            }
            if (stage.getLock() == null) {
                result.addWarning(ValidationWarning.of(field + ".lockTimeout", "未声明 lock，lockTimeout 不生效"));
            }
        }
    }

    /**
     * 先序遍历保证祖先先登记，逐级向上查找同名锁
     */
    private void validateNestedLock(String path, String field, StageDefinition stage,
                                    Map<String, String> locksByPath, ValidationResult result) {
        String lock = stage.getLock();
        if (lock == null || lock.isBlank()) {
            return;
        }
        locksByPath.put(path, lock);
        String ancestor = path;
        int cut;
        while ((cut = ancestor.lastIndexOf(StageTreeWalker.PATH_SEPARATOR)) > 0) {
            ancestor = ancestor.substring(0, cut);
            if (lock.equals(locksByPath.get(ancestor))) {
                result.addError(ValidationError.of(field + ".lock",
                        "锁 " + lock + " 已由祖先 Stage " + ancestor + " 持有，嵌套持有同名锁会自我等待",
                        ValidationError.NESTED_LOCK_CONFLICT, lock));
                return;
            }
        }
    }

    @Override
    public String getValidatorName() {
        return "StageTreeValidator";
    }

    @Override
    public int getOrder() {
        return 10;
    }
}
