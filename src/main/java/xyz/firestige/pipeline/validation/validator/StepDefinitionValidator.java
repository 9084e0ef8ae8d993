package xyz.firestige.pipeline.validation.validator;

import xyz.firestige.pipeline.domain.definition.CredentialBinding;
import xyz.firestige.pipeline.domain.definition.CredentialType;
import xyz.firestige.pipeline.domain.definition.PipelineDefinition;
import xyz.firestige.pipeline.domain.definition.PostHooks;
import xyz.firestige.pipeline.domain.definition.StepDefinition;
import xyz.firestige.pipeline.domain.shared.DurationLimits;
import xyz.firestige.pipeline.validation.DefinitionValidator;
import xyz.firestige.pipeline.validation.StageTreeWalker;
import xyz.firestige.pipeline.validation.ValidationError;
import xyz.firestige.pipeline.validation.ValidationResult;
import xyz.firestige.pipeline.validation.ValidationWarning;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 步骤校验器：动作描述、重试次数、时长、凭据绑定
 * <p>
 * Stage 步骤与各级后置钩子中的步骤使用同一套规则。
 */
public class StepDefinitionValidator implements DefinitionValidator {

    private static final Pattern VARIABLE_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Set<String> knownActions;

    public StepDefinitionValidator(Set<String> knownActions) {
        this.knownActions = Set.copyOf(knownActions);
    }

    @Override
    public ValidationResult validate(PipelineDefinition definition) {
        ValidationResult result = new ValidationResult();

        StageTreeWalker.walk(definition.getStages(), (path, stage) -> {
            String field = StageTreeWalker.field(path);
            for (StepDefinition step : stage.getSteps()) {
                validateStep(field + ".step[" + step.getName() + "]", step, result);
            }
            validateHooks(field + ".post", stage.getPost(), result);
        });
        validateHooks("post", definition.getPost(), result);

        return result;
    }

    private void validateHooks(String field, PostHooks hooks, ValidationResult result) {
        for (StepDefinition step : hooks.allSteps()) {
            validateStep(field + ".step[" + step.getName() + "]", step, result);
        }
    }

    private void validateStep(String field, StepDefinition step, ValidationResult result) {
        validateAction(field, step, result);

        if (step.getRetry() < 0) {
            result.addError(ValidationError.of(field + ".retry", "重试次数不能为负数",
                    ValidationError.INVALID_RETRY, step.getRetry()));
        }
        requirePositive(field + ".timeout", step.getTimeout(), result);
        if (step.getRetryBackoff() != null && step.getRetryBackoff().isNegative()) {
            result.addError(ValidationError.of(field + ".retryBackoff", "重试间隔不能为负数",
                    ValidationError.INVALID_DURATION, step.getRetryBackoff()));
        } else {
            requireRepresentable(field + ".retryBackoff", step.getRetryBackoff(), result);
        }
        if (step.getRetryBackoff() != null && step.getRetry() == 0) {
            result.addWarning(ValidationWarning.of(field + ".retryBackoff", "retry 为 0，retryBackoff 不生效"));
        }
        if (step.getUnstableExitCodes().contains(0)) {
            result.addError(ValidationError.of(field + ".unstableExitCodes", "退出码 0 不能标记为 UNSTABLE",
                    ValidationError.INVALID_STEP_ACTION, step.getUnstableExitCodes()));
        }
        if (step.getDir() != null && (step.getDir().startsWith("/") || step.getDir().contains(".."))) {
            result.addError(ValidationError.of(field + ".dir", "工作目录必须是工作区内的相对路径",
                    ValidationError.INVALID_STEP_ACTION, step.getDir()));
        }

        validateCredentials(field, step, result);
    }

    private void validateAction(String field, StepDefinition step, ValidationResult result) {
        boolean hasCommand = step.getCommand() != null;
        boolean hasAction = step.getAction() != null;
        if (hasCommand == hasAction) {
            result.addError(ValidationError.of(field, "command 与 action 必须且只能给出一个",
                    ValidationError.INVALID_STEP_ACTION));
            return;
        }
        if (hasCommand) {
            if (step.getCommand().isBlank()) {
                result.addError(ValidationError.of(field + ".command", "命令不能为空",
                        ValidationError.INVALID_STEP_ACTION));
            }
            if (!step.getArguments().isEmpty()) {
                result.addWarning(ValidationWarning.of(field + ".with", "command 步骤忽略 with 参数"));
            }
        } else if (!knownActions.contains(step.getAction())) {
            result.addError(ValidationError.of(field + ".action", "未知的动作，可用: " + knownActions,
                    ValidationError.UNKNOWN_ACTION, step.getAction()));
        }
    }

    private void validateCredentials(String field, StepDefinition step, ValidationResult result) {
        Set<String> exposed = new HashSet<>();
        for (int i = 0; i < step.getCredentials().size(); i++) {
            CredentialBinding binding = step.getCredentials().get(i);
            String bindingField = field + ".credentials[" + i + "]";
            if (binding.getCredentialId() == null || binding.getCredentialId().isBlank()) {
                result.addError(ValidationError.of(bindingField + ".credentialId", "凭据 ID 不能为空",
                        ValidationError.INVALID_CREDENTIAL_BINDING));
            }
            if (binding.getType() == CredentialType.STRING) {
                if (binding.getUsernameVariable() != null || binding.getPasswordVariable() != null) {
                    result.addError(ValidationError.of(bindingField,
                            "STRING 类型只能使用 variable", ValidationError.INVALID_CREDENTIAL_BINDING));
                }
            } else if (binding.getVariable() != null) {
                result.addError(ValidationError.of(bindingField,
                        "USERNAME_PASSWORD 类型使用 usernameVariable / passwordVariable",
                        ValidationError.INVALID_CREDENTIAL_BINDING));
            }
            for (String variable : binding.getExposedVariables()) {
                if (variable == null || !VARIABLE_PATTERN.matcher(variable).matches()) {
                    result.addError(ValidationError.of(bindingField, "凭据变量名无效",
                            ValidationError.INVALID_CREDENTIAL_BINDING, variable));
                } else if (!exposed.add(variable)) {
                    result.addError(ValidationError.of(bindingField, "凭据变量名在同一步骤内重复",
                            ValidationError.INVALID_CREDENTIAL_BINDING, variable));
                }
            }
        }
    }

    private void requirePositive(String field, Duration duration, ValidationResult result) {
        if (duration != null && (duration.isNegative() || duration.isZero())) {
            result.addError(ValidationError.of(field, "时长必须为正数", ValidationError.INVALID_DURATION, duration));
        } else {
            requireRepresentable(field, duration, result);
        }
    }

    private void requireRepresentable(String field, Duration duration, ValidationResult result) {
        if (duration != null && !DurationLimits.isRepresentable(duration)) {
            result.addError(ValidationError.of(field, "时长超出可表示范围（最长约 292 年）",
                    ValidationError.INVALID_DURATION, duration));
        }
    }

    @Override
    public String getValidatorName() {
        return "StepDefinitionValidator";
    }

    @Override
    public int getOrder() {
        return 20;
    }
}
