package xyz.firestige.pipeline.validation.validator;

import xyz.firestige.pipeline.domain.definition.ParameterDefinition;
import xyz.firestige.pipeline.domain.definition.PipelineDefinition;
import xyz.firestige.pipeline.domain.definition.PipelineOptions;
import xyz.firestige.pipeline.domain.shared.DurationLimits;
import xyz.firestige.pipeline.validation.DefinitionValidator;
import xyz.firestige.pipeline.validation.ValidationError;
import xyz.firestige.pipeline.validation.ValidationResult;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

/**
 * 全局选项与参数声明校验器
 */
public class PipelineOptionsValidator implements DefinitionValidator {

    @Override
    public ValidationResult validate(PipelineDefinition definition) {
        ValidationResult result = new ValidationResult();
        PipelineOptions options = definition.getOptions();

        if (options.getConcurrencyLimit() != null && options.getConcurrencyLimit() < 1) {
            result.addError(ValidationError.of("options.concurrencyLimit", "并发上限必须 >= 1",
                    ValidationError.INVALID_OPTION, options.getConcurrencyLimit()));
        }
        if (options.getRetention() != null && options.getRetention() < 1) {
            result.addError(ValidationError.of("options.retention", "保留运行数必须 >= 1",
                    ValidationError.INVALID_OPTION, options.getRetention()));
        }
        requirePositive("options.timeout", options.getTimeout(), result);
        requirePositive("options.defaultStepTimeout", options.getDefaultStepTimeout(), result);

        Set<String> names = new HashSet<>();
        for (ParameterDefinition parameter : definition.getParameters()) {
            if (parameter.getName() == null || parameter.getName().isBlank()) {
                result.addError(ValidationError.of("parameters", "参数名称不能为空", ValidationError.MISSING_NAME));
            } else if (!names.add(parameter.getName())) {
                result.addError(ValidationError.of("parameters[" + parameter.getName() + "]", "参数重复声明",
                        ValidationError.DUPLICATE_PARAMETER, parameter.getName()));
            }
        }
        return result;
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
        return "PipelineOptionsValidator";
    }

    @Override
    public int getOrder() {
        return 5;
    }
}
