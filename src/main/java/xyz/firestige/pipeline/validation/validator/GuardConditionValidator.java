package xyz.firestige.pipeline.validation.validator;

import xyz.firestige.pipeline.domain.definition.GuardCondition;
import xyz.firestige.pipeline.domain.definition.ParameterDefinition;
import xyz.firestige.pipeline.domain.definition.PipelineDefinition;
import xyz.firestige.pipeline.validation.DefinitionValidator;
import xyz.firestige.pipeline.validation.StageTreeWalker;
import xyz.firestige.pipeline.validation.ValidationError;
import xyz.firestige.pipeline.validation.ValidationResult;

import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * 守卫条件校验器：引用的参数必须已声明，比较算子恰好一个，正则可编译
 */
public class GuardConditionValidator implements DefinitionValidator {

    @Override
    public ValidationResult validate(PipelineDefinition definition) {
        ValidationResult result = new ValidationResult();
        Set<String> declared = definition.getParameters().stream()
                .map(ParameterDefinition::getName)
                .collect(Collectors.toSet());

        StageTreeWalker.walk(definition.getStages(), (path, stage) -> {
            GuardCondition when = stage.getWhen();
            if (when == null) {
                return;
            }
            String field = StageTreeWalker.field(path) + ".when";
            if (when.getParameter() == null || when.getParameter().isBlank()) {
                result.addError(ValidationError.of(field, "守卫条件缺少 parameter", ValidationError.INVALID_GUARD));
            } else if (!declared.contains(when.getParameter())) {
                result.addError(ValidationError.of(field, "守卫条件引用了未声明的参数",
                        ValidationError.UNDEFINED_PARAMETER, when.getParameter()));
            }
            if (when.operatorCount() != 1) {
                result.addError(ValidationError.of(field,
                        "equals / notEquals / matches 必须且只能给出一个（当前 " + when.operatorCount() + " 个）",
                        ValidationError.INVALID_GUARD));
            }
            if (when.getMatches() != null) {
                try {
                    Pattern.compile(when.getMatches());
                } catch (PatternSyntaxException e) {
                    result.addError(ValidationError.of(field + ".matches", "正则表达式无效: " + e.getDescription(),
                            ValidationError.INVALID_GUARD, when.getMatches()));
                }
            }
        });

        return result;
    }

    @Override
    public String getValidatorName() {
        return "GuardConditionValidator";
    }

    @Override
    public int getOrder() {
        return 30;
    }
}
