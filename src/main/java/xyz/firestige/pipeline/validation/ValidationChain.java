package xyz.firestige.pipeline.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.domain.definition.PipelineDefinition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * 定义校验链
 * <p>
 * 按 {@link DefinitionValidator#getOrder()} 依次执行全部校验器，收集所有错误后一次性返回，
 * 使用户一次看到定义中的全部问题。
 */
public class ValidationChain {

    private static final Logger log = LoggerFactory.getLogger(ValidationChain.class);

    private final List<DefinitionValidator> validators = new ArrayList<>();

    public ValidationChain addValidator(DefinitionValidator validator) {
        return addValidators(List.of(validator));
    }

    public ValidationChain addValidators(Collection<? extends DefinitionValidator> added) {
        validators.addAll(added);
        validators.sort(Comparator.comparingInt(DefinitionValidator::getOrder));
        return this;
    }

    public ValidationResult validate(PipelineDefinition definition) {
        ValidationResult result = new ValidationResult();
        for (DefinitionValidator validator : validators) {
            ValidationResult partial = validator.validate(definition);
            if (partial.hasErrors()) {
                log.debug("{} 发现 {} 个错误: {}", validator.getValidatorName(),
                        partial.getErrors().size(), definition.getName());
            }
            result.merge(partial);
        }
        return result;
    }
}
