package xyz.firestige.pipeline.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次定义校验的结果：错误阻止运行，警告只记录
 */
public class ValidationResult {

    private final List<ValidationError> errors = new ArrayList<>();
    private final List<ValidationWarning> warnings = new ArrayList<>();

    public void addError(ValidationError error) {
        errors.add(error);
    }

    public void addWarning(ValidationWarning warning) {
        warnings.add(warning);
    }

    /**
     * 追加另一个结果的错误与警告，保持各自的报告顺序
     */
    public ValidationResult merge(ValidationResult other) {
        if (other != null) {
            errors.addAll(other.errors);
            warnings.addAll(other.warnings);
        }
        return this;
    }

    /**
     * @throws PipelineValidationException 存在任意错误
     */
    public void throwIfInvalid() {
        if (!errors.isEmpty()) {
            throw new PipelineValidationException(errors);
        }
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public List<ValidationError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<ValidationWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    @Override
    public String toString() {
        return "ValidationResult{errors=" + errors.size() + ", warnings=" + warnings.size() + '}';
    }
}
