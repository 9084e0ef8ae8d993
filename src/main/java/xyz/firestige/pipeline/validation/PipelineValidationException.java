package xyz.firestige.pipeline.validation;

import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.PipelineException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 定义校验失败，携带全部校验错误；在任何执行开始前抛出
 */
public class PipelineValidationException extends PipelineException {

    private final List<ValidationError> errors;

    public PipelineValidationException(List<ValidationError> errors) {
        super(ErrorType.VALIDATION_ERROR, buildMessage(errors));
        this.errors = List.copyOf(errors);
    }

    public PipelineValidationException(List<ValidationError> errors, Throwable cause) {
        super(ErrorType.VALIDATION_ERROR, buildMessage(errors), cause);
        this.errors = List.copyOf(errors);
    }

    private static String buildMessage(List<ValidationError> errors) {
        return "流水线定义校验失败，共 " + errors.size() + " 个问题: " + errors.stream()
                .map(ValidationError::toString)
                .collect(Collectors.joining("; "));
    }

    public List<ValidationError> getErrors() {
        return errors;
    }
}
