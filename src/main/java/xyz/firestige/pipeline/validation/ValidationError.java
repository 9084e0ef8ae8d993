package xyz.firestige.pipeline.validation;

import java.util.Objects;

/**
 * 阻止运行的定义错误
 * <p>
 * 错误码为下列常量之一，调用方按错误码而不是消息文本判断问题类型。
 */
public final class ValidationError {

    public static final String PARSE_ERROR = "PARSE_ERROR";
    public static final String MISSING_NAME = "MISSING_NAME";
    public static final String INVALID_NAME = "INVALID_NAME";
    public static final String DUPLICATE_STAGE_NAME = "DUPLICATE_STAGE_NAME";
    public static final String DUPLICATE_STEP_NAME = "DUPLICATE_STEP_NAME";
    public static final String INVALID_STAGE_SHAPE = "INVALID_STAGE_SHAPE";
    public static final String SHARED_STAGE_REFERENCE = "SHARED_STAGE_REFERENCE";
    public static final String INVALID_GUARD = "INVALID_GUARD";
    public static final String UNDEFINED_PARAMETER = "UNDEFINED_PARAMETER";
    public static final String MISSING_PARAMETER = "MISSING_PARAMETER";
    public static final String INVALID_STEP_ACTION = "INVALID_STEP_ACTION";
    public static final String UNKNOWN_ACTION = "UNKNOWN_ACTION";
    public static final String INVALID_RETRY = "INVALID_RETRY";
    public static final String INVALID_DURATION = "INVALID_DURATION";
    public static final String NESTED_LOCK_CONFLICT = "NESTED_LOCK_CONFLICT";
    public static final String INVALID_CREDENTIAL_BINDING = "INVALID_CREDENTIAL_BINDING";
    public static final String INVALID_OPTION = "INVALID_OPTION";
    public static final String DUPLICATE_PARAMETER = "DUPLICATE_PARAMETER";

    /**
     * 定义中的位置，如 {@code stage[build].step[compile].retry}
     */
    private final String field;
    private final String message;
    private final String errorCode;
    private final Object rejectedValue;

    private ValidationError(String field, String message, String errorCode, Object rejectedValue) {
        this.field = field;
        this.message = message;
        this.errorCode = errorCode;
        this.rejectedValue = rejectedValue;
    }

    public static ValidationError of(String field, String message, String errorCode) {
        return new ValidationError(field, message, errorCode, null);
    }

    public static ValidationError of(String field, String message, String errorCode, Object rejectedValue) {
        return new ValidationError(field, message, errorCode, rejectedValue);
    }

    public String getField() {
        return field;
    }

    public String getMessage() {
        return message;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Object getRejectedValue() {
        return rejectedValue;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ValidationError)) {
            return false;
        }
        ValidationError that = (ValidationError) o;
        return Objects.equals(field, that.field)
                && Objects.equals(errorCode, that.errorCode)
                && Objects.equals(message, that.message)
                && Objects.equals(rejectedValue, that.rejectedValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, errorCode, message, rejectedValue);
    }

    @Override
    public String toString() {
        String text = "[" + errorCode + "] " + field + ": " + message;
        return rejectedValue != null ? text + " (值: " + rejectedValue + ")" : text;
    }
}
