package xyz.firestige.pipeline.validation;

/**
 * 不阻止运行的定义问题，例如声明了但不会生效的选项
 *
 * @param field   定义中的位置，如 {@code stages[0].steps[1].retryBackoff}
 * @param message 说明
 */
public record ValidationWarning(String field, String message) {

    public static ValidationWarning of(String field, String message) {
        return new ValidationWarning(field, message);
    }

    @Override
    public String toString() {
        return field + ": " + message;
    }
}
