package xyz.firestige.pipeline.domain.shared.exception;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.function.UnaryOperator;

/**
 * 步骤、Stage 或运行的失败原因，随运行报告归档
 * <p>
 * 不可变；消息在写入前已经过凭据脱敏。是否可重试由 {@link ErrorType} 决定。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FailureInfo {

    private final ErrorType errorType;
    private final String errorMessage;

    /**
     * Stage / Step 路径，运行级失败为 null
     */
    private final String failedAt;

    private final LocalDateTime timestamp;

    @JsonCreator
    FailureInfo(@JsonProperty("errorType") ErrorType errorType,
                @JsonProperty("errorMessage") String errorMessage,
                @JsonProperty("failedAt") String failedAt,
                @JsonProperty("timestamp") LocalDateTime timestamp) {
        this.errorType = errorType != null ? errorType : ErrorType.SYSTEM_ERROR;
        this.errorMessage = errorMessage;
        this.failedAt = failedAt;
        this.timestamp = timestamp != null ? timestamp : LocalDateTime.now();
    }

    public static FailureInfo of(ErrorType errorType, String errorMessage) {
        return of(errorType, errorMessage, null);
    }

    public static FailureInfo of(ErrorType errorType, String errorMessage, String failedAt) {
        return new FailureInfo(errorType, errorMessage, failedAt, null);
    }

    public static FailureInfo fromException(Exception e, ErrorType errorType, String failedAt) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return of(errorType, message, failedAt);
    }

    /**
     * 脱敏等消息改写，保留原失败时间
     */
    public FailureInfo withMessage(UnaryOperator<String> rewrite) {
        return new FailureInfo(errorType, rewrite.apply(errorMessage), failedAt, timestamp);
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getFailedAt() {
        return failedAt;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public boolean isRetryable() {
        return errorType.isRetryable();
    }

    @Override
    public String toString() {
        return errorType + (failedAt != null ? " @" + failedAt : "") + ": " + errorMessage;
    }
}
