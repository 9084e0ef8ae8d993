package xyz.firestige.pipeline.domain.shared.exception;

/**
 * 非法状态转换异常
 */
public class IllegalStateTransitionException extends PipelineException {

    private final Enum<?> from;
    private final Enum<?> to;

    public IllegalStateTransitionException(String subject, Enum<?> from, Enum<?> to) {
        super(ErrorType.SYSTEM_ERROR, String.format("非法状态转换 [%s]: %s -> %s", subject, from, to));
        this.from = from;
        this.to = to;
    }

    public Enum<?> getFrom() {
        return from;
    }

    public Enum<?> getTo() {
        return to;
    }
}
