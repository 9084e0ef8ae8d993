package xyz.firestige.pipeline.infrastructure.execution.action;

import java.util.List;

/**
 * 动作执行结果：退出码 + 可选消息 + 归档的产物路径
 */
public final class ActionOutcome {

    private final int exitCode;
    private final String message;
    private final List<String> artifacts;

    private ActionOutcome(int exitCode, String message, List<String> artifacts) {
        this.exitCode = exitCode;
        this.message = message;
        this.artifacts = List.copyOf(artifacts);
    }

    public static ActionOutcome success() {
        return new ActionOutcome(0, null, List.of());
    }

    public static ActionOutcome success(List<String> artifacts) {
        return new ActionOutcome(0, null, artifacts);
    }

    public static ActionOutcome exit(int exitCode) {
        return new ActionOutcome(exitCode, null, List.of());
    }

    public static ActionOutcome failure(int exitCode, String message) {
        return new ActionOutcome(exitCode, message, List.of());
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getMessage() {
        return message;
    }

    public List<String> getArtifacts() {
        return artifacts;
    }

    @Override
    public String toString() {
        return "ActionOutcome{exitCode=" + exitCode + ", message='" + message + "'}";
    }
}
