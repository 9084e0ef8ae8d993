package xyz.firestige.pipeline.infrastructure.execution.action;

import xyz.firestige.pipeline.domain.run.CancellationToken;
import xyz.firestige.pipeline.domain.run.RunContext;
import xyz.firestige.pipeline.infrastructure.execution.output.OutputCapture;

import java.nio.file.Path;
import java.util.Map;

/**
 * 动作调用请求
 */
public final class ActionRequest {

    private final String stepPath;
    private final String command;
    private final Map<String, String> arguments;
    private final Map<String, String> environment;
    private final Path workingDirectory;
    private final OutputCapture output;
    private final CancellationToken cancellationToken;
    private final RunContext runContext;

    public ActionRequest(String stepPath, String command, Map<String, String> arguments,
                         Map<String, String> environment, Path workingDirectory, OutputCapture output,
                         CancellationToken cancellationToken, RunContext runContext) {
        this.stepPath = stepPath;
        this.command = command;
        this.arguments = Map.copyOf(arguments);
        this.environment = environment;
        this.workingDirectory = workingDirectory;
        this.output = output;
        this.cancellationToken = cancellationToken;
        this.runContext = runContext;
    }

    public String getStepPath() {
        return stepPath;
    }

    /**
     * 已替换模板变量的命令，非 command 步骤为 null
     */
    public String getCommand() {
        return command;
    }

    public Map<String, String> getArguments() {
        return arguments;
    }

    public String getArgument(String key, String defaultValue) {
        return arguments.getOrDefault(key, defaultValue);
    }

    /**
     * 步骤执行环境，包含凭据变量；不得记录日志
     */
    public Map<String, String> getEnvironment() {
        return environment;
    }

    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    public OutputCapture getOutput() {
        return output;
    }

    /**
     * 动作必须在有界间隔内检查该令牌
     */
    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public RunContext getRunContext() {
        return runContext;
    }
}
