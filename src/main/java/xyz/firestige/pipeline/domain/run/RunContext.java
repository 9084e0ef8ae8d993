package xyz.firestige.pipeline.domain.run;

import org.slf4j.MDC;
import xyz.firestige.pipeline.domain.shared.vo.RunId;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 运行上下文：运行标识、参数、基础环境变量、工作区与归档目录，以及 MDC 注入
 * <p>
 * 创建后不可变；每个步骤在其基础环境之上派生自己的环境副本。
 */
public class RunContext {

    public static final String MDC_PIPELINE = "pipeline";
    public static final String MDC_RUN_ID = "runId";
    public static final String MDC_STAGE = "stage";

    private final RunId runId;
    private final Map<String, String> parameters;
    private final Map<String, String> environment;
    private final Path workspace;
    private final Path runDirectory;

    public RunContext(RunId runId, Map<String, String> parameters, Map<String, String> definitionEnvironment,
                      Path workspace, Path runDirectory) {
        this.runId = runId;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.workspace = workspace;
        this.runDirectory = runDirectory;

        Map<String, String> env = new LinkedHashMap<>(definitionEnvironment);
        env.putAll(parameters);
        env.put("PIPELINE_NAME", runId.getPipelineName());
        env.put("BUILD_NUMBER", String.valueOf(runId.getRunNumber()));
        env.put("RUN_ID", runId.getValue());
        env.put("WORKSPACE", workspace.toString());
        this.environment = Collections.unmodifiableMap(env);
    }

    public void injectMdc(String stagePath) {
        MDC.put(MDC_PIPELINE, runId.getPipelineName());
        MDC.put(MDC_RUN_ID, runId.getValue());
        if (stagePath != null) {
            MDC.put(MDC_STAGE, stagePath);
        } else {
            MDC.remove(MDC_STAGE);
        }
    }

    public void clearMdc() {
        MDC.remove(MDC_PIPELINE);
        MDC.remove(MDC_RUN_ID);
        MDC.remove(MDC_STAGE);
    }

    public RunId getRunId() {
        return runId;
    }

    public String getPipelineName() {
        return runId.getPipelineName();
    }

    public Map<String, String> getParameters() {
        return parameters;
    }

    /**
     * 定义环境 + 参数 + 内置变量（PIPELINE_NAME / BUILD_NUMBER / RUN_ID / WORKSPACE）
     */
    public Map<String, String> getEnvironment() {
        return environment;
    }

    public Path getWorkspace() {
        return workspace;
    }

    public Path getRunDirectory() {
        return runDirectory;
    }

    public Path getLogDirectory() {
        return runDirectory.resolve("logs");
    }

    public Path getArtifactDirectory() {
        return runDirectory.resolve("artifacts");
    }
}
