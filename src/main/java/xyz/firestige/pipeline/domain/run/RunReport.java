package xyz.firestige.pipeline.domain.run;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import xyz.firestige.pipeline.domain.shared.exception.FailureInfo;
import xyz.firestige.pipeline.domain.shared.vo.RunId;
import xyz.firestige.pipeline.domain.state.ExecutionStateMachine;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 运行报告
 * <p>
 * 汇总一次运行的全部执行结果：Stage 结果树、按执行顺序的钩子输出、归档产物路径。
 * 运行结束后以 {@code report.json} 写入归档目录。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunReport {

    private RunId runId;
    private String pipelineName;
    private int runNumber;
    private Map<String, String> parameters = new LinkedHashMap<>();
    private volatile ExecutionStatus status = ExecutionStatus.PENDING;
    private volatile LocalDateTime startTime;
    private volatile LocalDateTime endTime;
    private volatile Duration duration;
    private final List<ExecutionResult> stages = new CopyOnWriteArrayList<>();
    private final List<HookOutput> hooks = new CopyOnWriteArrayList<>();
    private final List<String> artifacts = new CopyOnWriteArrayList<>();
    private volatile FailureInfo failureInfo;
    private volatile CancelReason cancelReason;

    @JsonIgnore
    private transient ExecutionStateMachine stateMachine;

    public RunReport() {
    }

    public RunReport(RunId runId, Map<String, String> parameters) {
        this.runId = runId;
        this.pipelineName = runId.getPipelineName();
        this.runNumber = runId.getRunNumber();
        this.parameters = new LinkedHashMap<>(parameters);
        this.stateMachine = ExecutionStateMachine.forRun(runId.getValue());
    }

    public void start() {
        this.status = stateMachine.transitionTo(ExecutionStatus.RUNNING);
        this.startTime = LocalDateTime.now();
    }

    public void complete(ExecutionStatus outcome, FailureInfo failureInfo) {
        this.status = stateMachine.transitionTo(outcome);
        this.failureInfo = failureInfo;
        this.endTime = LocalDateTime.now();
        if (startTime != null) {
            this.duration = Duration.between(startTime, endTime);
        }
    }

    @JsonIgnore
    public boolean isFinished() {
        return status.isTerminal();
    }

    public void addStage(ExecutionResult stage) {
        stages.add(stage);
    }

    public void addHook(HookOutput hook) {
        hooks.add(hook);
    }

    public void addArtifact(String path) {
        artifacts.add(path);
    }

    /**
     * 按路径查找 Stage / Step 结果
     */
    public ExecutionResult find(String path) {
        for (ExecutionResult stage : stages) {
            ExecutionResult found = stage.find(path);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    // Getters and Setters

    public RunId getRunId() {
        return runId;
    }

    public void setRunId(RunId runId) {
        this.runId = runId;
    }

    public String getPipelineName() {
        return pipelineName;
    }

    public void setPipelineName(String pipelineName) {
        this.pipelineName = pipelineName;
    }

    public int getRunNumber() {
        return runNumber;
    }

    public void setRunNumber(int runNumber) {
        this.runNumber = runNumber;
    }

    public Map<String, String> getParameters() {
        return parameters;
    }

    public void setParameters(Map<String, String> parameters) {
        this.parameters = parameters;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public void setStatus(ExecutionStatus status) {
        this.status = status;
    }

    public LocalDateTime getStartTime() {
        return startTime;
    }

    public void setStartTime(LocalDateTime startTime) {
        this.startTime = startTime;
    }

    public LocalDateTime getEndTime() {
        return endTime;
    }

    public void setEndTime(LocalDateTime endTime) {
        this.endTime = endTime;
    }

    public Duration getDuration() {
        return duration;
    }

    public void setDuration(Duration duration) {
        this.duration = duration;
    }

    public List<ExecutionResult> getStages() {
        return stages;
    }

    public void setStages(List<ExecutionResult> stages) {
        this.stages.clear();
        if (stages != null) {
            this.stages.addAll(stages);
        }
    }

    public List<HookOutput> getHooks() {
        return hooks;
    }

    public void setHooks(List<HookOutput> hooks) {
        this.hooks.clear();
        if (hooks != null) {
            this.hooks.addAll(hooks);
        }
    }

    public List<String> getArtifacts() {
        return artifacts;
    }

    public void setArtifacts(List<String> artifacts) {
        this.artifacts.clear();
        if (artifacts != null) {
            this.artifacts.addAll(artifacts);
        }
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }

    public void setFailureInfo(FailureInfo failureInfo) {
        this.failureInfo = failureInfo;
    }

    public CancelReason getCancelReason() {
        return cancelReason;
    }

    public void setCancelReason(CancelReason cancelReason) {
        this.cancelReason = cancelReason;
    }

    @Override
    public String toString() {
        return "RunReport{runId=" + runId + ", status=" + status + ", duration=" + duration + '}';
    }
}
