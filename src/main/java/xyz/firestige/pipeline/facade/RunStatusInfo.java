package xyz.firestige.pipeline.facade;

import xyz.firestige.pipeline.domain.run.ExecutionResult;
import xyz.firestige.pipeline.domain.run.ExecutionStatus;
import xyz.firestige.pipeline.domain.run.RunReport;
import xyz.firestige.pipeline.domain.shared.vo.RunId;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 运行状态信息（Facade 层 DTO）
 * 用于 get-status 查询的返回值
 */
public class RunStatusInfo {

    private RunId runId;
    private ExecutionStatus status;
    private boolean finished;
    private String message;
    private Duration duration;
    private Map<String, ExecutionStatus> stages = new LinkedHashMap<>();

    public RunStatusInfo() {
    }

    public static RunStatusInfo from(RunReport report) {
        RunStatusInfo info = new RunStatusInfo();
        info.setRunId(report.getRunId());
        info.setStatus(report.getStatus());
        info.setFinished(report.isFinished());
        info.setDuration(report.getDuration());
        if (report.getFailureInfo() != null) {
            info.setMessage(report.getFailureInfo().getErrorMessage());
        }
        for (ExecutionResult stage : report.getStages()) {
            info.stages.put(stage.getId(), stage.getStatus());
        }
        return info;
    }

    public RunId getRunId() {
        return runId;
    }

    public void setRunId(RunId runId) {
        this.runId = runId;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public void setStatus(ExecutionStatus status) {
        this.status = status;
    }

    public boolean isFinished() {
        return finished;
    }

    public void setFinished(boolean finished) {
        this.finished = finished;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public Duration getDuration() {
        return duration;
    }

    public void setDuration(Duration duration) {
        this.duration = duration;
    }

    /**
     * 顶层 Stage 路径 → 状态，按定义顺序
     */
    public Map<String, ExecutionStatus> getStages() {
        return stages;
    }

    public void setStages(Map<String, ExecutionStatus> stages) {
        this.stages = stages;
    }

    @Override
    public String toString() {
        return "RunStatusInfo{runId=" + runId + ", status=" + status + ", finished=" + finished + '}';
    }
}
