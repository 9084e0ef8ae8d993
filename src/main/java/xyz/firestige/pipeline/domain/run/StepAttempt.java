package xyz.firestige.pipeline.domain.run;

import xyz.firestige.pipeline.domain.shared.exception.FailureInfo;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 步骤的一次尝试（重试链中的一环）
 */
public class StepAttempt {

    private int attempt;
    private ExecutionStatus status;
    private Integer exitCode;
    private String outputRef;
    private FailureInfo failureInfo;
    private LocalDateTime startTime;
    private Duration duration;

    public StepAttempt() {
    }

    public static StepAttempt of(int attempt, ExecutionResult result) {
        StepAttempt a = new StepAttempt();
        a.attempt = attempt;
        a.status = result.getStatus();
        a.exitCode = result.getExitCode();
        a.outputRef = result.getOutputRef();
        a.failureInfo = result.getFailureInfo();
        a.startTime = result.getStartTime();
        a.duration = result.getDuration();
        return a;
    }

    public int getAttempt() {
        return attempt;
    }

    public void setAttempt(int attempt) {
        this.attempt = attempt;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public void setStatus(ExecutionStatus status) {
        this.status = status;
    }

    public Integer getExitCode() {
        return exitCode;
    }

    public void setExitCode(Integer exitCode) {
        this.exitCode = exitCode;
    }

    public String getOutputRef() {
        return outputRef;
    }

    public void setOutputRef(String outputRef) {
        this.outputRef = outputRef;
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }

    public void setFailureInfo(FailureInfo failureInfo) {
        this.failureInfo = failureInfo;
    }

    public LocalDateTime getStartTime() {
        return startTime;
    }

    public void setStartTime(LocalDateTime startTime) {
        this.startTime = startTime;
    }

    public Duration getDuration() {
        return duration;
    }

    public void setDuration(Duration duration) {
        this.duration = duration;
    }

    @Override
    public String toString() {
        return "StepAttempt{attempt=" + attempt + ", status=" + status + ", exitCode=" + exitCode + '}';
    }
}
