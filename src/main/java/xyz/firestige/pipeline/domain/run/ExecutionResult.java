package xyz.firestige.pipeline.domain.run;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import xyz.firestige.pipeline.domain.shared.exception.FailureInfo;
import xyz.firestige.pipeline.domain.state.ExecutionStateMachine;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Stage / Step 执行结果（运行报告中的树节点）
 * <p>
 * 运行期间由所属 worker 线程写入，报告查询方并发读取。
 * 状态迁移经过 {@link ExecutionStateMachine} 校验；从归档反序列化的结果不再迁移。
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ExecutionResult {

    /**
     * 路径标识，如 {@code test/unit/run-tests}
     */
    private String id;

    private String name;

    private ResultType type;

    private volatile ExecutionStatus status = ExecutionStatus.PENDING;

    private volatile LocalDateTime startTime;

    private volatile LocalDateTime endTime;

    private volatile Duration duration;

    /**
     * 捕获输出的引用（日志文件路径）
     */
    private volatile String outputRef;

    private volatile Integer exitCode;

    private volatile FailureInfo failureInfo;

    private boolean bestEffort;

    /**
     * 重试链，仅步骤结果有
     */
    private final List<StepAttempt> attempts = new CopyOnWriteArrayList<>();

    /**
     * 子节点：Stage 的步骤结果，或并行分组的分支结果
     */
    private final List<ExecutionResult> children = new CopyOnWriteArrayList<>();

    @JsonIgnore
    private transient ExecutionStateMachine stateMachine;

    public ExecutionResult() {
    }

    public ExecutionResult(String id, String name, ResultType type) {
        this.id = id;
        this.name = name;
        this.type = type;
    }

    public static ExecutionResult pending(String id, String name, ResultType type) {
        return new ExecutionResult(id, name, type);
    }

    public static ExecutionResult skipped(String id, String name, ResultType type) {
        ExecutionResult result = new ExecutionResult(id, name, type);
        result.skip();
        return result;
    }

    private synchronized ExecutionStateMachine machine() {
        if (stateMachine == null) {
            stateMachine = ExecutionStateMachine.forStage(id);
        }
        return stateMachine;
    }

    public void start() {
        this.status = machine().transitionTo(ExecutionStatus.RUNNING);
        this.startTime = LocalDateTime.now();
    }

    public void skip() {
        this.status = machine().transitionTo(ExecutionStatus.SKIPPED);
    }

    public void complete(ExecutionStatus outcome, FailureInfo failureInfo) {
        this.status = machine().transitionTo(outcome);
        this.failureInfo = failureInfo;
        this.endTime = LocalDateTime.now();
        calculateDuration();
    }

    public void success() {
        complete(ExecutionStatus.SUCCESS, null);
    }

    public void failure(FailureInfo failureInfo) {
        complete(ExecutionStatus.FAILURE, failureInfo);
    }

    public void calculateDuration() {
        if (startTime != null && endTime != null) {
            this.duration = Duration.between(startTime, endTime);
        }
    }

    public void addChild(ExecutionResult child) {
        children.add(child);
    }

    public void addAttempt(StepAttempt attempt) {
        attempts.add(attempt);
    }

    /**
     * 按路径在子树中查找结果
     */
    public ExecutionResult find(String path) {
        if (path.equals(id)) {
            return this;
        }
        for (ExecutionResult child : children) {
            ExecutionResult found = child.find(path);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    // Getters and Setters

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public ResultType getType() {
        return type;
    }

    public void setType(ResultType type) {
        this.type = type;
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

    public String getOutputRef() {
        return outputRef;
    }

    public void setOutputRef(String outputRef) {
        this.outputRef = outputRef;
    }

    public Integer getExitCode() {
        return exitCode;
    }

    public void setExitCode(Integer exitCode) {
        this.exitCode = exitCode;
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }

    public void setFailureInfo(FailureInfo failureInfo) {
        this.failureInfo = failureInfo;
    }

    public boolean isBestEffort() {
        return bestEffort;
    }

    public void setBestEffort(boolean bestEffort) {
        this.bestEffort = bestEffort;
    }

    public List<StepAttempt> getAttempts() {
        return attempts;
    }

    public void setAttempts(List<StepAttempt> attempts) {
        this.attempts.clear();
        if (attempts != null) {
            this.attempts.addAll(attempts);
        }
    }

    public List<ExecutionResult> getChildren() {
        return children;
    }

    public void setChildren(List<ExecutionResult> children) {
        this.children.clear();
        if (children != null) {
            this.children.addAll(children);
        }
    }

    @Override
    public String toString() {
        return "ExecutionResult{" +
                "id='" + id + '\'' +
                ", status=" + status +
                ", duration=" + duration +
                '}';
    }
}
