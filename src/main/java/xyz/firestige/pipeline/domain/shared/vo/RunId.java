package xyz.firestige.pipeline.domain.shared.vo;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * RunId 值对象
 *
 * 职责：
 * 1. 标识一条流水线的一次运行
 * 2. 提供类型安全（无法与其他 String 混淆）
 * 3. 不可变对象，线程安全
 *
 * 格式规则：{pipelineName}#{runNumber}
 * 示例：backend-service#42
 */
public final class RunId {

    private static final char SEPARATOR = '#';

    private final String pipelineName;
    private final int runNumber;

    private RunId(String pipelineName, int runNumber) {
        this.pipelineName = pipelineName;
        this.runNumber = runNumber;
    }

    public static RunId of(String pipelineName, int runNumber) {
        if (pipelineName == null || pipelineName.isBlank()) {
            throw new IllegalArgumentException("流水线名称不能为空");
        }
        if (pipelineName.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("流水线名称不能包含 '#': " + pipelineName);
        }
        if (runNumber <= 0) {
            throw new IllegalArgumentException("运行编号必须为正数: " + runNumber);
        }
        return new RunId(pipelineName, runNumber);
    }

    /**
     * 解析 RunId 字符串
     *
     * @param value 形如 {@code backend-service#42}
     * @throws IllegalArgumentException 如果格式无效
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static RunId parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Run ID 不能为空");
        }
        int idx = value.lastIndexOf(SEPARATOR);
        if (idx <= 0 || idx == value.length() - 1) {
            throw new IllegalArgumentException("Run ID 格式无效，应为 {pipeline}#{number}: " + value);
        }
        try {
            return of(value.substring(0, idx), Integer.parseInt(value.substring(idx + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Run ID 运行编号无效: " + value, e);
        }
    }

    public String getPipelineName() {
        return pipelineName;
    }

    public int getRunNumber() {
        return runNumber;
    }

    @JsonValue
    public String getValue() {
        return pipelineName + SEPARATOR + runNumber;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RunId runId = (RunId) o;
        return runNumber == runId.runNumber && Objects.equals(pipelineName, runId.pipelineName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pipelineName, runNumber);
    }

    @Override
    public String toString() {
        return getValue();
    }
}
