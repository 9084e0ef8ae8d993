package xyz.firestige.pipeline.infrastructure.persistence;

import xyz.firestige.pipeline.domain.run.RunReport;
import xyz.firestige.pipeline.domain.shared.vo.RunId;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * 运行归档
 * <p>
 * 布局：{@code <root>/<pipeline>/<runNumber>/}，包含 {@code report.json}、{@code logs/}、{@code artifacts/}。
 */
public interface RunArchive {

    /**
     * 分配下一个运行编号（单调递增）
     */
    int nextRunNumber(String pipelineName);

    /**
     * 运行目录，不存在时创建
     */
    Path runDirectory(RunId runId);

    void save(RunReport report);

    Optional<RunReport> find(RunId runId);

    /**
     * 已归档（有报告）的运行编号，升序
     */
    List<Integer> listRunNumbers(String pipelineName);

    /**
     * 只保留最新的 keep 个已归档运行，删除更早的
     *
     * @return 被清理的运行
     */
    List<RunId> purgeBeyond(String pipelineName, int keep);
}
