package xyz.firestige.pipeline.infrastructure.persistence;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.pipeline.domain.run.ExecutionResult;
import xyz.firestige.pipeline.domain.run.ExecutionStatus;
import xyz.firestige.pipeline.domain.run.ResultType;
import xyz.firestige.pipeline.domain.run.RunReport;
import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.FailureInfo;
import xyz.firestige.pipeline.domain.shared.vo.RunId;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FileSystemRunArchive 单元测试")
class FileSystemRunArchiveTest {

    @TempDir
    Path root;

    private FileSystemRunArchive archive;

    @BeforeEach
    void setUp() {
        archive = new FileSystemRunArchive(root);
    }

    private RunReport finishedReport(int runNumber, ExecutionStatus status) {
        RunId runId = RunId.of("web-app", runNumber);
        archive.runDirectory(runId);
        RunReport report = new RunReport(runId, Map.of("VERSION", "1." + runNumber));
        report.start();
        ExecutionResult stage = ExecutionResult.pending("build", "build", ResultType.STAGE);
        stage.start();
        if (status == ExecutionStatus.FAILURE) {
            stage.failure(FailureInfo.of(ErrorType.STEP_FAILURE, "退出码 1", "build/compile"));
        } else {
            stage.complete(status, null);
        }
        report.addStage(stage);
        report.addArtifact("artifacts/dist/app.jar");
        report.complete(status, stage.getFailureInfo());
        archive.save(report);
        return report;
    }

    @Test
    @DisplayName("运行编号单调递增，即使目录尚未写入报告")
    void runNumbersAreMonotonic() {
        assertThat(archive.nextRunNumber("web-app")).isEqualTo(1);
        assertThat(archive.nextRunNumber("web-app")).isEqualTo(2);
        assertThat(archive.nextRunNumber("other")).isEqualTo(1);

        FileSystemRunArchive reopened = new FileSystemRunArchive(root);
        archive.runDirectory(RunId.of("web-app", 7));
        assertThat(reopened.nextRunNumber("web-app")).isEqualTo(8);
    }

    @Test
    @DisplayName("报告写入后可读回")
    void savedReportCanBeRead() {
        finishedReport(1, ExecutionStatus.FAILURE);

        Optional<RunReport> found = archive.find(RunId.of("web-app", 1));

        assertThat(found).isPresent();
        RunReport report = found.get();
        assertThat(report.getRunId()).isEqualTo(RunId.of("web-app", 1));
        assertThat(report.getStatus()).isEqualTo(ExecutionStatus.FAILURE);
        assertThat(report.getParameters()).containsEntry("VERSION", "1.1");
        assertThat(report.getStages()).hasSize(1);
        assertThat(report.getStages().get(0).getFailureInfo().getFailedAt()).isEqualTo("build/compile");
        assertThat(report.getArtifacts()).containsExactly("artifacts/dist/app.jar");
        assertThat(root.resolve("web-app/1/report.json.tmp")).doesNotExist();
    }

    @Test
    @DisplayName("不存在的运行返回空")
    void missingRunIsEmpty() {
        assertThat(archive.find(RunId.of("web-app", 99))).isEmpty();
    }

    @Test
    @DisplayName("保留策略只统计已归档运行，删除最早的")
    void purgeKeepsNewestArchivedRuns() throws Exception {
        for (int i = 1; i <= 4; i++) {
            finishedReport(i, ExecutionStatus.SUCCESS);
        }
        Path inProgress = archive.runDirectory(RunId.of("web-app", 5));
        Files.writeString(inProgress.resolve("marker"), "running");

        assertThat(archive.purgeBeyond("web-app", 2))
                .containsExactly(RunId.of("web-app", 1), RunId.of("web-app", 2));

        assertThat(archive.listRunNumbers("web-app")).containsExactly(3, 4);
        assertThat(root.resolve("web-app/1")).doesNotExist();
        assertThat(inProgress.resolve("marker")).exists();
    }

    @Test
    @DisplayName("归档数量未超过保留数时不清理")
    void purgeWithinRetentionIsNoop() {
        finishedReport(1, ExecutionStatus.SUCCESS);

        assertThat(archive.purgeBeyond("web-app", 10)).isEmpty();
        assertThat(archive.purgeBeyond("unknown", 1)).isEmpty();
    }
}
