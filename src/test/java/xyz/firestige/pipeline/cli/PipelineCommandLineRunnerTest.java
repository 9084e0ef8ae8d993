package xyz.firestige.pipeline.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;
import xyz.firestige.pipeline.domain.definition.PipelineDefinition;
import xyz.firestige.pipeline.domain.definition.StageDefinition;
import xyz.firestige.pipeline.domain.definition.StepDefinition;
import xyz.firestige.pipeline.domain.run.ExecutionStatus;
import xyz.firestige.pipeline.domain.run.RunReport;
import xyz.firestige.pipeline.domain.shared.exception.ConcurrentRunException;
import xyz.firestige.pipeline.domain.shared.exception.RunNotFoundException;
import xyz.firestige.pipeline.domain.shared.vo.RunId;
import xyz.firestige.pipeline.facade.PipelineRunFacade;
import xyz.firestige.pipeline.validation.PipelineValidationException;
import xyz.firestige.pipeline.validation.ValidationError;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("PipelineCommandLineRunner 单元测试")
class PipelineCommandLineRunnerTest {

    private static final RunId RUN_ID = RunId.of("web-app", 7);

    private PipelineRunFacade facade;
    private ByteArrayOutputStream buffer;
    private PipelineCommandLineRunner runner;
    private PipelineDefinition definition;

    @BeforeEach
    void setUp() {
        facade = mock(PipelineRunFacade.class);
        buffer = new ByteArrayOutputStream();
        runner = new PipelineCommandLineRunner(facade, new PrintStream(buffer, true, StandardCharsets.UTF_8));
        definition = PipelineDefinition.builder("web-app")
                .stage(StageDefinition.builder("build").step(StepDefinition.builder("compile").command("true").build()).build())
                .build();
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static RunReport finished(ExecutionStatus status) {
        RunReport report = new RunReport(RUN_ID, Map.of());
        report.start();
        report.complete(status, null);
        return report;
    }

    private void run(String... args) {
        runner.run(new DefaultApplicationArguments(args));
    }

    @Test
    @DisplayName("场景: start-run 传入参数并以运行结局作为退出码")
    void startRunUsesOutcomeAsExitCode() {
        // Given
        when(facade.loadDefinition("ci/web-app.yml")).thenReturn(definition);
        when(facade.startRun(eq(definition), anyMap())).thenReturn(RUN_ID);
        when(facade.awaitCompletion(eq(RUN_ID), any(Duration.class))).thenReturn(finished(ExecutionStatus.FAILURE));

        // When
        run("start-run", "--definition=ci/web-app.yml", "--param.VERSION=1.2.0", "--param.BRANCH=main");

        // Then
        verify(facade).startRun(definition, Map.of("VERSION", "1.2.0", "BRANCH", "main"));
        assertThat(runner.getExitCode()).isEqualTo(1);
        assertThat(output()).contains("runId: web-app#7").contains("status: FAILURE");
    }

    @Test
    @DisplayName("场景: UNSTABLE 视为成功")
    void unstableExitsZero() {
        when(facade.loadDefinition(null)).thenReturn(definition);
        when(facade.startRun(eq(definition), anyMap())).thenReturn(RUN_ID);
        when(facade.awaitCompletion(eq(RUN_ID), any(Duration.class))).thenReturn(finished(ExecutionStatus.UNSTABLE));

        run("start-run");

        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    @DisplayName("场景: 已有运行时拒绝，退出码 4")
    void concurrentRunIsRejected() {
        when(facade.loadDefinition(null)).thenReturn(definition);
        when(facade.startRun(eq(definition), anyMap())).thenThrow(new ConcurrentRunException("web-app"));

        run("start-run");

        assertThat(runner.getExitCode()).isEqualTo(CliExitCode.REJECTED.getCode());
    }

    @Test
    @DisplayName("场景: 定义无效时列出全部错误，退出码 3")
    void invalidDefinitionListsErrors() {
        when(facade.loadDefinition(null)).thenReturn(definition);
        when(facade.plan(eq(definition), anyMap())).thenThrow(new PipelineValidationException(List.of(
                ValidationError.of("stage[build]", "Stage 名称重复", ValidationError.DUPLICATE_STAGE_NAME),
                ValidationError.of("parameters.VERSION", "缺少必填参数", ValidationError.MISSING_PARAMETER))));

        run("validate");

        assertThat(runner.getExitCode()).isEqualTo(3);
        assertThat(output()).contains("流水线定义无效").contains("stage[build]").contains("parameters.VERSION");
    }

    @Test
    @DisplayName("场景: validate 通过")
    void validateSucceeds() {
        when(facade.loadDefinition(null)).thenReturn(definition);

        run("validate", "--param.VERSION=1.0");

        verify(facade).plan(definition, Map.of("VERSION", "1.0"));
        assertThat(runner.getExitCode()).isZero();
        assertThat(output()).contains("web-app");
    }

    @Test
    @DisplayName("场景: get-status 输出报告 JSON")
    void getStatusPrintsReport() {
        when(facade.getReport(RUN_ID)).thenReturn(finished(ExecutionStatus.ABORTED));

        run("get-status", "--run-id=web-app#7");

        assertThat(runner.getExitCode()).isEqualTo(2);
        assertThat(output()).contains("\"runId\" : \"web-app#7\"").contains("ABORTED");
    }

    @Test
    @DisplayName("场景: get-status 查询不存在的运行，退出码 4")
    void getStatusUnknownRun() {
        when(facade.getReport(RUN_ID)).thenThrow(new RunNotFoundException(RUN_ID));

        run("get-status", "--run-id=web-app#7");

        assertThat(runner.getExitCode()).isEqualTo(4);
    }

    @Test
    @DisplayName("场景: 用法错误，退出码 3")
    void usageErrors() {
        run("get-status");
        assertThat(runner.getExitCode()).isEqualTo(3);

        run("get-status", "--run-id=not-a-run-id");
        assertThat(runner.getExitCode()).isEqualTo(3);

        run("deploy-everything");
        assertThat(runner.getExitCode()).isEqualTo(3);
        assertThat(output()).contains("未知命令");
    }

    @Test
    @DisplayName("场景: 没有命令时什么也不做")
    void noCommandIsNoop() {
        run("--spring.profiles.active=dev");

        assertThat(runner.getExitCode()).isZero();
    }
}
