package xyz.firestige.pipeline.infrastructure.execution;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.pipeline.domain.definition.CredentialBinding;
import xyz.firestige.pipeline.domain.definition.GuardCondition;
import xyz.firestige.pipeline.domain.definition.HookKind;
import xyz.firestige.pipeline.domain.definition.ParameterDefinition;
import xyz.firestige.pipeline.domain.definition.PipelineDefinition;
import xyz.firestige.pipeline.domain.definition.PipelineOptions;
import xyz.firestige.pipeline.domain.definition.PostHooks;
import xyz.firestige.pipeline.domain.definition.StageDefinition;
import xyz.firestige.pipeline.domain.definition.StepDefinition;
import xyz.firestige.pipeline.domain.plan.ExecutionPlan;
import xyz.firestige.pipeline.domain.run.CancelReason;
import xyz.firestige.pipeline.domain.run.ExecutionResult;
import xyz.firestige.pipeline.domain.run.ExecutionStatus;
import xyz.firestige.pipeline.domain.run.HookOutput;
import xyz.firestige.pipeline.domain.run.RunReport;
import xyz.firestige.pipeline.domain.run.event.PipelineRunEvent;
import xyz.firestige.pipeline.domain.run.event.RunCompletedEvent;
import xyz.firestige.pipeline.domain.run.event.RunStartedEvent;
import xyz.firestige.pipeline.domain.run.event.StageCompletedEvent;
import xyz.firestige.pipeline.domain.run.event.StageStartedEvent;
import xyz.firestige.pipeline.domain.shared.exception.ConcurrentRunException;
import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.RunNotFoundException;
import xyz.firestige.pipeline.domain.shared.vo.RunId;
import xyz.firestige.pipeline.infrastructure.credential.SecretValue;
import xyz.firestige.pipeline.infrastructure.execution.action.ActionOutcome;
import xyz.firestige.pipeline.infrastructure.execution.action.ActionRegistry;
import xyz.firestige.pipeline.infrastructure.execution.action.StepAction;
import xyz.firestige.pipeline.infrastructure.lock.ResourceLockManager;
import xyz.firestige.pipeline.testutil.EngineFixture;
import xyz.firestige.pipeline.testutil.ScriptedAction;
import xyz.firestige.pipeline.testutil.ChildProcessLeakExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * PipelineEngine 集成测试：内存锁 + 临时目录归档 + 可编排的测试动作
 */
@Tag("integration")
@ExtendWith(ChildProcessLeakExtension.class)
@DisplayName("PipelineEngine 集成测试")
class PipelineEngineTest {

    @TempDir
    Path tempDir;

    private final List<String> journal = new CopyOnWriteArrayList<>();
    private ScriptedAction ok;
    private ScriptedAction flaky;
    private ScriptedAction counted;
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger maxRunning = new AtomicInteger();
    private EngineFixture fixture;

    @BeforeEach
    void setUp() {
        ok = ScriptedAction.succeeding("ok", journal);
        flaky = ScriptedAction.failingTimes("flaky", journal, 2);
        counted = new ScriptedAction("counted", journal, (request, n) -> {
            maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
            try {
                Thread.sleep(80);
            } finally {
                running.decrementAndGet();
            }
            return ActionOutcome.success();
        });
        fixture = new EngineFixture(tempDir,
                ok,
                flaky,
                counted,
                ScriptedAction.failing("fail", journal),
                ScriptedAction.sleeping("slow", journal, Duration.ofSeconds(30)),
                ScriptedAction.sleeping("nap", journal, Duration.ofMillis(200)),
                ScriptedAction.printing("print", journal));
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private static StepDefinition step(String name, String action) {
        return StepDefinition.builder(name).action(action).build();
    }

    private static StageDefinition stage(String name, String... actions) {
        StageDefinition.Builder builder = StageDefinition.builder(name);
        for (int i = 0; i < actions.length; i++) {
            builder.step(step("s" + (i + 1), actions[i]));
        }
        return builder.build();
    }

    private static PipelineOptions options(Integer concurrencyLimit, Integer retention, Duration timeout,
                                           Boolean disableConcurrentBuilds) {
        return new PipelineOptions(concurrencyLimit, retention, timeout, null, disableConcurrentBuilds);
    }

    @Test
    @DisplayName("场景: 顺序 Stage 全部成功，事件按顺序发布")
    void sequentialStagesSucceed() {
        // Given
        PipelineDefinition definition = PipelineDefinition.builder("app")
                .stage(stage("build", "ok", "ok"))
                .stage(stage("test", "ok"))
                .build();

        // When
        RunReport report = fixture.run(definition);

        // Then
        assertThat(report.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(report.getRunId()).isEqualTo(RunId.of("app", 1));
        assertThat(journal).containsExactly("build/s1", "build/s2", "test/s1");
        assertThat(report.getStages()).extracting(ExecutionResult::getStatus)
                .containsExactly(ExecutionStatus.SUCCESS, ExecutionStatus.SUCCESS);

        List<PipelineRunEvent> events = fixture.events.getEvents();
        assertThat(events.get(0)).isInstanceOf(RunStartedEvent.class);
        assertThat(events.get(events.size() - 1)).isInstanceOf(RunCompletedEvent.class);
        assertThat(fixture.events.eventsOfType(StageStartedEvent.class))
                .extracting(StageStartedEvent::getStagePath)
                .containsExactly("build", "test");
        assertThat(fixture.engine.activeRunCount()).isZero();
        assertThat(fixture.archive.find(report.getRunId())).isPresent();
    }

    @Test
    @DisplayName("场景: 步骤失败后同 Stage 剩余步骤与后续 Stage 均为 SKIPPED")
    void failureSkipsRemainingWork() {
        // Given
        PipelineDefinition definition = PipelineDefinition.builder("app")
                .stage(stage("build", "ok", "fail", "ok"))
                .stage(stage("deploy", "ok"))
                .build();

        // When
        RunReport report = fixture.run(definition);

        // Then
        assertThat(report.getStatus()).isEqualTo(ExecutionStatus.FAILURE);
        assertThat(report.getFailureInfo().getFailedAt()).isEqualTo("build/s2");
        assertThat(report.find("build/s3").getStatus()).isEqualTo(ExecutionStatus.SKIPPED);
        assertThat(report.find("deploy").getStatus()).isEqualTo(ExecutionStatus.SKIPPED);
        assertThat(report.find("deploy/s1").getStatus()).isEqualTo(ExecutionStatus.SKIPPED);
        assertThat(journal).containsExactly("build/s1", "build/s2");
    }

    @Test
    @DisplayName("场景: 并行分支之一失败，兄弟分支照常完成，分组为 FAILURE")
    void parallelBranchFailureDoesNotCancelSiblings() {
        // Given
        StageDefinition group = StageDefinition.builder("checks")
                .branch(stage("lint", "nap"))
                .branch(stage("unit", "fail"))
                .branch(stage("docs", "nap"))
                .build();
        PipelineDefinition definition = PipelineDefinition.builder("app")
                .stage(group)
                .stage(stage("deploy", "ok"))
                .build();

        // When
        RunReport report = fixture.run(definition);

        // Then
        assertThat(report.getStatus()).isEqualTo(ExecutionStatus.FAILURE);
        assertThat(report.find("checks").getStatus()).isEqualTo(ExecutionStatus.FAILURE);
        assertThat(report.find("checks/lint").getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(report.find("checks/unit").getStatus()).isEqualTo(ExecutionStatus.FAILURE);
        assertThat(report.find("checks/docs").getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(report.find("checks").getChildren())
                .allSatisfy(branch -> assertThat(branch.getStatus().isTerminal()).isTrue());
        assertThat(report.find("deploy").getStatus()).isEqualTo(ExecutionStatus.SKIPPED);
        assertThat(journal).containsExactlyInAnyOrder("checks/lint/s1", "checks/unit/s1", "checks/docs/s1");
    }

    @Test
    @DisplayName("场景: best-effort Stage 失败时运行继续，结局为 UNSTABLE")
    void bestEffortStageMakesRunUnstable() {
        // Given
        PipelineDefinition definition = PipelineDefinition.builder("app")
                .stage(StageDefinition.builder("scan").step(step("s1", "fail")).bestEffort(true).build())
                .stage(stage("deploy", "ok"))
                .build();

        // When
        RunReport report = fixture.run(definition);

        // Then
        assertThat(report.getStatus()).isEqualTo(ExecutionStatus.UNSTABLE);
        assertThat(report.find("scan").getStatus()).isEqualTo(ExecutionStatus.FAILURE);
        assertThat(report.find("deploy").getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
    }

    @Test
    @DisplayName("场景: best-effort 分支失败，并行分组按 UNSTABLE 计")
    void bestEffortBranchMakesGroupUnstable() {
        // Given
        StageDefinition group = StageDefinition.builder("checks")
                .branch(stage("unit", "ok"))
                .branch(StageDefinition.builder("flaky-e2e").step(step("s1", "fail")).bestEffort(true).build())
                .build();
        PipelineDefinition definition = PipelineDefinition.builder("app").stage(group).build();

        // When
        RunReport report = fixture.run(definition);

        // Then
        assertThat(report.find("checks").getStatus()).isEqualTo(ExecutionStatus.UNSTABLE);
        assertThat(report.getStatus()).isEqualTo(ExecutionStatus.UNSTABLE);
    }

    @Test
    @DisplayName("场景: 退出码在 unstableExitCodes 中时步骤为 UNSTABLE，后续继续执行")
    void unstableExitCode() {
        // Given
        StepDefinition tests = StepDefinition.builder("tests").action("print")
                .with("exitCode", "3")
                .unstableExitCodes(3)
                .build();
        PipelineDefinition definition = PipelineDefinition.builder("app")
                .stage(StageDefinition.builder("test").step(tests).step(step("report", "ok")).build())
                .build();

        // When
        RunReport report = fixture.run(definition);

        // Then
        ExecutionResult result = report.find("test/tests");
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.UNSTABLE);
        assertThat(result.getExitCode()).isEqualTo(3);
        assertThat(report.find("test/report").getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(report.getStatus()).isEqualTo(ExecutionStatus.UNSTABLE);
    }

    @Test
    @DisplayName("场景: 钩子先执行 always 再执行结局对应的一组，钩子失败不改变结局")
    void hooksRunInOrderAndFailuresDoNotEscalate() {
        // Given
        StageDefinition build = StageDefinition.builder("build")
                .step(step("compile", "ok"))
                .post(PostHooks.builder()
                        .on(HookKind.SUCCESS, step("publish", "ok"))
                        .on(HookKind.ALWAYS, step("cleanup", "fail"), step("never", "ok"))
                        .on(HookKind.FAILURE, step("alert", "ok"))
                        .build())
                .build();
        PipelineDefinition definition = PipelineDefinition.builder("app")
                .stage(build)
                .post(PostHooks.builder()
                        .on(HookKind.ALWAYS, step("notify", "ok"))
                        .on(HookKind.SUCCESS, step("tag", "ok"))
                        .build())
                .build();

        // When
        RunReport report = fixture.run(definition);

        // Then
        assertThat(report.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(journal).containsExactly(
                "build/compile",
                "build/post/always/cleanup",
                "build/post/success/publish",
                "post/always/notify",
                "post/success/tag");

        HookOutput always = report.getHooks().stream()
                .filter(h -> h.getScope().equals("build") && h.getKind() == HookKind.ALWAYS)
                .findFirst().orElseThrow();
        assertThat(always.getStatus()).isEqualTo(ExecutionStatus.FAILURE);
        assertThat(always.getSteps()).extracting(ExecutionResult::getStatus)
                .containsExactly(ExecutionStatus.FAILURE, ExecutionStatus.SKIPPED);
        assertThat(report.getHooks()).extracting(HookOutput::getScope)
                .contains(HookOutput.PIPELINE_SCOPE);
    }

    @Test
    @DisplayName("场景: 被跳过的 Stage 不执行钩子")
    void skippedStageRunsNoHooks() {
        // Given
        StageDefinition deploy = StageDefinition.builder("deploy")
                .step(step("s1", "ok"))
                .post(PostHooks.builder().on(HookKind.ALWAYS, step("cleanup", "ok")).build())
                .build();
        PipelineDefinition definition = PipelineDefinition.builder("app")
                .stage(stage("build", "fail"))
                .stage(deploy)
                .build();

        // When
        RunReport report = fixture.run(definition);

        // Then
        assertThat(report.find("deploy").getStatus()).isEqualTo(ExecutionStatus.SKIPPED);
        assertThat(journal).doesNotContain("deploy/post/always/cleanup");
    }

    @Test
    @DisplayName("场景: 全局超时中止运行，释放 Stage 锁与运行锁，执行 aborted 钩子")
    void globalTimeoutAbortsRun() {
        // Given
        StageDefinition deploy = StageDefinition.builder("deploy")
                .step(step("rollout", "slow"))
                .lock("prod-env")
                .build();
        PipelineDefinition definition = PipelineDefinition.builder("app")
                .options(options(null, null, Duration.ofMillis(300), null))
                .stage(deploy)
                .stage(stage("verify", "ok"))
                .post(PostHooks.builder().on(HookKind.ABORTED, step("on-abort", "ok")).build())
                .build();

        // When
        long started = System.nanoTime();
        RunReport report = fixture.run(definition);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        // Then
        assertThat(report.getStatus()).isEqualTo(ExecutionStatus.ABORTED);
        assertThat(report.getCancelReason()).isEqualTo(CancelReason.RUN_TIMEOUT);
        assertThat(elapsed).isLessThan(Duration.ofSeconds(5));
        assertThat(report.find("deploy/rollout").getStatus()).isEqualTo(ExecutionStatus.ABORTED);
        assertThat(report.find("verify").getStatus()).isEqualTo(ExecutionStatus.SKIPPED);
        assertThat(journal).contains("post/aborted/on-abort");
        assertThat(fixture.locks.isLocked("prod-env")).isFalse();
        assertThat(fixture.locks.isLocked(ResourceLockManager.runLockName("app"))).isFalse();
    }

    @Test
    @DisplayName("场景: 禁止并发时第二个运行被拒绝，前一个结束后可再次运行")
    void concurrentRunIsRejected() {
        // Given
        PipelineDefinition definition = PipelineDefinition.builder("app")
                .stage(stage("build", "slow"))
                .build();
        ExecutionPlan plan = fixture.plan(definition, Map.of());
        RunExecution first = fixture.engine.prepare(plan);
        CompletableFuture<RunReport> running = CompletableFuture.supplyAsync(() -> fixture.engine.execute(first));
        await().atMost(5, TimeUnit.SECONDS).until(() -> journal.contains("build/s1"));

        // When / Then
        assertThatThrownBy(() -> fixture.engine.prepare(plan))
                .isInstanceOf(ConcurrentRunException.class);

        fixture.engine.cancel(first.getRunId());
        RunReport report = running.join();
        assertThat(report.getStatus()).isEqualTo(ExecutionStatus.ABORTED);
        assertThat(report.getCancelReason()).isEqualTo(CancelReason.CANCELLED);

        RunExecution next = fixture.engine.prepare(plan);
        assertThat(next.getRunId().getRunNumber()).isEqualTo(2);
        next.cancel(CancelReason.CANCELLED);
        fixture.engine.execute(next);
    }

    @Test
    @DisplayName("场景: 允许并发时两个运行可以同时进行")
    void concurrentRunsAllowedWhenEnabled() {
        // Given
        PipelineDefinition definition = PipelineDefinition.builder("app")
                .options(options(null, null, null, false))
                .stage(stage("build", "nap"))
                .build();
        ExecutionPlan plan = fixture.plan(definition, Map.of());

        // When
        RunExecution first = fixture.engine.prepare(plan);
        RunExecution second = fixture.engine.prepare(plan);
        CompletableFuture<RunReport> a = CompletableFuture.supplyAsync(() -> fixture.engine.execute(first));
        CompletableFuture<RunReport> b = CompletableFuture.supplyAsync(() -> fixture.engine.execute(second));

        // Then
        assertThat(first.getRunId()).isNotEqualTo(second.getRunId());
        assertThat(a.join().getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(b.join().getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
    }

    @Test
    @DisplayName("场景: 守卫不满足的 Stage 被跳过")
    void guardedStageIsSkipped() {
        // Given
        PipelineDefinition definition = PipelineDefinition.builder("app")
                .parameter(ParameterDefinition.of("ENV", "dev"))
                .stage(stage("build", "ok"))
                .stage(StageDefinition.builder("deploy-prod")
                        .step(step("s1", "ok"))
                        .when(GuardCondition.equalTo("ENV", "prod"))
                        .build())
                .build();

        // When
        RunReport skipped = fixture.run(definition);
        RunReport deployed = fixture.run(definition, Map.of("ENV", "prod"));

        // Then
        assertThat(skipped.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(skipped.find("deploy-prod").getStatus()).isEqualTo(ExecutionStatus.SKIPPED);
        assertThat(deployed.find("deploy-prod").getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(fixture.events.eventsOfType(StageCompletedEvent.class))
                .filteredOn(e -> e.getStagePath().equals("deploy-prod"))
                .extracting(StageCompletedEvent::getStatus)
                .containsExactly(ExecutionStatus.SKIPPED, ExecutionStatus.SUCCESS);
    }

    @Test
    @DisplayName("场景: 取消运行后结局为 ABORTED，原因 CANCELLED")
    void cancelRunningRun() {
        // Given
        PipelineDefinition definition = PipelineDefinition.builder("app")
                .stage(stage("build", "slow"))
                .build();
        RunExecution execution = fixture.engine.prepare(fixture.plan(definition, Map.of()));
        CompletableFuture<RunReport> running = CompletableFuture.supplyAsync(() -> fixture.engine.execute(execution));
        await().atMost(5, TimeUnit.SECONDS).until(() -> journal.contains("build/s1"));

        // When
        boolean cancelled = fixture.engine.cancel(execution.getRunId());

        // Then
        RunReport report = running.join();
        assertThat(cancelled).isTrue();
        assertThat(report.getStatus()).isEqualTo(ExecutionStatus.ABORTED);
        assertThat(report.getCancelReason()).isEqualTo(CancelReason.CANCELLED);
        assertThat(report.getFailureInfo().getErrorType()).isEqualTo(ErrorType.ABORTED);
        assertThatThrownBy(() -> fixture.engine.cancel(execution.getRunId()))
                .isInstanceOf(RunNotFoundException.class);
        assertThat(fixture.engine.findReport(execution.getRunId())).isPresent();
    }

    @Test
    @DisplayName("场景: 保留策略只保留最近 N 次运行")
    void retentionPurgesOldRuns() {
        // Given
        PipelineDefinition definition = PipelineDefinition.builder("app")
                .options(options(null, 2, null, null))
                .stage(stage("build", "ok"))
                .build();

        // When
        fixture.run(definition);
        fixture.run(definition);
        fixture.run(definition);

        // Then
        assertThat(fixture.archive.listRunNumbers("app")).containsExactly(2, 3);
        assertThat(fixture.archive.find(RunId.of("app", 1))).isEmpty();
    }

    @Test
    @DisplayName("场景: 声明同一资源锁的并行分支互斥执行")
    void sameLockBranchesDoNotOverlap() {
        // Given
        StageDefinition group = StageDefinition.builder("deploy")
                .branch(StageDefinition.builder("eu").step(step("s1", "counted")).lock("shared-db").build())
                .branch(StageDefinition.builder("us").step(step("s1", "counted")).lock("shared-db").build())
                .branch(StageDefinition.builder("ap").step(step("s1", "counted")).lock("shared-db").build())
                .build();
        PipelineDefinition definition = PipelineDefinition.builder("app").stage(group).build();

        // When
        RunReport report = fixture.run(definition);

        // Then
        assertThat(report.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(counted.getInvocations()).isEqualTo(3);
        assertThat(maxRunning.get()).isEqualTo(1);
        assertThat(fixture.locks.isLocked("shared-db")).isFalse();
    }

    @Test
    @DisplayName("场景: 资源锁等待超时，Stage 以 LOCK_CONTENTION 失败")
    void lockTimeoutFailsStage() {
        // Given
        fixture.locks.tryAcquire("prod-env", "someone-else", Duration.ofMinutes(1));
        PipelineDefinition definition = PipelineDefinition.builder("app")
                .stage(StageDefinition.builder("deploy")
                        .step(step("s1", "ok"))
                        .lock("prod-env")
                        .lockTimeout(Duration.ofMillis(100))
                        .build())
                .build();

        // When
        RunReport report = fixture.run(definition);

        // Then
        assertThat(report.getStatus()).isEqualTo(ExecutionStatus.FAILURE);
        assertThat(report.find("deploy").getFailureInfo().getErrorType()).isEqualTo(ErrorType.LOCK_CONTENTION);
        assertThat(report.find("deploy/s1").getStatus()).isEqualTo(ExecutionStatus.SKIPPED);
        assertThat(fixture.locks.getOwner("prod-env")).isEqualTo("someone-else");
        assertThat(journal).isEmpty();
    }

    @Test
    @DisplayName("场景: 未获得资源锁时 always 钩子仍在锁外执行")
    void lockTimeoutStillRunsAlwaysHooks() {
        // Given
        fixture.locks.tryAcquire("prod-env", "someone-else", Duration.ofMinutes(1));
        PipelineDefinition definition = PipelineDefinition.builder("app")
                .stage(StageDefinition.builder("deploy")
                        .step(step("s1", "ok"))
                        .lock("prod-env")
                        .lockTimeout(Duration.ofMillis(100))
                        .post(PostHooks.builder()
                                .on(HookKind.ALWAYS, step("cleanup", "ok"))
                                .on(HookKind.FAILURE, step("alert", "ok"))
                                .build())
                        .build())
                .build();

        // When
        RunReport report = fixture.run(definition);

        // Then
        assertThat(report.find("deploy").getFailureInfo().getErrorType()).isEqualTo(ErrorType.LOCK_CONTENTION);
        assertThat(journal).containsExactly("deploy/post/always/cleanup", "deploy/post/failure/alert");
        assertThat(fixture.locks.getOwner("prod-env")).isEqualTo("someone-else");
    }

    @Test
    @DisplayName("场景: 步骤链中抛出的运行时异常使 Stage 失败，钩子照常执行，后续 Stage 跳过")
    void unexpectedExceptionFailsStageAndKeepsReportComplete() {
        // Given
        ActionRegistry broken = new ActionRegistry() {
            @Override
            public StepAction get(String actionId) {
                if ("boom".equals(actionId)) {
                    throw new IllegalStateException("registry corrupted");
                }
                return super.get(actionId);
            }
        };
        fixture.close();
        fixture = new EngineFixture(tempDir, broken, ok, ScriptedAction.succeeding("boom", journal));
        PipelineDefinition definition = PipelineDefinition.builder("app")
                .stage(StageDefinition.builder("build")
                        .step(step("s1", "boom"))
                        .step(step("s2", "ok"))
                        .post(PostHooks.builder().on(HookKind.ALWAYS, step("cleanup", "ok")).build())
                        .build())
                .stage(stage("deploy", "ok"))
                .build();

        // When
        RunReport report = fixture.run(definition);

        // Then
        assertThat(report.getStatus()).isEqualTo(ExecutionStatus.FAILURE);
        assertThat(report.getStages()).hasSize(2);
        assertThat(report.find("build").getStatus()).isEqualTo(ExecutionStatus.FAILURE);
        assertThat(report.find("build/s1").getFailureInfo().getErrorType()).isEqualTo(ErrorType.SYSTEM_ERROR);
        assertThat(report.find("build/s2").getStatus()).isEqualTo(ExecutionStatus.SKIPPED);
        assertThat(report.find("deploy").getStatus()).isEqualTo(ExecutionStatus.SKIPPED);
        assertThat(journal).containsExactly("build/post/always/cleanup");
    }

    @Test
    @DisplayName("场景: concurrencyLimit=1 时并行分支的步骤串行执行")
    void concurrencyLimitSerializesSteps() {
        // Given
        StageDefinition group = StageDefinition.builder("matrix")
                .branch(stage("a", "counted"))
                .branch(stage("b", "counted"))
                .branch(stage("c", "counted"))
                .build();
        PipelineDefinition definition = PipelineDefinition.builder("app")
                .options(options(1, null, null, null))
                .stage(group)
                .build();

        // When
        RunReport report = fixture.run(definition);

        // Then
        assertThat(report.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(maxRunning.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("场景: 凭据注入步骤环境，日志中的密文被掩码")
    void credentialIsMaskedInStepLog() throws Exception {
        // Given
        fixture.secrets.put("deploy-token", SecretValue.of("s3cr3t-value"));
        StepDefinition push = StepDefinition.builder("push").action("print")
                .with("message", "pushing")
                .with("printEnv", "TOKEN")
                .credential(CredentialBinding.string("deploy-token", "TOKEN"))
                .build();
        PipelineDefinition definition = PipelineDefinition.builder("app")
                .stage(StageDefinition.builder("release").step(push).build())
                .build();

        // When
        RunReport report = fixture.run(definition);

        // Then
        ExecutionResult result = report.find("release/push");
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(result.getOutputRef()).isEqualTo("logs/release/push/attempt-1.log");
        Path logFile = fixture.archive.getRoot().resolve("app").resolve("1").resolve(result.getOutputRef());
        String content = Files.readString(logFile, StandardCharsets.UTF_8);
        assertThat(content).contains("pushing").contains("TOKEN=****").doesNotContain("s3cr3t-value");
    }

    @Test
    @DisplayName("场景: 缺失的凭据使步骤失败且不执行动作")
    void missingCredentialFailsStep() {
        // Given
        StepDefinition push = StepDefinition.builder("push").action("ok")
                .credential(CredentialBinding.string("absent", "TOKEN"))
                .build();
        PipelineDefinition definition = PipelineDefinition.builder("app")
                .stage(StageDefinition.builder("release").step(push).build())
                .build();

        // When
        RunReport report = fixture.run(definition);

        // Then
        assertThat(report.getStatus()).isEqualTo(ExecutionStatus.FAILURE);
        assertThat(report.find("release/push").getFailureInfo().getErrorType())
                .isEqualTo(ErrorType.CREDENTIAL_ERROR);
        assertThat(ok.getInvocations()).isZero();
    }

    @Test
    @DisplayName("场景: 失败的步骤按 retry 次数重试，成功后结束")
    void retryUntilSuccess() {
        // Given
        StepDefinition unstable = StepDefinition.builder("fetch").action("flaky")
                .retry(2)
                .retryBackoff(Duration.ofMillis(10))
                .build();
        PipelineDefinition definition = PipelineDefinition.builder("app")
                .stage(StageDefinition.builder("prepare").step(unstable).build())
                .build();

        // When
        RunReport report = fixture.run(definition);

        // Then
        ExecutionResult result = report.find("prepare/fetch");
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(flaky.getInvocations()).isEqualTo(3);
        assertThat(result.getAttempts()).hasSize(3);
        assertThat(result.getAttempts().stream().map(a -> a.getStatus()).collect(Collectors.toList()))
                .containsExactly(ExecutionStatus.FAILURE, ExecutionStatus.FAILURE, ExecutionStatus.SUCCESS);
        assertThat(result.getOutputRef()).isEqualTo("logs/prepare/fetch/attempt-3.log");
    }

    @Test
    @DisplayName("场景: shell 步骤在工作区执行，参数通过环境变量传入")
    void shellStepSeesParameters() throws Exception {
        // Given
        PipelineDefinition definition = PipelineDefinition.builder("app")
                .parameter(ParameterDefinition.of("VERSION", "1.0"))
                .stage(StageDefinition.builder("build")
                        .step(StepDefinition.builder("write")
                                .command("echo \"$VERSION\" > version.txt")
                                .build())
                        .build())
                .build();

        // When
        RunReport report = fixture.run(definition, Map.of("VERSION", "2.5"));

        // Then
        assertThat(report.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        Path written = tempDir.resolve("workspace").resolve("app").resolve("version.txt");
        assertThat(Files.readString(written).trim()).isEqualTo("2.5");
    }
}
