package xyz.firestige.pipeline.testutil;

import xyz.firestige.pipeline.application.plan.PlanDefaults;
import xyz.firestige.pipeline.application.plan.StageGraphResolver;
import xyz.firestige.pipeline.domain.definition.PipelineDefinition;
import xyz.firestige.pipeline.domain.plan.ExecutionPlan;
import xyz.firestige.pipeline.domain.run.RunReport;
import xyz.firestige.pipeline.infrastructure.credential.CredentialScopeManager;
import xyz.firestige.pipeline.infrastructure.credential.InMemorySecretStore;
import xyz.firestige.pipeline.infrastructure.execution.EngineSettings;
import xyz.firestige.pipeline.infrastructure.execution.HookRunner;
import xyz.firestige.pipeline.infrastructure.execution.PipelineEngine;
import xyz.firestige.pipeline.infrastructure.execution.StageRunner;
import xyz.firestige.pipeline.infrastructure.execution.StepExecutor;
import xyz.firestige.pipeline.infrastructure.execution.StepRunner;
import xyz.firestige.pipeline.infrastructure.execution.action.ActionRegistry;
import xyz.firestige.pipeline.infrastructure.execution.action.ArchiveArtifactsAction;
import xyz.firestige.pipeline.infrastructure.execution.action.EchoAction;
import xyz.firestige.pipeline.infrastructure.execution.action.ShellCommandAction;
import xyz.firestige.pipeline.infrastructure.execution.action.StepAction;
import xyz.firestige.pipeline.infrastructure.execution.retry.RetryingStepExecutor;
import xyz.firestige.pipeline.infrastructure.lock.InMemoryResourceLockManager;
import xyz.firestige.pipeline.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.pipeline.infrastructure.persistence.FileSystemRunArchive;
import xyz.firestige.pipeline.infrastructure.template.TemplateResolver;
import xyz.firestige.pipeline.validation.ValidationChain;
import xyz.firestige.pipeline.validation.validator.GuardConditionValidator;
import xyz.firestige.pipeline.validation.validator.PipelineOptionsValidator;
import xyz.firestige.pipeline.validation.validator.StageTreeValidator;
import xyz.firestige.pipeline.validation.validator.StepDefinitionValidator;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 组装一套完整引擎（内存锁 + 临时目录归档），测试用短轮询间隔
 */
public class EngineFixture implements AutoCloseable {

    public static final Duration POLL = Duration.ofMillis(20);
    public static final Duration GRACE = Duration.ofMillis(500);

    public final ActionRegistry actions;
    public final InMemorySecretStore secrets = new InMemorySecretStore();
    public final InMemoryResourceLockManager locks = new InMemoryResourceLockManager();
    public final RecordingEventPublisher events = new RecordingEventPublisher();
    public final FileSystemRunArchive archive;
    public final StageGraphResolver resolver;
    public final PipelineEngine engine;

    private final ExecutorService workerPool = Executors.newCachedThreadPool();
    private final ExecutorService branchPool = Executors.newCachedThreadPool();
    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2);

    public EngineFixture(Path root, StepAction... extraActions) {
        this(root, new ActionRegistry(), extraActions);
    }

    public EngineFixture(Path root, ActionRegistry actions, StepAction... extraActions) {
        this.actions = actions;
        actions.register(new ShellCommandAction(List.of("/bin/sh", "-c"), POLL, GRACE));
        actions.register(new EchoAction());
        actions.register(new ArchiveArtifactsAction());
        for (StepAction action : extraActions) {
            actions.register(action);
        }

        ValidationChain chain = new ValidationChain()
                .addValidator(new StageTreeValidator())
                .addValidator(new StepDefinitionValidator(actions.getActionIds()))
                .addValidator(new GuardConditionValidator())
                .addValidator(new PipelineOptionsValidator());
        resolver = new StageGraphResolver(chain, PlanDefaults.standard());

        archive = new FileSystemRunArchive(root.resolve("runs"));
        EngineSettings settings = new EngineSettings(root.resolve("workspace"), Duration.ofMinutes(1), POLL);
        StepRunner stepRunner = new StepRunner(
                new StepExecutor(actions, new TemplateResolver(), workerPool, POLL, GRACE),
                new RetryingStepExecutor(),
                new CredentialScopeManager(secrets));
        HookRunner hookRunner = new HookRunner(stepRunner);
        StageRunner stageRunner = new StageRunner(stepRunner, hookRunner, locks, events, branchPool, settings);
        engine = new PipelineEngine(stageRunner, hookRunner, locks, archive, events, scheduler, settings,
                new NoopMetricsRegistry());
    }

    public ExecutionPlan plan(PipelineDefinition definition, Map<String, String> parameters) {
        return resolver.resolve(definition, parameters);
    }

    public RunReport run(PipelineDefinition definition) {
        return run(definition, Map.of());
    }

    public RunReport run(PipelineDefinition definition, Map<String, String> parameters) {
        return engine.run(plan(definition, parameters));
    }

    @Override
    public void close() {
        workerPool.shutdownNow();
        branchPool.shutdownNow();
        scheduler.shutdownNow();
    }
}
