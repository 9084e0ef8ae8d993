package xyz.firestige.pipeline.autoconfigure;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import xyz.firestige.pipeline.application.plan.PlanDefaults;
import xyz.firestige.pipeline.application.plan.StageGraphResolver;
import xyz.firestige.pipeline.config.properties.PipelinePersistenceProperties;
import xyz.firestige.pipeline.config.properties.PipelineProperties;
import xyz.firestige.pipeline.domain.shared.event.DomainEventPublisher;
import xyz.firestige.pipeline.facade.PipelineRunFacade;
import xyz.firestige.pipeline.infrastructure.credential.CredentialScopeManager;
import xyz.firestige.pipeline.infrastructure.credential.EnvironmentSecretStore;
import xyz.firestige.pipeline.infrastructure.credential.InMemorySecretStore;
import xyz.firestige.pipeline.infrastructure.credential.SecretStore;
import xyz.firestige.pipeline.infrastructure.credential.SecretValue;
import xyz.firestige.pipeline.infrastructure.definition.PipelineDefinitionCodec;
import xyz.firestige.pipeline.infrastructure.event.RunEventLogger;
import xyz.firestige.pipeline.infrastructure.event.SpringDomainEventPublisher;
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
import xyz.firestige.pipeline.infrastructure.lock.ResourceLockManager;
import xyz.firestige.pipeline.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.pipeline.infrastructure.metrics.MicrometerMetricsRegistry;
import xyz.firestige.pipeline.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.pipeline.infrastructure.persistence.FileSystemRunArchive;
import xyz.firestige.pipeline.infrastructure.persistence.RunArchive;
import xyz.firestige.pipeline.infrastructure.template.TemplateResolver;
import xyz.firestige.pipeline.validation.DefinitionValidator;
import xyz.firestige.pipeline.validation.ValidationChain;
import xyz.firestige.pipeline.validation.validator.GuardConditionValidator;
import xyz.firestige.pipeline.validation.validator.PipelineOptionsValidator;
import xyz.firestige.pipeline.validation.validator.StageTreeValidator;
import xyz.firestige.pipeline.validation.validator.StepDefinitionValidator;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 流水线引擎自动配置
 * <p>
 * 所有 Bean 均为 {@code @ConditionalOnMissingBean}，使用方可以替换任意一环
 * （如自定义 SecretStore、追加 StepAction、替换 RunArchive）。
 */
@AutoConfiguration(after = PipelinePersistenceAutoConfiguration.class)
@EnableConfigurationProperties({PipelineProperties.class, PipelinePersistenceProperties.class})
public class PipelineEngineAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(PipelineEngineAutoConfiguration.class);

    // ========== Events & Metrics ==========

    @Bean
    @ConditionalOnMissingBean(DomainEventPublisher.class)
    public DomainEventPublisher pipelineDomainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        return new SpringDomainEventPublisher(applicationEventPublisher);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "pipeline.events", name = "log-enabled", havingValue = "true", matchIfMissing = true)
    public RunEventLogger runEventLogger() {
        return new RunEventLogger();
    }

    /**
     * 存在 Micrometer MeterRegistry 时上报指标，否则 Noop
     */
    @Bean
    @ConditionalOnMissingBean
    public MetricsRegistry pipelineMetricsRegistry(ObjectProvider<MeterRegistry> meterRegistryProvider) {
        MeterRegistry mr = meterRegistryProvider.getIfAvailable();
        if (mr != null) {
            return new MicrometerMetricsRegistry(mr);
        }
        return new NoopMetricsRegistry();
    }

    // ========== Credentials ==========

    @Bean
    @ConditionalOnMissingBean
    public SecretStore secretStore(PipelineProperties properties) {
        if (properties.getSecretSource() == PipelineProperties.SecretSource.ENVIRONMENT) {
            logger.info("[AutoConfig] 凭据来源: 进程环境变量 ({}<ID>)", EnvironmentSecretStore.PREFIX);
            return new EnvironmentSecretStore();
        }
        InMemorySecretStore store = new InMemorySecretStore();
        properties.getCredentials().forEach((id, credential) -> store.put(id,
                credential.getUsername() != null
                        ? SecretValue.of(credential.getUsername(), credential.getSecret())
                        : SecretValue.of(credential.getSecret())));
        logger.info("[AutoConfig] 凭据来源: 配置文件，共 {} 个凭据", properties.getCredentials().size());
        return store;
    }

    @Bean
    @ConditionalOnMissingBean
    public CredentialScopeManager credentialScopeManager(SecretStore secretStore) {
        return new CredentialScopeManager(secretStore);
    }

    // ========== Actions ==========

    @Bean
    public ShellCommandAction shellCommandAction(PipelineProperties properties) {
        return new ShellCommandAction(properties.getShell(), properties.getPollInterval(),
                properties.getKillGracePeriod());
    }

    @Bean
    public EchoAction echoAction() {
        return new EchoAction();
    }

    @Bean
    public ArchiveArtifactsAction archiveArtifactsAction() {
        return new ArchiveArtifactsAction();
    }

    @Bean
    @ConditionalOnMissingBean
    public ActionRegistry actionRegistry(List<StepAction> actions) {
        ActionRegistry registry = new ActionRegistry(actions);
        logger.info("[AutoConfig] 已注册步骤动作: {}", registry.getActionIds());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public TemplateResolver templateResolver() {
        return new TemplateResolver();
    }

    // ========== Definition & Planning ==========

    @Bean
    @ConditionalOnMissingBean
    public PipelineDefinitionCodec pipelineDefinitionCodec() {
        return new PipelineDefinitionCodec();
    }

    @Bean
    public StageTreeValidator stageTreeValidator() {
        return new StageTreeValidator();
    }

    @Bean
    public StepDefinitionValidator stepDefinitionValidator(ActionRegistry actionRegistry) {
        return new StepDefinitionValidator(actionRegistry.getActionIds());
    }

    @Bean
    public GuardConditionValidator guardConditionValidator() {
        return new GuardConditionValidator();
    }

    @Bean
    public PipelineOptionsValidator pipelineOptionsValidator() {
        return new PipelineOptionsValidator();
    }

    /**
     * 按顺序执行全部定义校验器
     */
    @Bean
    @ConditionalOnMissingBean
    public ValidationChain definitionValidationChain(List<DefinitionValidator> validators) {
        return new ValidationChain().addValidators(validators);
    }

    @Bean
    @ConditionalOnMissingBean
    public StageGraphResolver stageGraphResolver(ValidationChain definitionValidationChain,
                                                 PipelineProperties properties) {
        return new StageGraphResolver(definitionValidationChain, new PlanDefaults(
                properties.getConcurrencyLimit(), properties.getRetention(), properties.getDefaultStepTimeout()));
    }

    // ========== Thread Pools ==========

    @Bean(name = "pipelineWorkerPool", destroyMethod = "shutdownNow")
    public ExecutorService pipelineWorkerPool() {
        return Executors.newCachedThreadPool(daemonThreadFactory("pipeline-worker-"));
    }

    @Bean(name = "pipelineBranchPool", destroyMethod = "shutdownNow")
    public ExecutorService pipelineBranchPool() {
        return Executors.newCachedThreadPool(daemonThreadFactory("pipeline-branch-"));
    }

    @Bean(name = "pipelineRunPool", destroyMethod = "shutdownNow")
    public ExecutorService pipelineRunPool() {
        return Executors.newCachedThreadPool(daemonThreadFactory("pipeline-run-"));
    }

    @Bean(name = "pipelineScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService pipelineScheduler() {
        return Executors.newScheduledThreadPool(2, daemonThreadFactory("pipeline-scheduler-"));
    }

    private static CustomizableThreadFactory daemonThreadFactory(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }

    // ========== Engine ==========

    @Bean
    @ConditionalOnMissingBean
    public RunArchive runArchive(PipelineProperties properties) {
        logger.info("[AutoConfig] 运行归档目录: {}", properties.getArchiveRoot().toAbsolutePath());
        return new FileSystemRunArchive(properties.getArchiveRoot());
    }

    @Bean
    public EngineSettings engineSettings(PipelineProperties properties,
                                         PipelinePersistenceProperties persistenceProperties) {
        return new EngineSettings(properties.getWorkspaceRoot(), persistenceProperties.getLockTtl(),
                properties.getLockPollInterval());
    }

    @Bean
    @ConditionalOnMissingBean
    public StepRunner stepRunner(ActionRegistry actionRegistry, TemplateResolver templateResolver,
                                 CredentialScopeManager credentialScopeManager,
                                 @Qualifier("pipelineWorkerPool") ExecutorService workerPool,
                                 PipelineProperties properties) {
        StepExecutor stepExecutor = new StepExecutor(actionRegistry, templateResolver, workerPool,
                properties.getPollInterval(), properties.getKillGracePeriod());
        return new StepRunner(stepExecutor, new RetryingStepExecutor(), credentialScopeManager);
    }

    @Bean
    @ConditionalOnMissingBean
    public HookRunner hookRunner(StepRunner stepRunner) {
        return new HookRunner(stepRunner);
    }

    @Bean
    @ConditionalOnMissingBean
    public StageRunner stageRunner(StepRunner stepRunner, HookRunner hookRunner, ResourceLockManager lockManager,
                                   DomainEventPublisher eventPublisher,
                                   @Qualifier("pipelineBranchPool") ExecutorService branchPool,
                                   EngineSettings engineSettings) {
        return new StageRunner(stepRunner, hookRunner, lockManager, eventPublisher, branchPool, engineSettings);
    }

    @Bean
    @ConditionalOnMissingBean
    public PipelineEngine pipelineEngine(StageRunner stageRunner, HookRunner hookRunner,
                                         ResourceLockManager lockManager, RunArchive runArchive,
                                         DomainEventPublisher eventPublisher,
                                         @Qualifier("pipelineScheduler") ScheduledExecutorService scheduler,
                                         EngineSettings engineSettings, MetricsRegistry metricsRegistry) {
        logger.info("[AutoConfig] 装配流水线引擎: workspace={}", engineSettings.workspaceRoot().toAbsolutePath());
        return new PipelineEngine(stageRunner, hookRunner, lockManager, runArchive, eventPublisher,
                scheduler, engineSettings, metricsRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public PipelineRunFacade pipelineRunFacade(StageGraphResolver stageGraphResolver, PipelineEngine pipelineEngine,
                                               PipelineDefinitionCodec codec, ResourceLoader resourceLoader,
                                               @Qualifier("pipelineRunPool") ExecutorService runPool,
                                               PipelineProperties properties) {
        return new PipelineRunFacade(stageGraphResolver, pipelineEngine, codec, resourceLoader, runPool,
                properties.getDefinitionLocation());
    }
}
