package xyz.firestige.pipeline.facade;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ResourceLoader;
import xyz.firestige.pipeline.application.plan.StageGraphResolver;
import xyz.firestige.pipeline.domain.definition.PipelineDefinition;
import xyz.firestige.pipeline.domain.plan.ExecutionPlan;
import xyz.firestige.pipeline.domain.run.RunReport;
import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.PipelineException;
import xyz.firestige.pipeline.domain.shared.exception.RunNotFoundException;
import xyz.firestige.pipeline.domain.shared.vo.RunId;
import xyz.firestige.pipeline.infrastructure.definition.PipelineDefinitionCodec;
import xyz.firestige.pipeline.infrastructure.execution.PipelineEngine;
import xyz.firestige.pipeline.infrastructure.execution.RunExecution;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 流水线运行 Facade
 * <p>
 * 职责：
 * 1. 解析定义与参数为执行计划（校验失败抛 PipelineValidationException，列出全部错误）
 * 2. 同步准备运行（拒绝并发运行时直接抛出），再交给运行线程池异步执行
 * 3. 查询状态：执行中的运行返回实时报告，已结束的从归档读取
 */
public class PipelineRunFacade {

    private static final Logger logger = LoggerFactory.getLogger(PipelineRunFacade.class);

    private final StageGraphResolver resolver;
    private final PipelineEngine engine;
    private final PipelineDefinitionCodec codec;
    private final ResourceLoader resourceLoader;
    private final ExecutorService runPool;
    private final String defaultDefinitionLocation;

    public PipelineRunFacade(StageGraphResolver resolver, PipelineEngine engine, PipelineDefinitionCodec codec,
                             ResourceLoader resourceLoader, ExecutorService runPool,
                             String defaultDefinitionLocation) {
        this.resolver = resolver;
        this.engine = engine;
        this.codec = codec;
        this.resourceLoader = resourceLoader;
        this.runPool = runPool;
        this.defaultDefinitionLocation = defaultDefinitionLocation;
    }

    /**
     * 启动运行，立即返回运行标识
     */
    public RunId startRun(PipelineDefinition definition, Map<String, String> parameters) {
        ExecutionPlan plan = resolver.resolve(definition, parameters);
        RunExecution execution = engine.prepare(plan);
        logger.info("提交运行: {}", execution.getRunId());
        runPool.execute(() -> engine.execute(execution));
        return execution.getRunId();
    }

    /**
     * 使用 {@code pipeline.definition-location} 配置的定义启动运行
     */
    public RunId startRun(Map<String, String> parameters) {
        return startRun(loadDefinition(null), parameters);
    }

    /**
     * 同步运行到结束
     */
    public RunReport runToCompletion(PipelineDefinition definition, Map<String, String> parameters) {
        return engine.run(resolver.resolve(definition, parameters));
    }

    /**
     * 只解析不执行，用于提前校验定义与参数
     */
    public ExecutionPlan plan(PipelineDefinition definition, Map<String, String> parameters) {
        return resolver.resolve(definition, parameters);
    }

    public RunStatusInfo getStatus(RunId runId) {
        return RunStatusInfo.from(getReport(runId));
    }

    /**
     * @throws RunNotFoundException 既不在执行中也不在归档中
     */
    public RunReport getReport(RunId runId) {
        return engine.findReport(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    /**
     * 等待运行结束
     *
     * @throws PipelineException 等待超时（SYSTEM_ERROR）
     */
    public RunReport awaitCompletion(RunId runId, Duration timeout) {
        Optional<RunExecution> active = engine.activeRun(runId);
        if (active.isEmpty()) {
            return getReport(runId);
        }
        try {
            return active.get().getCompletion().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new PipelineException(ErrorType.SYSTEM_ERROR, "等待运行结束超时: " + runId, e);
        } catch (ExecutionException e) {
            throw new PipelineException(ErrorType.SYSTEM_ERROR, "运行异常结束: " + runId, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException(ErrorType.SYSTEM_ERROR, "等待运行结束时被中断: " + runId, e);
        }
    }

    public boolean cancel(RunId runId) {
        return engine.cancel(runId);
    }

    /**
     * 加载定义：location 为空时使用默认位置；支持 {@code classpath:} 与 {@code file:} 前缀，无前缀按文件路径处理
     */
    public PipelineDefinition loadDefinition(String location) {
        String effective = location != null ? location : defaultDefinitionLocation;
        if (effective == null || effective.isBlank()) {
            throw new PipelineException(ErrorType.VALIDATION_ERROR, "未指定流水线定义（pipeline.definition-location）");
        }
        if (!effective.contains(":")) {
            effective = "file:" + effective;
        }
        return codec.read(resourceLoader.getResource(effective));
    }
}
