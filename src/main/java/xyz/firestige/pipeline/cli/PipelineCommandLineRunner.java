package xyz.firestige.pipeline.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import xyz.firestige.pipeline.domain.definition.PipelineDefinition;
import xyz.firestige.pipeline.domain.run.RunReport;
import xyz.firestige.pipeline.domain.shared.exception.ConcurrentRunException;
import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.PipelineException;
import xyz.firestige.pipeline.domain.shared.exception.RunNotFoundException;
import xyz.firestige.pipeline.domain.shared.vo.RunId;
import xyz.firestige.pipeline.facade.PipelineRunFacade;
import xyz.firestige.pipeline.facade.RunStatusInfo;
import xyz.firestige.pipeline.validation.PipelineValidationException;

import java.io.PrintStream;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 命令行触发入口
 * <pre>
 * start-run  [--definition=pipeline.yml] [--param.NAME=value]...   运行到结束，退出码反映结局
 * get-status --run-id=NAME#N                                       输出归档的运行报告
 * validate   [--definition=pipeline.yml] [--param.NAME=value]...   只校验不执行
 * </pre>
 */
@Component
@ConditionalOnProperty(prefix = "pipeline.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PipelineCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(PipelineCommandLineRunner.class);

    static final String START_RUN = "start-run";
    static final String GET_STATUS = "get-status";
    static final String VALIDATE = "validate";
    static final String PARAM_PREFIX = "param.";

    private static final Duration MAX_WAIT = Duration.ofDays(7);

    private final PipelineRunFacade facade;
    private final ObjectMapper objectMapper;
    private final PrintStream out;
    private volatile CliExitCode exitCode = CliExitCode.OK;

    public PipelineCommandLineRunner(PipelineRunFacade facade) {
        this(facade, System.out);
    }

    PipelineCommandLineRunner(PipelineRunFacade facade, PrintStream out) {
        this.facade = facade;
        this.out = out;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        if (commands.isEmpty()) {
            log.debug("未指定命令，跳过命令行处理");
            return;
        }
        String command = commands.get(0);
        try {
            switch (command) {
                case START_RUN:
                    exitCode = startRun(args);
                    break;
                case GET_STATUS:
                    exitCode = getStatus(args);
                    break;
                case VALIDATE:
                    exitCode = validate(args);
                    break;
                default:
                    out.println("未知命令: " + command + "（可用: start-run, get-status, validate）");
                    exitCode = CliExitCode.INVALID;
            }
        } catch (PipelineValidationException e) {
            out.println("流水线定义无效:");
            e.getErrors().forEach(error -> out.println("  " + error));
            exitCode = CliExitCode.INVALID;
        } catch (ConcurrentRunException | RunNotFoundException e) {
            out.println(e.getMessage());
            exitCode = CliExitCode.REJECTED;
        } catch (IllegalArgumentException e) {
            out.println("参数错误: " + e.getMessage());
            exitCode = CliExitCode.INVALID;
        } catch (PipelineException e) {
            log.error("命令执行失败: {}", command, e);
            out.println("命令执行失败: " + e.getMessage());
            exitCode = CliExitCode.FAILURE;
        }
    }

    private CliExitCode startRun(ApplicationArguments args) {
        PipelineDefinition definition = facade.loadDefinition(singleOption(args, "definition"));
        RunId runId = facade.startRun(definition, parameters(args));
        out.println("runId: " + runId);
        RunReport report = facade.awaitCompletion(runId, MAX_WAIT);
        RunStatusInfo info = RunStatusInfo.from(report);
        out.println("status: " + info.getStatus());
        info.getStages().forEach((stage, status) -> out.println("  " + stage + ": " + status));
        if (info.getMessage() != null) {
            out.println("message: " + info.getMessage());
        }
        return CliExitCode.forStatus(report.getStatus());
    }

    private CliExitCode getStatus(ApplicationArguments args) {
        String value = singleOption(args, "run-id");
        if (value == null) {
            throw new IllegalArgumentException("缺少 --run-id=NAME#N");
        }
        RunReport report = facade.getReport(RunId.parse(value));
        try {
            out.println(objectMapper.writeValueAsString(report));
        } catch (JsonProcessingException e) {
            throw new PipelineException(ErrorType.SYSTEM_ERROR, "运行报告序列化失败: " + value, e);
        }
        return CliExitCode.forStatus(report.getStatus());
    }

    private CliExitCode validate(ApplicationArguments args) {
        PipelineDefinition definition = facade.loadDefinition(singleOption(args, "definition"));
        facade.plan(definition, parameters(args));
        out.println("流水线定义有效: " + definition.getName());
        return CliExitCode.OK;
    }

    private static String singleOption(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        if (values.size() > 1) {
            throw new IllegalArgumentException("选项只能指定一次: --" + name);
        }
        return values.get(0);
    }

    static Map<String, String> parameters(ApplicationArguments args) {
        Map<String, String> parameters = new LinkedHashMap<>();
        for (String option : args.getOptionNames()) {
            if (option.startsWith(PARAM_PREFIX) && option.length() > PARAM_PREFIX.length()) {
                List<String> values = args.getOptionValues(option);
                String value = values.isEmpty() ? "" : values.get(values.size() - 1);
                parameters.put(option.substring(PARAM_PREFIX.length()), value);
            }
        }
        return parameters;
    }

    @Override
    public int getExitCode() {
        return exitCode.getCode();
    }
}
