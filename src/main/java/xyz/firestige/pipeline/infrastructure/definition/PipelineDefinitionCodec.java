package xyz.firestige.pipeline.infrastructure.definition;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import xyz.firestige.pipeline.domain.definition.PipelineDefinition;
import xyz.firestige.pipeline.domain.shared.exception.ErrorType;
import xyz.firestige.pipeline.domain.shared.exception.PipelineException;
import xyz.firestige.pipeline.validation.PipelineValidationException;
import xyz.firestige.pipeline.validation.ValidationError;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 流水线定义 YAML 编解码
 * <p>
 * 读取后写出的文本再次读取得到相等的定义。时长使用 ISO-8601（如 {@code PT30S}）。
 * 语法错误、未知字段、类型不匹配统一转换为带 {@code PARSE_ERROR} 的校验异常。
 */
public class PipelineDefinitionCodec {

    private static final Logger log = LoggerFactory.getLogger(PipelineDefinitionCodec.class);

    private final ObjectMapper yamlMapper;

    public PipelineDefinitionCodec() {
        YAMLFactory factory = YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .build();
        this.yamlMapper = new ObjectMapper(factory)
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
    }

    public PipelineDefinition read(String yaml) {
        try {
            return checkNotEmpty(yamlMapper.readValue(yaml, PipelineDefinition.class), "<inline>");
        } catch (JsonProcessingException e) {
            throw parseError("<inline>", e);
        }
    }

    public PipelineDefinition read(Path file) {
        log.info("加载流水线定义: {}", file);
        try (InputStream in = Files.newInputStream(file)) {
            return checkNotEmpty(yamlMapper.readValue(in, PipelineDefinition.class), file.toString());
        } catch (JsonProcessingException e) {
            throw parseError(file.toString(), e);
        } catch (IOException e) {
            throw new PipelineException(ErrorType.VALIDATION_ERROR, "无法读取流水线定义文件: " + file, e);
        }
    }

    public PipelineDefinition read(Resource resource) {
        log.info("加载流水线定义: {}", resource.getDescription());
        try (InputStream in = resource.getInputStream()) {
            return checkNotEmpty(yamlMapper.readValue(in, PipelineDefinition.class), resource.getDescription());
        } catch (JsonProcessingException e) {
            throw parseError(resource.getDescription(), e);
        } catch (IOException e) {
            throw new PipelineException(ErrorType.VALIDATION_ERROR,
                    "无法读取流水线定义: " + resource.getDescription(), e);
        }
    }

    public String write(PipelineDefinition definition) {
        try {
            return yamlMapper.writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new PipelineException(ErrorType.SYSTEM_ERROR, "流水线定义序列化失败: " + definition.getName(), e);
        }
    }

    public void write(PipelineDefinition definition, Path file) {
        try {
            Files.writeString(file, write(definition), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PipelineException(ErrorType.SYSTEM_ERROR, "无法写入流水线定义文件: " + file, e);
        }
    }

    private PipelineDefinition checkNotEmpty(PipelineDefinition definition, String source) {
        if (definition == null) {
            throw new PipelineValidationException(List.of(
                    ValidationError.of(source, "流水线定义为空", ValidationError.PARSE_ERROR)));
        }
        return definition;
    }

    private PipelineValidationException parseError(String source, JsonProcessingException e) {
        String location = e.getLocation() != null
                ? source + ":" + e.getLocation().getLineNr() + ":" + e.getLocation().getColumnNr()
                : source;
        log.error("流水线定义解析失败: {}", location);
        return new PipelineValidationException(List.of(
                ValidationError.of(location, e.getOriginalMessage(), ValidationError.PARSE_ERROR)), e);
    }
}
