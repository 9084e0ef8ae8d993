package xyz.firestige.pipeline.validation;

import xyz.firestige.pipeline.domain.definition.PipelineDefinition;

/**
 * 流水线定义校验器接口
 * 每个实现负责一个方面，发现的问题全部写入结果而不是抛出
 */
public interface DefinitionValidator {

    /**
     * 校验定义
     *
     * @param definition 流水线定义
     * @return 校验结果
     */
    ValidationResult validate(PipelineDefinition definition);

    /**
     * 获取校验器名称
     */
    String getValidatorName();

    /**
     * 获取执行顺序，数字越小越先执行
     */
    default int getOrder() {
        return 100;
    }
}
