package xyz.firestige.pipeline.domain.definition;

/**
 * Stage 形态：顺序步骤 或 并行分组
 */
public enum StageKind {
    STEPS,
    PARALLEL
}
