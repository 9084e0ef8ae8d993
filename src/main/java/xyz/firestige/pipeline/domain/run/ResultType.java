package xyz.firestige.pipeline.domain.run;

/**
 * 执行结果节点类型
 */
public enum ResultType {
    STAGE,
    PARALLEL,
    STEP
}
