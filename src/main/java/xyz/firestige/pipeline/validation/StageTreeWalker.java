package xyz.firestige.pipeline.validation;

import xyz.firestige.pipeline.domain.definition.StageDefinition;

import java.util.List;

/**
 * 先序遍历 Stage 树，回调每个 Stage 及其路径（如 {@code test/unit}）
 */
public final class StageTreeWalker {

    public static final String PATH_SEPARATOR = "/";

    @FunctionalInterface
    public interface StageVisitor {
        void visit(String path, StageDefinition stage);
    }

    private StageTreeWalker() {
    }

    public static void walk(List<StageDefinition> stages, StageVisitor visitor) {
        walk(null, stages, visitor);
    }

    private static void walk(String parentPath, List<StageDefinition> stages, StageVisitor visitor) {
        for (int i = 0; i < stages.size(); i++) {
            StageDefinition stage = stages.get(i);
            String path = childPath(parentPath, stage.getName() != null ? stage.getName() : "#" + i);
            visitor.visit(path, stage);
            walk(path, stage.getParallel(), visitor);
        }
    }

    public static String childPath(String parentPath, String name) {
        return parentPath == null ? name : parentPath + PATH_SEPARATOR + name;
    }

    /**
     * 校验错误里使用的 Stage 定位
     */
    public static String field(String path) {
        return "stage[" + path + "]";
    }
}
