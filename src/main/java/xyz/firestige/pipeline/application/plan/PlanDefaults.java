package xyz.firestige.pipeline.application.plan;

import java.time.Duration;

/**
 * 定义未给出全局选项时使用的默认值（来自 {@code pipeline.*} 配置）
 */
public record PlanDefaults(int concurrencyLimit, int retention, Duration stepTimeout) {

    public static PlanDefaults standard() {
        return new PlanDefaults(4, 10, Duration.ofHours(1));
    }
}
