package xyz.firestige.pipeline.domain.shared.event;

import xyz.firestige.pipeline.domain.run.event.PipelineRunEvent;

/**
 * 运行事件发布器
 * <p>
 * 引擎在运行与 Stage 的开始、结束时发布事件；发布失败不影响运行结果。
 */
public interface DomainEventPublisher {

    void publish(PipelineRunEvent event);
}
