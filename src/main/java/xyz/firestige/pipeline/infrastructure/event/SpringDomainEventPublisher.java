package xyz.firestige.pipeline.infrastructure.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import xyz.firestige.pipeline.domain.run.event.PipelineRunEvent;
import xyz.firestige.pipeline.domain.shared.event.DomainEventPublisher;

/**
 * 经 Spring 应用事件转发运行事件，监听方通过 {@code @EventListener} 订阅（见 {@link RunEventLogger}）
 * <p>
 * 监听器在引擎线程上同步执行，抛出的异常只记录，不回传给引擎。
 */
public class SpringDomainEventPublisher implements DomainEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(SpringDomainEventPublisher.class);

    private final ApplicationEventPublisher applicationEventPublisher;

    public SpringDomainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public void publish(PipelineRunEvent event) {
        try {
            applicationEventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.warn("运行事件监听器异常: {} {}", event.getClass().getSimpleName(), event.getRunId(), e);
        }
    }
}
