package xyz.firestige.pipeline.testutil;

import xyz.firestige.pipeline.domain.run.event.PipelineRunEvent;
import xyz.firestige.pipeline.domain.shared.event.DomainEventPublisher;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * 按发布顺序记录运行事件
 */
public class RecordingEventPublisher implements DomainEventPublisher {

    private final List<PipelineRunEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void publish(PipelineRunEvent event) {
        events.add(event);
    }

    public List<PipelineRunEvent> getEvents() {
        return new ArrayList<>(events);
    }

    public <T extends PipelineRunEvent> List<T> eventsOfType(Class<T> type) {
        return events.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }
}
