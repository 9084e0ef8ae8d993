package xyz.firestige.pipeline.infrastructure.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import xyz.firestige.pipeline.domain.run.event.RunCompletedEvent;
import xyz.firestige.pipeline.domain.run.event.RunStartedEvent;
import xyz.firestige.pipeline.domain.run.event.StageCompletedEvent;

/**
 * 运行事件日志监听器
 */
public class RunEventLogger {

    private static final Logger log = LoggerFactory.getLogger(RunEventLogger.class);

    @EventListener
    public void onRunStarted(RunStartedEvent event) {
        log.info("[event] 运行开始: {} params={}", event.getRunId(), event.getParameters().keySet());
    }

    @EventListener
    public void onStageCompleted(StageCompletedEvent event) {
        log.info("[event] Stage 结束: {} {} -> {} ({})",
                event.getRunId(), event.getStagePath(), event.getStatus(), event.getDuration());
    }

    @EventListener
    public void onRunCompleted(RunCompletedEvent event) {
        log.info("[event] 运行结束: {} -> {} ({})",
                event.getRunId(), event.getStatus(), event.getReport().getDuration());
    }
}
