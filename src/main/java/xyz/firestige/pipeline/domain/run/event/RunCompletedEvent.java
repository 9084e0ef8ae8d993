package xyz.firestige.pipeline.domain.run.event;

import xyz.firestige.pipeline.domain.run.RunReport;

/**
 * 运行结束事件，携带最终报告
 */
public class RunCompletedEvent extends PipelineRunEvent {

    private final RunReport report;

    public RunCompletedEvent(RunReport report) {
        super(report.getRunId(), report.getStatus());
        this.report = report;
    }

    public RunReport getReport() {
        return report;
    }
}
