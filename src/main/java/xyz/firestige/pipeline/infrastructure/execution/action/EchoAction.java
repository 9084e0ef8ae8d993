package xyz.firestige.pipeline.infrastructure.execution.action;

/**
 * 输出一条消息（{@code echo}），参数 {@code message}
 */
public class EchoAction implements StepAction {

    public static final String ACTION_ID = "echo";

    @Override
    public String getActionId() {
        return ACTION_ID;
    }

    @Override
    public ActionOutcome invoke(ActionRequest request) {
        String message = request.getArgument("message", "");
        for (String line : message.split("\\r?\\n", -1)) {
            request.getOutput().line(line);
        }
        return ActionOutcome.success();
    }
}
