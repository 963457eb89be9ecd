package io.swarmmesh.agent;

import io.swarmmesh.model.TaskResult;

/**
 * What an agent returned for one task. {@code output} is set on success, {@code error} on failure.
 */
public record AgentResult(
        boolean success,
        String output,
        String error
) {
    public static AgentResult ok(String output) {
        return new AgentResult(true, output, null);
    }

    public static AgentResult fail(String error) {
        return new AgentResult(false, null, error);
    }

    /**
     * The result the host reports back through the task-end hook.
     */
    public TaskResult taskResult() {
        return success ? TaskResult.SUCCESS : TaskResult.FAILURE;
    }
}
