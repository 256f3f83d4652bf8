package io.scanrelay.task;

import com.fasterxml.jackson.databind.JsonNode;
import io.scanrelay.model.JobType;

public interface TaskHandler {
    JobType type();

    /**
     * Runs the task body. Long-running bodies should call
     * {@link TaskContext#checkpoint(int, String)} between units of work.
     */
    JsonNode execute(TaskContext context) throws Exception;
}
