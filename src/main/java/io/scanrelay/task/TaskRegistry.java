package io.scanrelay.task;

import io.scanrelay.model.JobType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class TaskRegistry {
    private final Map<JobType, TaskHandler> handlers = Collections.synchronizedMap(new EnumMap<>(JobType.class));

    public TaskRegistry register(TaskHandler handler) {
        handlers.put(handler.type(), handler);
        return this;
    }

    public Optional<TaskHandler> find(JobType type) {
        return Optional.ofNullable(handlers.get(type));
    }

    public List<JobType> missingTypes() {
        List<JobType> missing = new ArrayList<>();
        for (JobType type : JobType.values()) {
            if (!handlers.containsKey(type)) {
                missing.add(type);
            }
        }
        return missing;
    }

    /**
     * @throws IllegalStateException when some job type has no handler
     */
    public void requireComplete() {
        List<JobType> missing = missingTypes();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No task handler registered for job type(s): " + missing);
        }
    }
}
