package dev.jobfeed.queue;

import dev.jobfeed.model.TaskType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class TaskHandlerRegistry {

    private final Map<TaskType, TaskHandler> handlers = new EnumMap<>(TaskType.class);

    public TaskHandlerRegistry(List<TaskHandler> handlers) {
        for (TaskHandler handler : handlers) {
            TaskHandler previous = this.handlers.put(handler.type(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers for " + handler.type() + ": "
                        + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        }
    }

    public Optional<TaskHandler> find(TaskType type) {
        return Optional.ofNullable(handlers.get(type));
    }
}
