package io.canopy.core.communication.node;

import io.canopy.core.blackboard.Blackboard;
import io.canopy.core.communication.CommunicationMiddleware;
import io.canopy.core.node.Status;
import io.canopy.core.util.Values;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/// Posts a task on the task board.
///
/// The new task id is stored under the task id key. Task data is read from a map on the
/// blackboard. Fails while the middleware is disabled.
public class CommTaskPublisher extends CommunicationLeaf {

    public static final String TITLE = "title";
    public static final String DESCRIPTION = "description";
    public static final String REQUIREMENTS = "requirements";
    public static final String PRIORITY = "priority";
    public static final String DATA_KEY = "dataKey";
    public static final String TASK_ID_KEY = "taskIdKey";

    private final String title;
    private final String description;
    private final Set<String> requirements;
    private final int priority;
    private final String dataKey;
    private final String taskIdKey;

    /// @param name node name, not null
    /// @param middleware middleware owning the task board, not null
    /// @param title task title, not null
    /// @param description task description, not null
    /// @param requirements capabilities a claimant needs, not null
    /// @param priority higher values are offered first
    /// @param dataKey key of the task data map, may be null
    /// @param taskIdKey key receiving the task id, may be null
    public CommTaskPublisher(
            String name,
            CommunicationMiddleware middleware,
            String title,
            String description,
            Set<String> requirements,
            int priority,
            String dataKey,
            String taskIdKey) {
        super(name, middleware, Set.of(TITLE, DESCRIPTION, PRIORITY, DATA_KEY, TASK_ID_KEY));
        this.title = Objects.requireNonNull(title, "title must not be null");
        this.description = Objects.requireNonNull(description, "description must not be null");
        this.requirements = Set.copyOf(requirements);
        this.priority = priority;
        this.dataKey = dataKey;
        this.taskIdKey = taskIdKey;
    }

    @Override
    protected Status communicate(Blackboard blackboard) {
        Map<String, Object> data = readParams(blackboard, resolveKey(DATA_KEY, dataKey));
        int effectivePriority = Values.toInt(resolve(PRIORITY, priority));
        Optional<String> taskId = getMiddleware().publishTask(
                String.valueOf(resolve(TITLE, title)),
                String.valueOf(resolve(DESCRIPTION, description)),
                requirements,
                effectivePriority,
                data);
        if (taskId.isEmpty()) {
            return Status.FAILURE;
        }
        store(blackboard, resolveKey(TASK_ID_KEY, taskIdKey), taskId.get());
        return Status.SUCCESS;
    }

    public Set<String> getRequirements() {
        return requirements;
    }

    @Override
    public Map<String, Object> describeAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(TITLE, title);
        attributes.put(DESCRIPTION, description);
        attributes.put(REQUIREMENTS, List.copyOf(new TreeSet<>(requirements)));
        attributes.put(PRIORITY, priority);
        if (dataKey != null) {
            attributes.put(DATA_KEY, dataKey);
        }
        if (taskIdKey != null) {
            attributes.put(TASK_ID_KEY, taskIdKey);
        }
        return attributes;
    }
}
