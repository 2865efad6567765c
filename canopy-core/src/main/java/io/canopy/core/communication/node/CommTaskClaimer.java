package io.canopy.core.communication.node;

import io.canopy.core.blackboard.Blackboard;
import io.canopy.core.communication.CommunicationMiddleware;
import io.canopy.core.communication.Task;
import io.canopy.core.exception.TaskNotFoundException;
import io.canopy.core.node.Status;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/// Claims the highest priority task this node is able to perform.
///
/// Tasks are tried in the order the board offers them, so losing a race for one task
/// moves on to the next. The claimed id and the task data are stored on the blackboard.
/// Fails when nothing could be claimed.
public class CommTaskClaimer extends CommunicationLeaf {

    public static final String CAPABILITIES = "capabilities";
    public static final String TASK_ID_KEY = "taskIdKey";
    public static final String TASK_DATA_KEY = "taskDataKey";

    private final Set<String> capabilities;
    private final String taskIdKey;
    private final String taskDataKey;

    /// @param name node name, also the claimant name, not null
    /// @param middleware middleware owning the task board, not null
    /// @param capabilities capabilities offered, not null
    /// @param taskIdKey key receiving the claimed id, may be null
    /// @param taskDataKey key receiving the task data, may be null
    public CommTaskClaimer(
            String name,
            CommunicationMiddleware middleware,
            Set<String> capabilities,
            String taskIdKey,
            String taskDataKey) {
        super(name, middleware, Set.of(TASK_ID_KEY, TASK_DATA_KEY));
        this.capabilities = Set.copyOf(capabilities);
        this.taskIdKey = taskIdKey;
        this.taskDataKey = taskDataKey;
    }

    @Override
    protected Status communicate(Blackboard blackboard) throws TaskNotFoundException {
        List<Task> available = getMiddleware().getAvailableTasks(capabilities);
        for (Task task : available) {
            if (getMiddleware().claimTask(task.getId(), source(), capabilities)) {
                store(blackboard, resolveKey(TASK_ID_KEY, taskIdKey), task.getId());
                store(blackboard, resolveKey(TASK_DATA_KEY, taskDataKey), task.getData());
                return Status.SUCCESS;
            }
        }
        return Status.FAILURE;
    }

    public Set<String> getCapabilities() {
        return capabilities;
    }

    @Override
    public Map<String, Object> describeAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(CAPABILITIES, List.copyOf(new TreeSet<>(capabilities)));
        if (taskIdKey != null) {
            attributes.put(TASK_ID_KEY, taskIdKey);
        }
        if (taskDataKey != null) {
            attributes.put(TASK_DATA_KEY, taskDataKey);
        }
        return attributes;
    }
}
