package io.canopy.core.communication.node;

import io.canopy.core.blackboard.Blackboard;
import io.canopy.core.communication.CommunicationMiddleware;
import io.canopy.core.exception.TaskNotFoundException;
import io.canopy.core.node.Status;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Completes the task whose id is stored on the blackboard.
///
/// Fails when no id is stored, the task is unknown or it is not claimed.
public class CommTaskComplete extends CommunicationLeaf {

    public static final String TASK_ID_KEY = "taskIdKey";
    public static final String RESULT_KEY = "resultKey";

    private final String taskIdKey;
    private final String resultKey;

    public CommTaskComplete(String name, CommunicationMiddleware middleware, String taskIdKey, String resultKey) {
        super(name, middleware, Set.of(TASK_ID_KEY, RESULT_KEY));
        this.taskIdKey = Objects.requireNonNull(taskIdKey, "taskIdKey must not be null");
        this.resultKey = resultKey;
    }

    @Override
    protected Status communicate(Blackboard blackboard) throws TaskNotFoundException {
        Object taskId = blackboard.get(resolveKey(TASK_ID_KEY, taskIdKey));
        if (taskId == null) {
            return Status.FAILURE;
        }
        String key = resolveKey(RESULT_KEY, resultKey);
        Object result = key == null ? null : blackboard.get(key);
        return getMiddleware().completeTask(taskId.toString(), result) ? Status.SUCCESS : Status.FAILURE;
    }

    @Override
    public Map<String, Object> describeAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(TASK_ID_KEY, taskIdKey);
        if (resultKey != null) {
            attributes.put(RESULT_KEY, resultKey);
        }
        return attributes;
    }
}
