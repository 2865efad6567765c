package io.canopy.core.node.composite;

import io.canopy.core.node.Node;
import io.canopy.core.node.Policy;
import io.canopy.core.node.Status;
import io.canopy.core.util.NamedThreadFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/// Ticks all children concurrently and resolves their statuses with a {@link Policy}.
///
/// Each tick submits every child to the executor, waits for all of them and then
/// counts successes, failures and running children. An empty parallel succeeds.
///
/// ### Executor
/// Without an explicit executor the node uses a shared cached pool of daemon threads.
/// An explicitly supplied pool must be able to run nested parallel nodes, so a small
/// fixed pool shared by deeply nested parallels can starve.
///
/// @implNote Children are ticked exactly once per parallel tick. If the ticking thread is
/// interrupted while waiting, outstanding child ticks are cancelled and the tick fails.
///
/// @see Policy
public class Parallel extends CompositeNode {

    private static final Logger logger = Logger.getLogger(Parallel.class.getName());

    private static final ExecutorService SHARED_EXECUTOR =
            Executors.newCachedThreadPool(new NamedThreadFactory("canopy-parallel"));

    private final Policy policy;
    private final ExecutorService executor;

    /// Creates a parallel node on the shared executor.
    ///
    /// @param name node name, not null
    /// @param policy resolution policy, not null
    /// @param children initial children, not null
    public Parallel(String name, Policy policy, Node... children) {
        this(name, policy, SHARED_EXECUTOR, children);
    }

    /// Creates a parallel node on a caller supplied executor.
    ///
    /// @param name node name, not null
    /// @param policy resolution policy, not null
    /// @param executor pool used to tick the children, not null
    /// @param children initial children, not null
    public Parallel(String name, Policy policy, ExecutorService executor, Node... children) {
        super(name, children);
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    @Override
    protected Status doTick() throws InterruptedException {
        List<Node> snapshot = List.copyOf(getChildren());
        if (snapshot.isEmpty()) {
            return Status.SUCCESS;
        }

        List<Future<Status>> futures = new ArrayList<>(snapshot.size());
        for (Node child : snapshot) {
            futures.add(executor.submit(child::tick));
        }

        int succeeded = 0;
        int failed = 0;
        int running = 0;
        for (int i = 0; i < futures.size(); i++) {
            Status result;
            try {
                result = futures.get(i).get();
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                throw e;
            } catch (ExecutionException e) {
                logger.warning(
                        "Child '"
                                + snapshot.get(i).getName()
                                + "' of parallel '"
                                + getName()
                                + "' raised: "
                                + e.getCause());
                result = Status.FAILURE;
            }
            switch (result) {
                case SUCCESS -> succeeded++;
                case FAILURE -> failed++;
                case RUNNING -> running++;
            }
        }
        return resolve(policy, succeeded, failed, running);
    }

    /// Applies a policy to the counted child results.
    ///
    /// @param policy resolution policy, not null
    /// @param succeeded number of children that succeeded
    /// @param failed number of children that failed
    /// @param running number of children still running
    /// @return the aggregate status, never null
    static Status resolve(Policy policy, int succeeded, int failed, int running) {
        int total = succeeded + failed + running;
        return switch (policy) {
            case SUCCEED_ON_ALL -> failed > 0
                    ? Status.FAILURE
                    : running > 0 ? Status.RUNNING : Status.SUCCESS;
            case SUCCEED_ON_ONE -> succeeded > 0
                    ? Status.SUCCESS
                    : running > 0 ? Status.RUNNING : Status.FAILURE;
            case FAIL_ON_ALL -> total > 0 && failed == total
                    ? Status.FAILURE
                    : running > 0 ? Status.RUNNING : Status.SUCCESS;
            case FAIL_ON_ONE -> failed > 0
                    ? Status.FAILURE
                    : running > 0 ? Status.RUNNING : Status.SUCCESS;
        };
    }

    public Policy getPolicy() {
        return policy;
    }

    @Override
    public Map<String, Object> describeAttributes() {
        return Map.of("policy", policy.name());
    }
}
