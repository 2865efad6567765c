package io.canopy.core.node;

/// Resolution rule applied by {@link io.canopy.core.node.composite.Parallel} once every
/// child has been ticked.
///
/// ### Resolution
/// - `SUCCEED_ON_ALL` - FAILURE if any child failed, else RUNNING if any is running, else SUCCESS
/// - `SUCCEED_ON_ONE` - SUCCESS if any child succeeded, else RUNNING if any is running, else FAILURE
/// - `FAIL_ON_ALL` - FAILURE if every child failed, else RUNNING if any is running, else SUCCESS
/// - `FAIL_ON_ONE` - FAILURE if any child failed, else RUNNING if any is running, else SUCCESS
public enum Policy {
    SUCCEED_ON_ALL,
    SUCCEED_ON_ONE,
    FAIL_ON_ALL,
    FAIL_ON_ONE
}
