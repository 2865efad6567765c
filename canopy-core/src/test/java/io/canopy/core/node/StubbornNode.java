package io.canopy.core.node;

import io.canopy.core.node.leaf.LeafNode;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/// Leaf that works for a fixed time per tick and ignores interrupts while doing so.
public class StubbornNode extends LeafNode {

    private final Duration work;
    private final CountDownLatch entered = new CountDownLatch(1);
    private final AtomicBoolean busy = new AtomicBoolean();
    private final AtomicInteger completed = new AtomicInteger();

    public StubbornNode(String name, Duration work) {
        super(name, Set.of());
        this.work = work;
    }

    @Override
    protected Status doTick() {
        busy.set(true);
        entered.countDown();
        long end = System.nanoTime() + work.toNanos();
        while (System.nanoTime() < end) {
            Thread.onSpinWait();
        }
        completed.incrementAndGet();
        busy.set(false);
        return Status.RUNNING;
    }

    public boolean awaitEntered(Duration timeout) throws InterruptedException {
        return entered.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isBusy() {
        return busy.get();
    }

    public int getCompleted() {
        return completed.get();
    }
}
