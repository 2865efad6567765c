package io.canopy.core.engine;

import io.canopy.core.blackboard.Blackboard;
import io.canopy.core.node.Node;
import io.canopy.core.node.Status;
import io.canopy.core.util.NamedThreadFactory;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Drives a tree's root at a fixed rate on a dedicated thread.
///
/// ### Lifecycle
/// {@link #start()} moves the manager from idle to running and {@link #stop()} back. The
/// loop ticks the root, measures how long that took and sleeps for the rest of the period.
/// An error inside one iteration is logged and the loop carries on.
///
/// ### Contracts
/// - **Precondition**: a root must be set before {@link #start()} or {@link #tickOnce()}
/// - **Invariant**: ticks of one manager never overlap, whether they come from the loop or
///   from direct {@link #tickOnce()} calls
/// - **Postcondition**: after {@link #stop()} returns no tick is in progress
///
/// @implNote Thread-safe. Configuration setters may be called while running; the next
/// iteration picks the new values up.
///
/// @see TickListener
public class TickManager {

    private static final Logger logger = Logger.getLogger(TickManager.class.getName());

    public static final double DEFAULT_TICK_RATE = 60.0;

    private static final long STOP_WARNING_SECONDS = 5;

    private final String name;
    private final ReentrantLock tickLock = new ReentrantLock();
    private final List<TickListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong tickCount = new AtomicLong();
    private final AtomicLong failedTicks = new AtomicLong();
    private final AtomicLong tickNanos = new AtomicLong();

    private volatile double tickRate;
    private volatile Node root;
    private volatile Blackboard blackboard;
    private volatile Status lastStatus = Status.FAILURE;
    private volatile Instant lastTickTime;
    private volatile Instant startedAt;
    private volatile boolean running;

    private ExecutorService loopExecutor;
    private volatile Thread loopThread;

    /// Creates an idle manager.
    ///
    /// @param name name used for the loop thread and log messages, not null
    /// @param tickRate ticks per second, positive
    public TickManager(String name, double tickRate) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        setTickRate(tickRate);
    }

    public TickManager(String name) {
        this(name, DEFAULT_TICK_RATE);
    }

    /// Starts the tick loop.
    ///
    /// Resets the root before the first tick. Starting a running manager has no effect.
    ///
    /// @throws IllegalStateException if no root is set
    public synchronized void start() {
        if (root == null) {
            throw new IllegalStateException("Tick manager '" + name + "' has no root node");
        }
        if (running) {
            return;
        }
        root.reset();
        running = true;
        startedAt = Instant.now();
        loopExecutor = Executors.newSingleThreadExecutor(new NamedThreadFactory("canopy-tick-" + name));
        loopExecutor.execute(this::runLoop);
        logger.info("Tick manager '" + name + "' started at " + tickRate + " Hz");
    }

    /// Stops the tick loop and waits for the current iteration to finish.
    ///
    /// The loop thread is interrupted, but a root that ignores interrupts is waited for
    /// however long it takes; a warning is logged every few seconds meanwhile. Interrupting
    /// the stopping thread does not cut the wait short, its interrupt status is restored on
    /// return. Stopping an idle manager has no effect. When called from the loop thread
    /// itself the loop is cancelled without waiting.
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        ExecutorService executor = loopExecutor;
        loopExecutor = null;
        executor.shutdownNow();
        if (Thread.currentThread() != loopThread) {
            awaitLoopExit(executor);
            awaitIdle();
        }
        startedAt = null;
        logger.info("Tick manager '" + name + "' stopped after " + tickCount.get() + " ticks");
    }

    /// Blocks until no tick of this manager is in progress.
    ///
    /// Returns at once when called from inside a tick of this manager.
    public void awaitIdle() {
        tickLock.lock();
        tickLock.unlock();
    }

    private void awaitLoopExit(ExecutorService executor) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    if (executor.awaitTermination(STOP_WARNING_SECONDS, TimeUnit.SECONDS)) {
                        return;
                    }
                    logger.warning("Tick loop of '" + name + "' still busy after stop, waiting for the current tick");
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /// Ticks the root once on the calling thread.
    ///
    /// Waits if another tick of this manager is in progress.
    ///
    /// @return the root's status, never null
    /// @throws IllegalStateException if no root is set
    public Status tickOnce() {
        tickLock.lock();
        try {
            Node current = root;
            if (current == null) {
                throw new IllegalStateException("Tick manager '" + name + "' has no root node");
            }
            long begin = System.nanoTime();
            Status status = current.tick();
            tickNanos.addAndGet(System.nanoTime() - begin);
            tickCount.incrementAndGet();
            lastTickTime = Instant.now();

            Status previous = lastStatus;
            lastStatus = status;
            for (TickListener listener : listeners) {
                notify(listener, previous, status);
            }
            return status;
        } finally {
            tickLock.unlock();
        }
    }

    private void notify(TickListener listener, Status previous, Status current) {
        try {
            if (previous != current) {
                listener.onStatusChange(previous, current);
            }
            listener.onTick(current);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Tick listener of '" + name + "' failed", e);
        }
    }

    private void runLoop() {
        loopThread = Thread.currentThread();
        while (running && !Thread.currentThread().isInterrupted()) {
            long begin = System.nanoTime();
            try {
                tickOnce();
            } catch (RuntimeException e) {
                failedTicks.incrementAndGet();
                logger.log(Level.WARNING, "Tick of '" + name + "' failed", e);
            }
            long periodNanos = (long) (TimeUnit.SECONDS.toNanos(1) / tickRate);
            long sleepNanos = Math.max(0, periodNanos - (System.nanoTime() - begin));
            try {
                TimeUnit.NANOSECONDS.sleep(sleepNanos);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        logger.fine("Tick loop of '" + name + "' exited");
    }

    /// Changes the tick rate.
    ///
    /// @param tickRate ticks per second, positive
    /// @throws IllegalArgumentException if the rate is not positive
    public void setTickRate(double tickRate) {
        if (!(tickRate > 0)) {
            throw new IllegalArgumentException("Tick rate must be positive, got " + tickRate);
        }
        this.tickRate = tickRate;
    }

    public double getTickRate() {
        return tickRate;
    }

    public void setRoot(Node root) {
        this.root = root;
    }

    public Node getRoot() {
        return root;
    }

    public void setBlackboard(Blackboard blackboard) {
        this.blackboard = blackboard;
    }

    public Blackboard getBlackboard() {
        return blackboard;
    }

    public void addListener(TickListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public boolean removeListener(TickListener listener) {
        return listeners.remove(listener);
    }

    public boolean isRunning() {
        return running;
    }

    public Status getLastStatus() {
        return lastStatus;
    }

    public long getTickCount() {
        return tickCount.get();
    }

    public String getName() {
        return name;
    }

    /// Returns a snapshot of the counters.
    ///
    /// @return the stats, never null
    public TickStats getStats() {
        long count = tickCount.get();
        Instant since = startedAt;
        return new TickStats(
                running,
                tickRate,
                count,
                lastStatus,
                lastTickTime,
                count == 0 ? Duration.ZERO : Duration.ofNanos(tickNanos.get() / count),
                since == null ? Duration.ZERO : Duration.between(since, Instant.now()),
                failedTicks.get());
    }

    /// Zeroes the counters and forgets the last status.
    public void resetStats() {
        tickCount.set(0);
        failedTicks.set(0);
        tickNanos.set(0);
        lastTickTime = null;
        lastStatus = Status.FAILURE;
    }
}
