package io.canopy.core.communication;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/// Runs a batch of callbacks concurrently and waits for all of them.
///
/// A failing callback is logged and does not affect the others or the caller.
final class FanOut {

    private static final Logger logger = Logger.getLogger(FanOut.class.getName());

    /// A single callback invocation.
    @FunctionalInterface
    interface Delivery {
        void run() throws Exception;
    }

    private FanOut() {}

    /// Runs every delivery and returns once all have finished or failed.
    ///
    /// @param executor pool running the deliveries, not null
    /// @param label description used in log messages, not null
    /// @param deliveries callbacks to run, not null
    /// @return number of deliveries that failed
    static int runAll(ExecutorService executor, String label, List<Delivery> deliveries) {
        if (deliveries.isEmpty()) {
            return 0;
        }
        List<Future<?>> futures = new ArrayList<>(deliveries.size());
        for (Delivery delivery : deliveries) {
            futures.add(
                    executor.submit(
                            () -> {
                                delivery.run();
                                return null;
                            }));
        }
        int failures = 0;
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                failures++;
                logger.warning(label + " callback failed: " + e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                logger.fine(label + " delivery interrupted");
                return failures;
            }
        }
        return failures;
    }
}
