package de.mirkosertic.searchvalidator.run;

import de.mirkosertic.searchvalidator.report.ResultAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Logs the progress of a running validation at a fixed interval.
 */
public class RunProgressReporter implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RunProgressReporter.class);

    private final ResultAggregator aggregator;
    private final long intervalMs;
    private final long startNanos = System.nanoTime();

    private final ScheduledExecutorService progressTimerExecutor =
            Executors.newSingleThreadScheduledExecutor(r -> {
                final Thread t = new Thread(r, "progress-timer");
                t.setDaemon(true);
                return t;
            });
    private volatile ScheduledFuture<?> progressTimerFuture;

    public RunProgressReporter(final ResultAggregator aggregator, final long intervalMs) {
        this.aggregator = aggregator;
        this.intervalMs = intervalMs;
    }

    public void start() {
        if (intervalMs <= 0) {
            return;
        }
        progressTimerFuture = progressTimerExecutor.scheduleAtFixedRate(
                this::logProgress,
                intervalMs,
                intervalMs,
                TimeUnit.MILLISECONDS
        );
        logger.debug("Started progress logging every {}ms", intervalMs);
    }

    void logProgress() {
        try {
            final ResultAggregator.Progress progress = aggregator.progress();
            final double elapsedSeconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
            logger.info("Validated {}/{} cases ({} passed, {} errors, {} cases/sec)",
                    progress.completed(),
                    progress.total(),
                    progress.passed(),
                    progress.errors(),
                    String.format("%.1f", elapsedSeconds > 0 ? progress.completed() / elapsedSeconds : 0.0));
        } catch (final RuntimeException e) {
            // a throwing task would silently end the schedule
            logger.error("Failed to log progress", e);
        }
    }

    @Override
    public void close() {
        final ScheduledFuture<?> future = progressTimerFuture;
        if (future != null) {
            future.cancel(false);
            progressTimerFuture = null;
        }
        progressTimerExecutor.shutdownNow();
    }
}
