package de.mirkosertic.rundownmonitor.monitor;

import de.mirkosertic.rundownmonitor.feed.ChangeListener;
import de.mirkosertic.rundownmonitor.feed.ChangeRecord;
import de.mirkosertic.rundownmonitor.feed.FeedReader;
import de.mirkosertic.rundownmonitor.feed.FeedWatcher;
import de.mirkosertic.rundownmonitor.feed.PollResult;
import de.mirkosertic.rundownmonitor.reconcile.ReconciliationResult;
import de.mirkosertic.rundownmonitor.reconcile.ReconciliationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Drives all rundown watchers from a single control loop.
 * <p>
 * A round polls every watcher whose interval has elapsed, one after the other, and then reconciles
 * the asset store once against the union of the active references of all watchers. Rundowns
 * that were not polled in this round contribute the references of their last completed poll.
 */
public class RundownMonitorService {

    private static final Logger logger = LoggerFactory.getLogger(RundownMonitorService.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final FeedReader reader;
    private final List<FeedWatcher> watchers;
    private final ReconciliationService reconciliationService;
    private final ChangeListener changeListener;
    private final long loopDelayMs;

    private volatile ScheduledExecutorService loop;

    public RundownMonitorService(final FeedReader reader,
                                 final List<FeedWatcher> watchers,
                                 final ReconciliationService reconciliationService,
                                 final ChangeListener changeListener,
                                 final long loopDelayMs) {
        this.reader = reader;
        this.watchers = List.copyOf(watchers);
        this.reconciliationService = reconciliationService;
        this.changeListener = changeListener;
        this.loopDelayMs = loopDelayMs;
    }

    /**
     * Run one round.
     *
     * @return the change records of all watchers polled in this round
     */
    public List<ChangeRecord> runRound() {
        // Step 1: Make sure the server is reachable, otherwise no watcher uses up its interval
        if (!reader.ensureConnected()) {
            logger.error("Server not reachable, skipping this round");
            return List.of();
        }

        // Step 2: Poll the due watchers
        final List<ChangeRecord> changes = new ArrayList<>();
        boolean anyPolled = false;
        for (final FeedWatcher watcher : watchers) {
            if (!watcher.isDue()) {
                continue;
            }
            anyPolled = true;
            try {
                final PollResult result = watcher.poll();
                changes.addAll(result.changes());
            } catch (final RuntimeException e) {
                logger.error("Poll failed, continuing with the next rundown", e);
            }
        }

        // Step 3: Reconcile once against the references of all watchers
        if (anyPolled) {
            final Set<String> activeReferences = new LinkedHashSet<>();
            for (final FeedWatcher watcher : watchers) {
                activeReferences.addAll(watcher.getActiveReferences());
            }
            final ReconciliationResult result = reconciliationService.reconcile(activeReferences);
            if (result.isUnchanged()) {
                logger.debug("Reconciled {} active references in {}ms, nothing changed",
                        activeReferences.size(), result.reconciliationTimeMs());
            } else {
                logger.info("Reconciled {} active references in {}ms: {} new, {} obsolete, {} indexed",
                        activeReferences.size(), result.reconciliationTimeMs(), result.newReferences().size(),
                        result.obsoleteReferences().size(), result.indexedCount());
            }
        }

        // Step 4: Report
        if (!changes.isEmpty()) {
            try {
                changeListener.onChanges(List.copyOf(changes));
            } catch (final RuntimeException e) {
                logger.error("Change listener failed", e);
            }
        }
        return changes;
    }

    /**
     * Run a single round and close the connection.
     */
    public List<ChangeRecord> runOnce() {
        try {
            return runRound();
        } finally {
            closeReader();
        }
    }

    /**
     * Start the control loop. Rounds run back to back with {@code loopDelayMs} in between.
     */
    public synchronized void start() {
        if (loop != null) {
            logger.warn("Monitor already running");
            return;
        }
        logger.info("Starting monitor for {} rundowns, loop delay {}ms", watchers.size(), loopDelayMs);
        final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "rundown-monitor");
            t.setDaemon(false);
            return t;
        });
        executor.scheduleWithFixedDelay(() -> {
            try {
                runRound();
            } catch (final RuntimeException e) {
                logger.error("Error during monitor round", e);
            }
        }, 0, loopDelayMs, TimeUnit.MILLISECONDS);
        this.loop = executor;
    }

    /**
     * Stop the control loop. A round that is in progress is allowed to finish.
     */
    public synchronized void stop() {
        final ScheduledExecutorService executor = this.loop;
        if (executor == null) {
            return;
        }
        logger.info("Stopping monitor...");
        this.loop = null;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Monitor round did not finish within {}s, interrupting", SHUTDOWN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        closeReader();
        logger.info("Monitor stopped");
    }

    public boolean isRunning() {
        return loop != null;
    }

    private void closeReader() {
        try {
            reader.close();
        } catch (final IOException e) {
            logger.warn("Error closing connection", e);
        }
    }
}
