package de.mirkosertic.rundownmonitor.feed;

import de.mirkosertic.rundownmonitor.config.FeedSettings;
import de.mirkosertic.rundownmonitor.label.EntryInfo;
import de.mirkosertic.rundownmonitor.label.LabelParser;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns the poll cycle of a single rundown.
 * <p>
 * Each cycle lists the rundown, reads every entry that passes the feed filter, collects the
 * references of its allow-listed labels and compares a content fingerprint against the previous
 * cycle to report new or changed entries.
 * <p>
 * A cycle that cannot list the rundown leaves both the active references and the fingerprints of
 * the last successful cycle in place. Losing the connection for a moment must not look like every
 * label was removed from the rundown.
 */
public class FeedWatcher {

    private static final Logger logger = LoggerFactory.getLogger(FeedWatcher.class);

    private final FeedSettings settings;
    private final FeedReader reader;
    private final LabelParser labelParser;
    private final Clock clock;

    private final Map<String, String> fingerprints = new HashMap<>();
    private List<String> activeReferences = List.of();
    private @Nullable Instant lastPollStart;
    private State state = State.IDLE;

    public FeedWatcher(final FeedSettings settings, final FeedReader reader,
                       final LabelParser labelParser, final Clock clock) {
        this.settings = settings;
        this.reader = reader;
        this.labelParser = labelParser;
        this.clock = clock;
    }

    /**
     * @return true if this rundown was never polled or its interval has elapsed since the last poll started
     */
    public boolean isDue() {
        final Instant last = lastPollStart;
        if (last == null) {
            return true;
        }
        final Duration elapsed = Duration.between(last, clock.instant());
        return elapsed.compareTo(Duration.ofSeconds(settings.intervalSeconds())) >= 0;
    }

    /**
     * Run one poll cycle.
     *
     * @return the cycle outcome including the change records of new or modified entries
     */
    public PollResult poll() {
        logger.info("Polling rundown {} at {}", settings.name(), settings.path());
        lastPollStart = clock.instant();
        state = State.POLLING;
        try {
            return runCycle();
        } catch (final RuntimeException e) {
            logger.error("Poll of rundown {} failed, keeping previous references", settings.name(), e);
            return finish(PollResult.failed());
        }
    }

    private PollResult runCycle() {
        final List<Entry> entries;
        try {
            entries = reader.listEntries(settings.path());
        } catch (final IOException e) {
            logger.error("Failed to list rundown {} at {}", settings.name(), settings.path(), e);
            return finish(PollResult.failed());
        }
        if (entries.isEmpty()) {
            logger.warn("No entries found in rundown {} at {}, keeping previous references",
                    settings.name(), settings.path());
            return finish(PollResult.failed());
        }

        final List<String> currentReferences = new ArrayList<>();
        final List<ChangeRecord> changes = new ArrayList<>();

        for (final Entry entry : entries) {
            if (entry.directory() || entry.name() == null || entry.name().isBlank()) {
                continue;
            }

            try {
                processEntry(entry.name(), currentReferences, changes);
            } catch (final RuntimeException e) {
                logger.warn("Skipping entry {} of rundown {}", entry.name(), settings.name(), e);
            }
        }

        activeReferences = List.copyOf(currentReferences);
        logger.info("Rundown {}: {} entries, {} active references, {} changes",
                settings.name(), entries.size(), activeReferences.size(), changes.size());
        return finish(new PollResult(State.COMPLETED, changes));
    }

    private void processEntry(final String entryName, final List<String> currentReferences,
                              final List<ChangeRecord> changes) {
        final String content = readQuietly(entryName);
        if (content == null || content.isEmpty()) {
            return;
        }

        if (!labelParser.hasMatch(content, settings.filter(), settings.allowedKinds())) {
            return;
        }

        final EntryInfo info = labelParser.extractEntryInfo(content, settings.allowedKinds());
        final String fingerprint = ContentFingerprint.of(content);
        currentReferences.addAll(info.references());

        final String previous = fingerprints.put(entryName, fingerprint);
        if (!fingerprint.equals(previous)) {
            logger.debug("Entry {} in rundown {} is new or changed", entryName, settings.name());
            changes.add(new ChangeRecord(settings.name(), entryName, info, clock.instant()));
        }
    }

    private @Nullable String readQuietly(final String entryName) {
        try {
            return reader.readEntry(entryName);
        } catch (final IOException e) {
            logger.warn("Failed to read entry {} of rundown {}", entryName, settings.name(), e);
            return null;
        }
    }

    private PollResult finish(final PollResult result) {
        state = result.state();
        return result;
    }

    /**
     * @return the references of the last completed cycle, in rundown order, possibly with duplicates
     */
    public List<String> getActiveReferences() {
        return activeReferences;
    }

    /**
     * @return the state the last cycle ended in, or {@link State#IDLE} before the first poll
     */
    public State getState() {
        return state;
    }

    Map<String, String> getFingerprints() {
        return Map.copyOf(fingerprints);
    }

    public enum State {
        IDLE,
        POLLING,
        COMPLETED,
        FAILED
    }
}
