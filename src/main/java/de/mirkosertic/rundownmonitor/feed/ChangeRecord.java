package de.mirkosertic.rundownmonitor.feed;

import de.mirkosertic.rundownmonitor.label.EntryInfo;

import java.time.Instant;

/**
 * Emitted by a {@link FeedWatcher} when an entry is seen for the first time or its content changed.
 * Change records only feed reporting; the asset store is driven by the active references.
 */
public record ChangeRecord(
        String feedName,
        String entryName,
        EntryInfo info,
        Instant timestamp
) {
}
