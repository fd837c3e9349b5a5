package de.mirkosertic.rundownmonitor.config;

import java.util.List;

/**
 * Settings of one watched rundown.
 */
public record FeedSettings(
        /** Display name used in logs and change reports. */
        String name,
        /** Location of the rundown on the server, e.g. {@code SHOW.MORNING.RUNDOWN}. */
        String path,
        /** Minimum number of seconds between two polls of this rundown. */
        long intervalSeconds,
        /** Entry filter: {@code LABELS}, a literal substring or a regular expression. */
        String filter,
        /** Label kinds whose payloads are collected as references. */
        List<String> allowedKinds
) {

    public FeedSettings {
        allowedKinds = List.copyOf(allowedKinds);
    }
}
