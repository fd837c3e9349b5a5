package de.mirkosertic.rundownmonitor.feed;

import java.util.List;

/**
 * Outcome of one {@link FeedWatcher#poll()} cycle.
 */
public record PollResult(FeedWatcher.State state, List<ChangeRecord> changes) {

    public PollResult {
        changes = List.copyOf(changes);
    }

    public static PollResult failed() {
        return new PollResult(FeedWatcher.State.FAILED, List.of());
    }

    public boolean isCompleted() {
        return state == FeedWatcher.State.COMPLETED;
    }
}
