package de.mirkosertic.rundownmonitor.feed;

/**
 * One item of a rundown listing. Names are unique within a listing at a given time.
 */
public record Entry(String name, boolean directory) {
}
