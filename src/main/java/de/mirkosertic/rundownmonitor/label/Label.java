package de.mirkosertic.rundownmonitor.label;

/**
 * A structured label parsed from a single {@code <ap>} tag of a rundown entry.
 */
public record Label(
        /** Short channel code such as {@code CG1}, or an empty string if the tag carries none. */
        String channel,
        /** Category of the label, e.g. {@code X_Total} or {@code Faldon}. Never empty. */
        String kind,
        /** Free text or URL carried by the label, possibly empty. */
        String payload
) {

    public boolean hasPayload() {
        return !payload.isEmpty();
    }
}
