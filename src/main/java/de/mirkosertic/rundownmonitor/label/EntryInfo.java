package de.mirkosertic.rundownmonitor.label;

import java.util.List;

/**
 * Everything the monitor extracts from one rundown entry.
 */
public record EntryInfo(
        String title,
        String status,
        String modifiedBy,
        String modifiedDate,
        String audioTime,
        /** Raw bodies of all label tags, in document order. */
        List<String> labelTags,
        /** All labels that could be parsed. */
        List<Label> labels,
        /** Labels whose kind is on the allow-list. */
        List<Label> matchingLabels,
        /** Non-empty payloads of {@link #matchingLabels()}; these drive the asset store. */
        List<String> references
) {

    public EntryInfo {
        labelTags = List.copyOf(labelTags);
        labels = List.copyOf(labels);
        matchingLabels = List.copyOf(matchingLabels);
        references = List.copyOf(references);
    }
}
