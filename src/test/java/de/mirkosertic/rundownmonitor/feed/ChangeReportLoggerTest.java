package de.mirkosertic.rundownmonitor.feed;

import de.mirkosertic.rundownmonitor.label.EntryInfo;
import de.mirkosertic.rundownmonitor.label.Label;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ChangeReportLoggerTest {

    @Test
    void shouldDescribeMatchingLabelsAndReferences() {
        // Given
        final Label label = new Label("CG2", "X_Total", "https://x.com/a/status/1");
        final EntryInfo info = new EntryInfo("APERTURA", "READY", "jgarcia", "1718031600", "45",
                List.of("[CG2] 20 X_Total -- 1: |https://x.com/a/status/1|"), List.of(label), List.of(label),
                List.of("https://x.com/a/status/1"));
        final ChangeRecord change = new ChangeRecord("MORNING", "STORY1", info, Instant.parse("2024-06-10T18:00:00Z"));

        // When
        final String report = ChangeReportLogger.format(change);

        // Then
        assertThat(report)
                .contains("MORNING")
                .contains("STORY1")
                .contains("APERTURA")
                .contains("modified by jgarcia")
                .contains("[CG2] X_Total -> https://x.com/a/status/1")
                .contains("Fetch:    https://x.com/a/status/1");
    }

    @Test
    void shouldHandleEntriesWithoutMonitoredLabels() {
        final EntryInfo info = new EntryInfo("", "", "", "", "", List.of(), List.of(), List.of(), List.of());
        final ChangeRecord change = new ChangeRecord("EVENING", "STORY9", info, Instant.EPOCH);

        assertThat(ChangeReportLogger.format(change)).contains("Title:    -").contains("none of 0 labels");
        assertThatCode(() -> new ChangeReportLogger().onChanges(List.of(change))).doesNotThrowAnyException();
    }
}
