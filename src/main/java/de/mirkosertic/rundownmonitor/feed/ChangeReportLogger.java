package de.mirkosertic.rundownmonitor.feed;

import de.mirkosertic.rundownmonitor.label.EntryInfo;
import de.mirkosertic.rundownmonitor.label.Label;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * {@link ChangeListener} that writes a readable block per new or modified entry to the log.
 */
public class ChangeReportLogger implements ChangeListener {

    private static final Logger logger = LoggerFactory.getLogger(ChangeReportLogger.class);

    @Override
    public void onChanges(final List<ChangeRecord> changes) {
        if (changes.isEmpty()) {
            return;
        }
        logger.info("{} new or modified entries", changes.size());
        for (final ChangeRecord change : changes) {
            logger.info("{}", format(change));
        }
    }

    static String format(final ChangeRecord change) {
        final EntryInfo info = change.info();
        final StringBuilder report = new StringBuilder();
        report.append("Change in rundown ").append(change.feedName())
                .append(" at ").append(change.timestamp()).append('\n');
        report.append("  Entry:    ").append(change.entryName()).append('\n');
        report.append("  Title:    ").append(orDash(info.title())).append('\n');
        report.append("  Status:   ").append(orDash(info.status()));
        if (!info.modifiedBy().isEmpty()) {
            report.append(" (modified by ").append(info.modifiedBy());
            if (!info.modifiedDate().isEmpty()) {
                report.append(", ").append(info.modifiedDate());
            }
            report.append(')');
        }
        report.append('\n');

        if (info.matchingLabels().isEmpty()) {
            report.append("  Labels:   none of ").append(info.labels().size()).append(" labels is monitored");
        } else {
            report.append("  Labels:");
            for (final Label label : info.matchingLabels()) {
                report.append("\n    [").append(label.channel()).append("] ")
                        .append(label.kind()).append(" -> ").append(orDash(label.payload()));
            }
            if (!info.references().isEmpty()) {
                report.append("\n  Fetch:    ").append(String.join(", ", info.references()));
            }
        }
        return report.toString();
    }

    private static String orDash(final String value) {
        return value == null || value.isEmpty() ? "-" : value;
    }
}
