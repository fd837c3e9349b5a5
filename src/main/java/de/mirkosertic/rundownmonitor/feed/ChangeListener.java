package de.mirkosertic.rundownmonitor.feed;

import java.util.List;

@FunctionalInterface
public interface ChangeListener {

    void onChanges(List<ChangeRecord> changes);
}
