package de.mirkosertic.rundownmonitor.reconcile;

import java.util.Set;

/**
 * Immutable result of one reconciliation pass between the active references and the local asset store.
 */
public record ReconciliationResult(
        /** Active references that were not known before this pass. */
        Set<String> newReferences,
        /** Known references that are no longer active. */
        Set<String> obsoleteReferences,
        /** Number of fetches started (their outcome is visible in the index only). */
        int fetchedCount,
        /** New references skipped because no identifier could be derived. */
        int unresolvedCount,
        /** Asset directories deleted. */
        int deletedCount,
        /** Asset directories that could not be deleted. */
        int deletionFailures,
        /** Rows in the index written by this pass. */
        int indexedCount,
        /** False if the index could not be written. */
        boolean indexWritten,
        /** Wall-clock time in milliseconds spent performing the reconciliation. */
        long reconciliationTimeMs
) {

    public ReconciliationResult {
        newReferences = Set.copyOf(newReferences);
        obsoleteReferences = Set.copyOf(obsoleteReferences);
    }

    /** True if this pass neither fetched nor removed anything. */
    public boolean isUnchanged() {
        return newReferences.isEmpty() && obsoleteReferences.isEmpty();
    }
}
