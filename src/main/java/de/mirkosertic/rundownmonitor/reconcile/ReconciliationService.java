package de.mirkosertic.rundownmonitor.reconcile;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import de.mirkosertic.rundownmonitor.asset.AssetFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps the local asset store in line with the references that are currently active in the
 * watched rundowns.
 * <p>
 * Algorithm:
 * <ol>
 *   <li>Diff the active references against the known ones: new and obsolete references.</li>
 *   <li>Fetch every new reference into {@code downloadBase/<identifier>} and record it.</li>
 *   <li>Delete the asset directory of every obsolete reference and forget it.</li>
 *   <li>Rewrite the index from the state, listing only assets whose descriptor exists.</li>
 * </ol>
 * <p>
 * Individual failures are logged and never abort the pass. A reference is recorded as known even if
 * its fetch failed, so it is not fetched again on every pass; it simply stays out of the index.
 */
public class ReconciliationService {

    private static final Logger logger = LoggerFactory.getLogger(ReconciliationService.class);

    private final ReconciliationState state;
    private final AssetFetcher fetcher;
    private final ReferenceIndexWriter indexWriter;
    private final Path downloadBase;

    public ReconciliationService(final ReconciliationState state, final AssetFetcher fetcher,
                                 final ReferenceIndexWriter indexWriter, final Path downloadBase) {
        this.state = state;
        this.fetcher = fetcher;
        this.indexWriter = indexWriter;
        this.downloadBase = downloadBase.toAbsolutePath().normalize();
    }

    /**
     * Run one reconciliation pass. Calling it again with the same input changes nothing and
     * writes an identical index.
     *
     * @param activeReferences the union of all references currently active in any rundown
     * @return the outcome of the pass; never null
     */
    public synchronized ReconciliationResult reconcile(final Set<String> activeReferences) {
        final long startTime = System.currentTimeMillis();

        // Step 1: Diff against the known references
        final Set<String> known = state.references();
        final Set<String> newReferences = ImmutableSet.copyOf(Sets.difference(activeReferences, known));
        final Set<String> obsoleteReferences = ImmutableSet.copyOf(Sets.difference(known, activeReferences));

        if (!newReferences.isEmpty() || !obsoleteReferences.isEmpty()) {
            logger.info("Reconciling {} active references: {} new, {} obsolete",
                    activeReferences.size(), newReferences.size(), obsoleteReferences.size());
        }

        // Step 2: Fetch new references
        int fetched = 0;
        int unresolved = 0;
        for (final String reference : newReferences) {
            final Optional<String> identifier = resolveIdentifier(reference);
            if (identifier.isEmpty()) {
                unresolved++;
                continue;
            }
            final Path target = downloadBase.resolve(identifier.get());
            logger.info("Fetching {} into {}", reference, target);
            try {
                fetcher.fetch(reference, target);
            } catch (final RuntimeException e) {
                logger.error("Fetcher failed for {}", reference, e);
            }
            state.put(reference, identifier.get());
            fetched++;
        }

        // Step 3: Remove obsolete references
        int deleted = 0;
        int deletionFailures = 0;
        for (final String reference : obsoleteReferences) {
            final Optional<String> identifier = state.identifierFor(reference);
            if (identifier.isPresent()) {
                final Path assetDirectory = downloadBase.resolve(identifier.get());
                if (state.isSharedByOther(identifier.get(), reference)) {
                    logger.info("Keeping {} for {}: still used by another reference", assetDirectory, reference);
                } else if (Files.exists(assetDirectory)) {
                    try {
                        MoreFiles.deleteRecursively(assetDirectory, RecursiveDeleteOption.ALLOW_INSECURE);
                        deleted++;
                        logger.info("Deleted {} for obsolete reference {}", assetDirectory, reference);
                    } catch (final IOException e) {
                        deletionFailures++;
                        logger.error("Failed to delete {} for obsolete reference {}", assetDirectory, reference, e);
                    }
                }
            }
            state.remove(reference);
        }

        // Step 4: Rebuild the index from the state
        final List<IndexRecord> records = collectIndexRecords();
        boolean indexWritten = true;
        try {
            indexWriter.write(records);
        } catch (final IOException e) {
            indexWritten = false;
            logger.error("Failed to write index {}", indexWriter.getIndexFile(), e);
        }

        final long reconciliationTimeMs = System.currentTimeMillis() - startTime;
        if (!newReferences.isEmpty() || !obsoleteReferences.isEmpty()) {
            logger.info("Reconciliation done in {}ms: fetched={}, unresolved={}, deleted={}, failed deletions={}, indexed={}",
                    reconciliationTimeMs, fetched, unresolved, deleted, deletionFailures, records.size());
        }

        return new ReconciliationResult(newReferences, obsoleteReferences, fetched, unresolved,
                deleted, deletionFailures, records.size(), indexWritten, reconciliationTimeMs);
    }

    /**
     * Derive the identifier of a new reference. Identifiers must name a direct child of the
     * download directory.
     */
    private Optional<String> resolveIdentifier(final String reference) {
        final Optional<String> identifier;
        try {
            identifier = fetcher.deriveIdentifier(reference);
        } catch (final RuntimeException e) {
            logger.warn("Cannot derive an identifier for {}, ignoring it", reference, e);
            return Optional.empty();
        }
        if (identifier.isEmpty() || identifier.get().isBlank()) {
            logger.warn("Cannot derive an identifier for {}, ignoring it", reference);
            return Optional.empty();
        }
        final Path target = downloadBase.resolve(identifier.get()).normalize();
        if (!downloadBase.equals(target.getParent())) {
            logger.warn("Identifier {} of {} does not name a directory below {}, ignoring it",
                    identifier.get(), reference, downloadBase);
            return Optional.empty();
        }
        return identifier;
    }

    private List<IndexRecord> collectIndexRecords() {
        final List<IndexRecord> records = new ArrayList<>();
        for (final Map.Entry<String, String> entry : state.snapshot().entrySet()) {
            final Path descriptorFile = downloadBase.resolve(entry.getValue()).resolve(fetcher.descriptorFileName());
            if (Files.exists(descriptorFile)) {
                records.add(new IndexRecord(entry.getKey(), descriptorFile));
            } else {
                logger.debug("No asset for {} at {}, leaving it out of the index", entry.getKey(), descriptorFile);
            }
        }
        return records;
    }
}
