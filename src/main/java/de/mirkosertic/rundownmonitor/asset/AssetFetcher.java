package de.mirkosertic.rundownmonitor.asset;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Materializes the asset behind a label reference in a local directory.
 * <p>
 * Fetching is best effort: implementations contain and log their own failures and never throw
 * past {@link #fetch(String, Path)}. Whether a fetch succeeded is observable only through the
 * presence of the descriptor file in the target directory.
 */
public interface AssetFetcher {

    /**
     * Derive the local identifier for a reference. Equal references always yield equal identifiers.
     *
     * @param reference the label payload, typically a URL
     * @return a file-name safe identifier, or empty if the reference is not supported
     */
    Optional<String> deriveIdentifier(String reference);

    /**
     * Fetch the asset into {@code targetDirectory}, creating the directory if needed.
     */
    void fetch(String reference, Path targetDirectory);

    /**
     * @return name of the file a successful fetch leaves in the target directory
     */
    String descriptorFileName();
}
