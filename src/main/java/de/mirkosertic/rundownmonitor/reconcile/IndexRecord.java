package de.mirkosertic.rundownmonitor.reconcile;

import java.nio.file.Path;

/**
 * One row of the reference index: a reference and the descriptor file of its asset.
 */
public record IndexRecord(String reference, Path descriptorFile) {
}
