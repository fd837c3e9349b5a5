package de.mirkosertic.rundownmonitor.label;

import java.util.Optional;

/**
 * One step of the kind-detection fallback chain used by {@link LabelParser}.
 * Implementations are pure functions of the tag text that remains after the channel code.
 */
@FunctionalInterface
public interface KindRule {

    Optional<String> deriveKind(String text);
}
