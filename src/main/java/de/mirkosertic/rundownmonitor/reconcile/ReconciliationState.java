package de.mirkosertic.rundownmonitor.reconcile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Persistent mapping of every known reference to the identifier of its asset directory.
 * <p>
 * Stored as a flat JSON object in {@value #STATE_FILE}. Every mutation rewrites the whole file
 * through a temporary file and an atomic move, so a crash never leaves a half written state behind.
 * A failed write is logged and the in-memory state stays authoritative; the next mutation writes
 * the file again.
 */
public class ReconciliationState {

    private static final Logger logger = LoggerFactory.getLogger(ReconciliationState.class);

    public static final String STATE_FILE = "content_state.json";

    private static final TypeReference<LinkedHashMap<String, String>> STATE_TYPE = new TypeReference<>() {
    };

    private final Path stateFile;
    private final ObjectMapper objectMapper;
    private final Map<String, String> entries;

    private ReconciliationState(final Path stateFile, final ObjectMapper objectMapper,
                                final Map<String, String> entries) {
        this.stateFile = stateFile;
        this.objectMapper = objectMapper;
        this.entries = entries;
    }

    /**
     * Load the state kept in {@code downloadBase}.
     * <p>
     * A missing file yields an empty state. A file that cannot be parsed is moved aside to
     * {@code content_state.json.corrupt-<epochMillis>} and an empty state is returned.
     *
     * @throws IOException if the file exists but cannot be read or moved aside
     */
    public static ReconciliationState load(final Path downloadBase, final ObjectMapper objectMapper,
                                           final Clock clock) throws IOException {
        final Path stateFile = downloadBase.resolve(STATE_FILE);
        if (!Files.exists(stateFile)) {
            logger.info("No state file at {}, starting with an empty state", stateFile);
            return new ReconciliationState(stateFile, objectMapper, new LinkedHashMap<>());
        }

        try {
            final LinkedHashMap<String, String> loaded = objectMapper.readValue(stateFile.toFile(), STATE_TYPE);
            final Map<String, String> entries = new LinkedHashMap<>();
            if (loaded != null) {
                loaded.forEach((reference, identifier) -> {
                    if (reference != null && identifier != null) {
                        entries.put(reference, identifier);
                    }
                });
            }
            logger.info("Loaded {} known references from {}", entries.size(), stateFile);
            return new ReconciliationState(stateFile, objectMapper, entries);
        } catch (final JsonProcessingException e) {
            final Path corrupt = stateFile.resolveSibling(STATE_FILE + ".corrupt-" + clock.millis());
            Files.move(stateFile, corrupt, StandardCopyOption.REPLACE_EXISTING);
            logger.error("State file {} is corrupt, moved it to {} and starting with an empty state",
                    stateFile, corrupt, e);
            return new ReconciliationState(stateFile, objectMapper, new LinkedHashMap<>());
        }
    }

    public synchronized void put(final String reference, final String identifier) {
        entries.put(reference, identifier);
        persist();
    }

    public synchronized void remove(final String reference) {
        if (entries.remove(reference) != null) {
            persist();
        }
    }

    /**
     * @return the known references in insertion order
     */
    public synchronized Set<String> references() {
        return new LinkedHashSet<>(entries.keySet());
    }

    public synchronized Optional<String> identifierFor(final String reference) {
        return Optional.ofNullable(entries.get(reference));
    }

    /**
     * @return true if a known reference other than {@code reference} maps to {@code identifier}
     */
    public synchronized boolean isSharedByOther(final String identifier, final String reference) {
        return entries.entrySet().stream()
                .anyMatch(e -> !e.getKey().equals(reference) && Objects.equals(e.getValue(), identifier));
    }

    /**
     * @return an ordered copy of all reference to identifier pairs
     */
    public synchronized Map<String, String> snapshot() {
        return new LinkedHashMap<>(entries);
    }

    private void persist() {
        final Path temp = stateFile.resolveSibling(STATE_FILE + ".tmp");
        try {
            Files.createDirectories(stateFile.getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), entries);
            Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            logger.debug("Saved {} references to {}", entries.size(), stateFile);
        } catch (final IOException e) {
            logger.error("Failed to save state to {}, keeping {} references in memory",
                    stateFile, entries.size(), e);
        }
    }
}
