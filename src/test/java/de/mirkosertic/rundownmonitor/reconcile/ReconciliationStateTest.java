package de.mirkosertic.rundownmonitor.reconcile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReconciliationState")
class ReconciliationStateTest {

    @TempDir
    Path downloads;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.ofEpochMilli(1718031600000L), ZoneOffset.UTC);

    @Test
    @DisplayName("Should start empty without a state file")
    void shouldStartEmpty() throws IOException {
        final ReconciliationState state = ReconciliationState.load(downloads, objectMapper, clock);

        assertThat(state.references()).isEmpty();
        assertThat(downloads.resolve(ReconciliationState.STATE_FILE)).doesNotExist();
    }

    @Test
    @DisplayName("Should persist every mutation as a flat JSON object")
    void shouldPersistMutations() throws IOException {
        // Given
        final ReconciliationState state = ReconciliationState.load(downloads, objectMapper, clock);

        // When
        state.put("https://x.com/a/status/1", "1");
        state.put("https://x.com/b/status/2", "2");
        state.remove("https://x.com/a/status/1");

        // Then
        final JsonNode json = objectMapper.readTree(downloads.resolve(ReconciliationState.STATE_FILE).toFile());
        assertThat(json.isObject()).isTrue();
        assertThat(json.size()).isEqualTo(1);
        assertThat(json.get("https://x.com/b/status/2").asText()).isEqualTo("2");
        assertThat(downloads.resolve(ReconciliationState.STATE_FILE + ".tmp")).doesNotExist();
    }

    @Test
    @DisplayName("Should restore references in their original order")
    void shouldRestoreOrder() throws IOException {
        // Given
        Files.writeString(downloads.resolve(ReconciliationState.STATE_FILE),
                "{\"C\": \"3\", \"A\": \"1\", \"B\": \"2\"}");

        // When
        final ReconciliationState state = ReconciliationState.load(downloads, objectMapper, clock);

        // Then
        assertThat(state.references()).containsExactly("C", "A", "B");
        assertThat(state.identifierFor("A")).contains("1");
        assertThat(state.identifierFor("Z")).isEmpty();
    }

    @Test
    @DisplayName("Should move a corrupt state file aside and start empty")
    void shouldMoveCorruptFileAside() throws IOException {
        // Given
        Files.writeString(downloads.resolve(ReconciliationState.STATE_FILE), "{ not json");

        // When
        final ReconciliationState state = ReconciliationState.load(downloads, objectMapper, clock);

        // Then
        assertThat(state.references()).isEmpty();
        assertThat(downloads.resolve(ReconciliationState.STATE_FILE)).doesNotExist();
        assertThat(downloads.resolve(ReconciliationState.STATE_FILE + ".corrupt-1718031600000"))
                .hasContent("{ not json");
    }

    @Test
    @DisplayName("Should detect identifiers shared by another reference")
    void shouldDetectSharedIdentifiers() throws IOException {
        final ReconciliationState state = ReconciliationState.load(downloads, objectMapper, clock);
        state.put("https://x.com/a/status/1", "1");
        state.put("https://twitter.com/a/status/1", "1");
        state.put("https://x.com/b/status/2", "2");

        assertThat(state.isSharedByOther("1", "https://x.com/a/status/1")).isTrue();
        assertThat(state.isSharedByOther("2", "https://x.com/b/status/2")).isFalse();
    }
}
