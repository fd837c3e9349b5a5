package de.mirkosertic.rundownmonitor.reconcile;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReferenceIndexWriter")
class ReferenceIndexWriterTest {

    @TempDir
    Path downloads;

    @Test
    @DisplayName("Should write the header and one row per record")
    void shouldWriteRows() throws IOException {
        // Given
        final ReferenceIndexWriter writer = new ReferenceIndexWriter(downloads);
        final Path descriptor = downloads.resolve("1555").resolve("tweet_api.json");

        // When
        writer.write(List.of(new IndexRecord("https://x.com/a/status/1555", descriptor)));

        // Then: rows end in CRLF like the files the playout machines already consume
        assertThat(Files.readString(writer.getIndexFile()))
                .isEqualTo("URL;LOCAL PATH\r\nhttps://x.com/a/status/1555;" + descriptor.toAbsolutePath() + "\r\n");
    }

    @Test
    @DisplayName("Should replace the previous index completely")
    void shouldReplaceIndex() throws IOException {
        final ReferenceIndexWriter writer = new ReferenceIndexWriter(downloads);
        writer.write(List.of(new IndexRecord("A", downloads.resolve("1/tweet_api.json")),
                new IndexRecord("B", downloads.resolve("2/tweet_api.json"))));

        writer.write(List.of());

        assertThat(Files.readAllLines(writer.getIndexFile())).containsExactly("URL;LOCAL PATH");
        assertThat(downloads.resolve(ReferenceIndexWriter.INDEX_FILE + ".tmp")).doesNotExist();
    }

    @Test
    @DisplayName("Should quote fields containing the delimiter or quotes")
    void shouldQuoteFields() {
        assertThat(ReferenceIndexWriter.escapeCsv("plain")).isEqualTo("plain");
        assertThat(ReferenceIndexWriter.escapeCsv("a;b")).isEqualTo("\"a;b\"");
        assertThat(ReferenceIndexWriter.escapeCsv("say \"hi\"")).isEqualTo("\"say \"\"hi\"\"\"");
    }
}
