package de.mirkosertic.rundownmonitor.reconcile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Writes {@value #INDEX_FILE}, the table the playout graphics read to find the local asset descriptor of
 * a reference. The file is always written in full and replaced atomically.
 */
public class ReferenceIndexWriter {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceIndexWriter.class);

    public static final String INDEX_FILE = "index.csv";
    static final String HEADER = "URL;LOCAL PATH";
    private static final char DELIMITER = ';';
    static final String LINE_END = "\r\n";

    private final Path indexFile;

    public ReferenceIndexWriter(final Path downloadBase) {
        this.indexFile = downloadBase.resolve(INDEX_FILE);
    }

    /**
     * Replace the index with the given rows, in order.
     *
     * @throws IOException if the file cannot be written or moved into place
     */
    public void write(final List<IndexRecord> records) throws IOException {
        Files.createDirectories(indexFile.getParent());
        final Path temp = indexFile.resolveSibling(INDEX_FILE + ".tmp");

        try (final BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
            writer.write(HEADER);
            writer.write(LINE_END);
            for (final IndexRecord record : records) {
                writer.write(escapeCsv(record.reference()));
                writer.write(DELIMITER);
                writer.write(escapeCsv(record.descriptorFile().toAbsolutePath().toString()));
                writer.write(LINE_END);
            }
        }

        Files.move(temp, indexFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.debug("Wrote {} index rows to {}", records.size(), indexFile);
    }

    public Path getIndexFile() {
        return indexFile;
    }

    static String escapeCsv(final String value) {
        if (value.indexOf(DELIMITER) >= 0 || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
