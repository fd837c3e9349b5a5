package de.mirkosertic.rundownmonitor.feed;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Stable content fingerprints for change detection. Unlike identity or string hash codes the
 * value is the same across JVM runs.
 */
public final class ContentFingerprint {

    private ContentFingerprint() {
        // utility class
    }

    /**
     * @param content the raw entry text
     * @return lowercase hex SHA-256 of the UTF-8 encoded content
     */
    public static String of(final String content) {
        return Hashing.sha256().hashString(content, StandardCharsets.UTF_8).toString();
    }
}
