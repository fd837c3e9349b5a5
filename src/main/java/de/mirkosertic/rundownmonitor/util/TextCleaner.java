package de.mirkosertic.rundownmonitor.util;

import org.jspecify.annotations.Nullable;

import java.util.regex.Pattern;

/**
 * Normalizes text pulled out of rundown markup before it is used as a reference or shown in reports.
 *
 * <p>Rundown servers hand out text that was typed into a newsroom editor, so it regularly contains:</p>
 * <ul>
 *   <li>Unicode replacement characters (U+FFFD) from failed charset conversion</li>
 *   <li>Control characters that aren't whitespace</li>
 *   <li>Zero-width characters pasted along with URLs</li>
 *   <li>Line breaks and tabs inside a single logical value</li>
 * </ul>
 */
public final class TextCleaner {

    /**
     * Characters that never belong in a value:
     * <ul>
     *   <li>U+0000-U+001F: Control characters (except \t \n \r, which count as whitespace)</li>
     *   <li>U+200B-U+200D: Zero-width space, non-joiner and joiner</li>
     *   <li>U+FEFF: Byte order mark</li>
     *   <li>U+FFFD: Replacement character</li>
     * </ul>
     */
    private static final Pattern INVALID_CHARS = Pattern.compile(
        "[" +
        "\\x00-\\x08" +
        "\\x0B\\x0C" +
        "\\x0E-\\x1F" +
        "\\u200B-\\u200D" +
        "\\uFEFF" +
        "\\uFFFD" +
        "]"
    );

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private TextCleaner() {
        // Utility class, no instances
    }

    /**
     * Remove invalid characters, turn every whitespace run (including line breaks) into a single
     * space and trim the result.
     *
     * @param text the text to clean (may be null)
     * @return cleaned text, or null if input was null
     */
    public static @Nullable String clean(final @Nullable String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        final String withoutInvalid = INVALID_CHARS.matcher(text).replaceAll("");
        return WHITESPACE_RUN.matcher(withoutInvalid).replaceAll(" ").trim();
    }

    /**
     * Remove invalid characters and trim, keeping inner whitespace as-is.
     *
     * @param text the text to clean (may be null)
     * @return cleaned text, or null if input was null
     */
    public static @Nullable String stripInvalidCharacters(final @Nullable String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        return INVALID_CHARS.matcher(text).replaceAll("").trim();
    }
}
