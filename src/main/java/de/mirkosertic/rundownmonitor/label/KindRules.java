package de.mirkosertic.rundownmonitor.label;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The built-in {@link KindRule}s, in the order the parser tries them.
 * <p>
 * Label tags come in several layouts, for example:
 * <ul>
 *   <li>{@code [A1-A2-A3] 10 QR -- 00010829: |payload|}</li>
 *   <li>{@code Faldon | 00013523: |payload(}</li>
 *   <li>{@code [CG1] Faldon | 00013523: |payload(}</li>
 * </ul>
 */
public final class KindRules {

    private static final Pattern AFTER_CODE_MARKER_PATTERN = Pattern.compile("--\\s+\\d+:\\s+([A-Za-z_0-9]+)");
    private static final Pattern AFTER_NUMBER_PATTERN = Pattern.compile("\\d+\\s+([A-Za-z_][A-Za-z_0-9]*(?:\\s+\\d+)?)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Set<String> STRUCTURAL_TOKENS = Set.of("]", "[[", "]]", "|", "--");

    /** Token right after a {@code -- <digits>:} entry code marker. */
    public static final KindRule AFTER_CODE_MARKER = text -> firstGroup(AFTER_CODE_MARKER_PATTERN, text);

    /** Token after a run of digits, keeping an optional numeric suffix such as {@code Titulo 2}. */
    public static final KindRule AFTER_NUMBER = text -> firstGroup(AFTER_NUMBER_PATTERN, text);

    /** First word that is neither numeric nor a structural token. */
    public static final KindRule FIRST_WORD = text -> {
        for (final String word : WHITESPACE.split(text.strip())) {
            if (!word.isEmpty() && !isNumeric(word) && !STRUCTURAL_TOKENS.contains(word)) {
                return Optional.of(word);
            }
        }
        return Optional.empty();
    };

    public static final List<KindRule> DEFAULT_CHAIN = List.of(AFTER_CODE_MARKER, AFTER_NUMBER, FIRST_WORD);

    private KindRules() {
    }

    private static Optional<String> firstGroup(final Pattern pattern, final String text) {
        final Matcher matcher = pattern.matcher(text);
        if (matcher.find()) {
            final String value = matcher.group(1).strip();
            if (!value.isEmpty()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /**
     * Numeric codes may contain dashes ({@code 10-20}); a token consisting only of dashes is not numeric.
     */
    static boolean isNumeric(final String word) {
        final String digits = word.replace("-", "");
        if (digits.isEmpty()) {
            return false;
        }
        for (int i = 0; i < digits.length(); i++) {
            if (!Character.isDigit(digits.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
