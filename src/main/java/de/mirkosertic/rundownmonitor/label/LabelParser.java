package de.mirkosertic.rundownmonitor.label;

import de.mirkosertic.rundownmonitor.util.TextCleaner;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Heuristic parser for the label-bearing {@code <ap>} regions of rundown entry markup.
 * <p>
 * Only the label tags are interpreted; the rest of the markup is ignored apart from a few
 * {@code <f id=...>} header fields used for reporting. A tag that cannot be parsed is dropped
 * silently, a parser never throws for malformed content.
 */
public class LabelParser {

    private static final Logger logger = LoggerFactory.getLogger(LabelParser.class);

    /** Filter value meaning "the entry has at least one label whose kind is allow-listed". */
    public static final String ALLOWED_KINDS_FILTER = "LABELS";

    public static final List<String> DEFAULT_ALLOWED_KINDS = List.of("X_Total", "X_Faldon");

    private static final Pattern LABEL_TAG = Pattern.compile("<ap>(.*?)</ap>", Pattern.DOTALL);
    private static final Pattern CHANNEL = Pattern.compile("\\[([A-Za-z0-9\\-]+)\\]");
    private static final Pattern CODED_PAYLOAD = Pattern.compile("\\d+:\\s*\\|([^|(]+)");
    private static final Pattern PAYLOAD = Pattern.compile("\\|([^|(]+)");

    private final List<KindRule> kindRules;

    public LabelParser() {
        this(KindRules.DEFAULT_CHAIN);
    }

    public LabelParser(final List<KindRule> kindRules) {
        this.kindRules = List.copyOf(kindRules);
    }

    /**
     * Extract the bodies of all label tags, left to right, across line boundaries.
     *
     * @param content raw entry markup (may be null)
     * @return the tag bodies in document order, never null
     */
    public List<String> extractLabelTags(final @Nullable String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }
        final List<String> tags = new ArrayList<>();
        final Matcher matcher = LABEL_TAG.matcher(content);
        while (matcher.find()) {
            tags.add(matcher.group(1));
        }
        return tags;
    }

    /**
     * Parse a single tag body into a {@link Label}.
     * <p>
     * The channel is an optional bracketed code, the kind comes from the first {@link KindRule}
     * that matches the remaining text, and the payload is the first {@code |}-delimited segment
     * (the segment after an entry code marker such as {@code 00013523: |} takes precedence).
     *
     * @param tagText the tag body (may be null)
     * @return the parsed label, or empty if no kind could be derived
     */
    public Optional<Label> parseLabel(final @Nullable String tagText) {
        if (tagText == null || tagText.isBlank()) {
            return Optional.empty();
        }

        try {
            final Matcher channelMatcher = CHANNEL.matcher(tagText);
            final String channel;
            final String remainder;
            if (channelMatcher.find()) {
                channel = channelMatcher.group(1).strip();
                remainder = tagText.substring(channelMatcher.end()).strip();
            } else {
                channel = "";
                remainder = tagText.strip();
            }

            final Optional<String> kind = deriveKind(remainder);
            if (kind.isEmpty()) {
                return Optional.empty();
            }

            return Optional.of(new Label(channel, kind.get(), derivePayload(remainder)));
        } catch (final RuntimeException e) {
            logger.debug("Dropping unparseable label tag: {}", tagText, e);
            return Optional.empty();
        }
    }

    private Optional<String> deriveKind(final String text) {
        for (final KindRule rule : kindRules) {
            final Optional<String> kind = rule.deriveKind(text);
            if (kind.isPresent() && !kind.get().isEmpty()) {
                return kind;
            }
        }
        return Optional.empty();
    }

    private static String derivePayload(final String text) {
        Matcher matcher = CODED_PAYLOAD.matcher(text);
        if (!matcher.find()) {
            matcher = PAYLOAD.matcher(text);
            if (!matcher.find()) {
                return "";
            }
        }
        final String cleaned = TextCleaner.clean(matcher.group(1));
        return cleaned == null ? "" : cleaned;
    }

    /**
     * Parse every label tag of an entry, dropping tags that cannot be parsed.
     */
    public List<Label> extractLabels(final @Nullable String content) {
        final List<Label> labels = new ArrayList<>();
        for (final String tag : extractLabelTags(content)) {
            parseLabel(tag).ifPresent(labels::add);
        }
        return labels;
    }

    public List<Label> filterByKind(final List<Label> labels) {
        return filterByKind(labels, DEFAULT_ALLOWED_KINDS);
    }

    /**
     * Keep the labels whose kind is on the allow-list, compared case-insensitively.
     */
    public List<Label> filterByKind(final List<Label> labels, final Collection<String> allowedKinds) {
        final Set<String> allowed = allowedKinds.stream()
                .map(kind -> kind.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        return labels.stream()
                .filter(label -> allowed.contains(label.kind().toLowerCase(Locale.ROOT)))
                .toList();
    }

    /**
     * Decide whether an entry passes a feed filter.
     * <p>
     * {@link #ALLOWED_KINDS_FILTER}, an empty pattern or {@code null} select entries with at least one
     * allow-listed label. Any other pattern is matched against each raw tag, first as a literal
     * substring and then as a regular expression. A pattern that is not a valid expression only
     * matches literally.
     *
     * @param content      raw entry markup
     * @param pattern      the feed's filter pattern
     * @param allowedKinds the allow-list used by the label filter
     * @return true if the entry should be processed
     */
    public boolean hasMatch(final @Nullable String content, final @Nullable String pattern,
                            final Collection<String> allowedKinds) {
        if (pattern == null || pattern.isEmpty() || ALLOWED_KINDS_FILTER.equals(pattern)) {
            return !filterByKind(extractLabels(content), allowedKinds).isEmpty();
        }

        final Pattern expression = compileOrNull(pattern);
        for (final String tag : extractLabelTags(content)) {
            if (tag.contains(pattern)) {
                return true;
            }
            if (expression != null && expression.matcher(tag).find()) {
                return true;
            }
        }
        return false;
    }

    public boolean hasMatch(final @Nullable String content, final @Nullable String pattern) {
        return hasMatch(content, pattern, DEFAULT_ALLOWED_KINDS);
    }

    private static @Nullable Pattern compileOrNull(final String pattern) {
        try {
            return Pattern.compile(pattern);
        } catch (final PatternSyntaxException e) {
            logger.debug("Filter '{}' is not a valid regular expression, using literal match only", pattern);
            return null;
        }
    }

    /**
     * Read the header fields and all labels of an entry in one go.
     *
     * @param content      raw entry markup
     * @param allowedKinds the allow-list deciding which labels produce references
     * @return the extracted information, never null
     */
    public EntryInfo extractEntryInfo(final String content, final Collection<String> allowedKinds) {
        final List<String> tags = extractLabelTags(content);
        final List<Label> labels = new ArrayList<>();
        for (final String tag : tags) {
            parseLabel(tag).ifPresent(labels::add);
        }
        final List<Label> matching = filterByKind(labels, allowedKinds);
        final List<String> references = matching.stream()
                .filter(Label::hasPayload)
                .map(Label::payload)
                .toList();

        return new EntryInfo(
                extractField(content, "title"),
                extractField(content, "status"),
                extractField(content, "modify-by"),
                extractField(content, "modify-date"),
                extractField(content, "audio-time"),
                tags,
                labels,
                matching,
                references
        );
    }

    /**
     * Value of a {@code <f id=NAME ...>value</f>} header field, or an empty string if absent.
     */
    public String extractField(final String content, final String fieldId) {
        final Pattern field = Pattern.compile("<f id=" + Pattern.quote(fieldId) + "[^>]*>([^<]*)</f>");
        final Matcher matcher = field.matcher(content);
        if (matcher.find()) {
            final String value = TextCleaner.stripInvalidCharacters(matcher.group(1));
            return value == null ? "" : value;
        }
        return "";
    }
}
