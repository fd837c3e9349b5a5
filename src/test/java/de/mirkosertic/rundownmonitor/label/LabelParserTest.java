package de.mirkosertic.rundownmonitor.label;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LabelParser")
class LabelParserTest {

    private static final String ENTRY = """
            <nsml version="-//AVID//DTD NSML 1.0//EN">
            <fields>
            <f id=title>APERTURA DEPORTES</f>
            <f id=status>READY</f>
            <f id=modify-by>jgarcia</f>
            <f id=modify-date>1718031600</f>
            <f id=audio-time>45</f>
            </fields>
            <body>
            <p>Texto del presentador</p>
            <ap>[CG2] 20 X_Total -- 00010830: |https://twitter.com/agencia/status/1555|</ap>
            <ap>[CG1] Faldon | 00013523: |Hola Mundo(</ap>
            <ap>[CG3] 30 X_Faldon -- 00010831: |https://x.com/club/status/1777|</ap>
            </body>
            </nsml>
            """;

    private final LabelParser parser = new LabelParser();

    @Nested
    @DisplayName("extractLabelTags")
    class ExtractLabelTags {

        @Test
        @DisplayName("Should return nothing when there are no markers")
        void shouldReturnEmptyWithoutMarkers() {
            assertThat(parser.extractLabelTags("<p>Just some text</p>")).isEmpty();
            assertThat(parser.extractLabelTags("")).isEmpty();
            assertThat(parser.extractLabelTags(null)).isEmpty();
        }

        @Test
        @DisplayName("Should return tag bodies in document order, across lines")
        void shouldReturnTagsInOrder() {
            final String content = "<ap>first</ap> text <ap>second\nline</ap>";

            assertThat(parser.extractLabelTags(content)).containsExactly("first", "second\nline");
        }
    }

    @Nested
    @DisplayName("parseLabel")
    class ParseLabel {

        @Test
        @DisplayName("Should prefer the segment after an entry code marker as payload")
        void shouldParseCodedPayload() {
            // When
            final Optional<Label> label = parser.parseLabel("[CG1] Faldon | 00013523: |Hola Mundo(");

            // Then
            assertThat(label).isPresent();
            assertThat(label.get().channel()).isEqualTo("CG1");
            assertThat(label.get().kind()).isNotEmpty();
            assertThat(label.get().payload()).isEqualTo("Hola Mundo");
        }

        @Test
        @DisplayName("Should take the kind after the number and the URL between pipes")
        void shouldParseUrlLabel() {
            final Optional<Label> label = parser.parseLabel(
                    "[A1-A2-A3] 10 QR -- 00010829: |https://x.com/user/status/123|");

            assertThat(label).contains(new Label("A1-A2-A3", "QR", "https://x.com/user/status/123"));
        }

        @Test
        @DisplayName("Should parse a label without channel")
        void shouldParseWithoutChannel() {
            final Optional<Label> label = parser.parseLabel("Faldon |Titular del dia|");

            assertThat(label).contains(new Label("", "Faldon", "Titular del dia"));
        }

        @Test
        @DisplayName("Should leave the payload empty when there is no pipe segment")
        void shouldParseWithoutPayload() {
            final Optional<Label> label = parser.parseLabel("[CG1] 5 Rotulo");

            assertThat(label).isPresent();
            assertThat(label.get().kind()).isEqualTo("Rotulo");
            assertThat(label.get().hasPayload()).isFalse();
        }

        @Test
        @DisplayName("Should reject empty and blank tags")
        void shouldRejectBlank() {
            assertThat(parser.parseLabel("")).isEmpty();
            assertThat(parser.parseLabel("   ")).isEmpty();
            assertThat(parser.parseLabel(null)).isEmpty();
        }

        @Test
        @DisplayName("Should reject tags without any kind")
        void shouldRejectTagWithoutKind() {
            assertThat(parser.parseLabel("[CG1] 123 -- |")).isEmpty();
        }

        @Test
        @DisplayName("Should drop a tag when a rule throws")
        void shouldDropTagWhenRuleFails() {
            // Given
            final KindRule failing = text -> {
                throw new IllegalStateException("broken rule");
            };
            final LabelParser failingParser = new LabelParser(List.of(failing));

            // When / Then
            assertThat(failingParser.parseLabel("[CG1] Faldon |x|")).isEmpty();
        }

        @Test
        @DisplayName("Should use the injected rule chain in order")
        void shouldUseInjectedRules() {
            final LabelParser custom = new LabelParser(List.of(text -> Optional.empty(), text -> Optional.of("FIXED")));

            assertThat(custom.parseLabel("anything |payload|"))
                    .contains(new Label("", "FIXED", "payload"));
        }
    }

    @Nested
    @DisplayName("filterByKind")
    class FilterByKind {

        @Test
        @DisplayName("Should compare kinds case-insensitively")
        void shouldBeCaseInsensitive() {
            final List<Label> labels = List.of(
                    new Label("CG1", "x_total", "a"),
                    new Label("CG2", "X_FALDON", "b"),
                    new Label("CG3", "QR", "c"));

            assertThat(parser.filterByKind(labels, List.of("X_Total")))
                    .extracting(Label::payload).containsExactly("a");
            assertThat(parser.filterByKind(labels))
                    .extracting(Label::payload).containsExactly("a", "b");
        }

        @Test
        @DisplayName("Should return nothing for an empty allow-list")
        void shouldReturnNothingForEmptyAllowList() {
            assertThat(parser.filterByKind(List.of(new Label("", "X_Total", "a")), List.of())).isEmpty();
        }
    }

    @Nested
    @DisplayName("hasMatch")
    class HasMatch {

        @Test
        @DisplayName("Should match entries with an allow-listed label for the LABELS filter")
        void shouldMatchAllowListedLabels() {
            assertThat(parser.hasMatch(ENTRY, LabelParser.ALLOWED_KINDS_FILTER)).isTrue();
            assertThat(parser.hasMatch(ENTRY, "")).isTrue();
            assertThat(parser.hasMatch(ENTRY, null)).isTrue();
            assertThat(parser.hasMatch(ENTRY, "LABELS", List.of("Rotulo"))).isFalse();
        }

        @Test
        @DisplayName("Should match a literal substring of a tag")
        void shouldMatchLiteral() {
            assertThat(parser.hasMatch(ENTRY, "Hola Mundo(")).isTrue();
            assertThat(parser.hasMatch(ENTRY, "Texto del presentador")).isFalse();
        }

        @Test
        @DisplayName("Should match a regular expression against the tags")
        void shouldMatchRegex() {
            assertThat(parser.hasMatch(ENTRY, "status/1[57]{3}")).isTrue();
            assertThat(parser.hasMatch(ENTRY, "^\\[CG9\\]")).isFalse();
        }

        @Test
        @DisplayName("Should fall back to literal matching for an invalid expression")
        void shouldHandleInvalidRegex() {
            final String content = "<ap>[CG1] Faldon |a(b|</ap>";

            assertThat(parser.hasMatch(content, "a(b")).isTrue();
            assertThat(parser.hasMatch(content, "x(y")).isFalse();
        }

        @Test
        @DisplayName("Should not match content without tags")
        void shouldNotMatchWithoutTags() {
            assertThat(parser.hasMatch("<p>nothing</p>", "LABELS")).isFalse();
            assertThat(parser.hasMatch("<p>nothing</p>", "nothing")).isFalse();
        }
    }

    @Nested
    @DisplayName("extractEntryInfo")
    class ExtractEntryInfo {

        @Test
        @DisplayName("Should read header fields, labels and references")
        void shouldExtractEntryInfo() {
            // When
            final EntryInfo info = parser.extractEntryInfo(ENTRY, LabelParser.DEFAULT_ALLOWED_KINDS);

            // Then
            assertThat(info.title()).isEqualTo("APERTURA DEPORTES");
            assertThat(info.status()).isEqualTo("READY");
            assertThat(info.modifiedBy()).isEqualTo("jgarcia");
            assertThat(info.modifiedDate()).isEqualTo("1718031600");
            assertThat(info.audioTime()).isEqualTo("45");
            assertThat(info.labelTags()).hasSize(3);
            assertThat(info.labels()).hasSize(3);
            assertThat(info.matchingLabels()).extracting(Label::kind).containsExactly("X_Total", "X_Faldon");
            assertThat(info.references()).containsExactly(
                    "https://twitter.com/agencia/status/1555",
                    "https://x.com/club/status/1777");
        }

        @Test
        @DisplayName("Should return empty fields for missing headers")
        void shouldHandleMissingFields() {
            final EntryInfo info = parser.extractEntryInfo("<ap>[CG1] 1 X_Total |ref|</ap>", List.of("x_total"));

            assertThat(info.title()).isEmpty();
            assertThat(info.status()).isEmpty();
            assertThat(info.references()).containsExactly("ref");
            assertThat(info.labelTags()).hasSize(1);
        }
    }
}
