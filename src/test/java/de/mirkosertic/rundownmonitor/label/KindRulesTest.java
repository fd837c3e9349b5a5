package de.mirkosertic.rundownmonitor.label;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("KindRules")
class KindRulesTest {

    @Test
    @DisplayName("AFTER_CODE_MARKER takes the token after '-- <digits>:'")
    void afterCodeMarker() {
        assertThat(KindRules.AFTER_CODE_MARKER.deriveKind("10 -- 00010829: X_Total |payload|")).contains("X_Total");
        assertThat(KindRules.AFTER_CODE_MARKER.deriveKind("10 QR -- 00010829: |payload|")).isEmpty();
        assertThat(KindRules.AFTER_CODE_MARKER.deriveKind("Faldon |payload|")).isEmpty();
    }

    @Test
    @DisplayName("AFTER_NUMBER takes the word after a number, with an optional numeric suffix")
    void afterNumber() {
        assertThat(KindRules.AFTER_NUMBER.deriveKind("10 QR -- 00010829: |payload|")).contains("QR");
        assertThat(KindRules.AFTER_NUMBER.deriveKind("3 Titulo 2 |payload|")).contains("Titulo 2");
        assertThat(KindRules.AFTER_NUMBER.deriveKind("Faldon | 00013523: |payload(")).isEmpty();
    }

    @Test
    @DisplayName("FIRST_WORD skips numbers and structural tokens")
    void firstWord() {
        assertThat(KindRules.FIRST_WORD.deriveKind("Faldon | 00013523: |payload(")).contains("Faldon");
        assertThat(KindRules.FIRST_WORD.deriveKind("| -- 10-20 ]] Rotulo")).contains("Rotulo");
        assertThat(KindRules.FIRST_WORD.deriveKind("  ")).isEmpty();
        assertThat(KindRules.FIRST_WORD.deriveKind("12 -- |")).isEmpty();
    }

    @Test
    @DisplayName("Numeric words may contain dashes but not consist of them")
    void isNumeric() {
        assertThat(KindRules.isNumeric("00013523")).isTrue();
        assertThat(KindRules.isNumeric("10-20")).isTrue();
        assertThat(KindRules.isNumeric("--")).isFalse();
        assertThat(KindRules.isNumeric("00013523:")).isFalse();
        assertThat(KindRules.isNumeric("X1")).isFalse();
    }

    @Test
    @DisplayName("The default chain tries the rules in order")
    void defaultChainOrder() {
        assertThat(KindRules.DEFAULT_CHAIN).containsExactly(
                KindRules.AFTER_CODE_MARKER, KindRules.AFTER_NUMBER, KindRules.FIRST_WORD);
    }
}
