package de.mirkosertic.rundownmonitor.feed;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContentFingerprintTest {

    @Test
    void shouldProduceSha256Hex() {
        assertThat(ContentFingerprint.of("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void shouldDifferForDifferentContent() {
        assertThat(ContentFingerprint.of("<ap>[CG1] 1 X_Total |a|</ap>"))
                .isNotEqualTo(ContentFingerprint.of("<ap>[CG1] 1 X_Total |b|</ap>"))
                .hasSize(64);
    }
}
