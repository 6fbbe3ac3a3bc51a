package com.example.reviewharvester.scraper;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FingerprintsTest {

    @Test
    void ignoresWhitespaceAndUnicodeForm() {
        String composed = Fingerprints.of("kim", "1주 전", "café  good");
        String decomposed = Fingerprints.of(" kim ", "1주 전", "cafe\u0301\ngood ");

        assertThat(composed).isEqualTo(decomposed);
    }

    @Test
    void differentAuthorsDiffer() {
        assertThat(Fingerprints.of("kim", "1주 전", "good"))
                .isNotEqualTo(Fingerprints.of("lee", "1주 전", "good"));
    }

    @Test
    void fieldsDoNotBleedIntoEachOther() {
        assertThat(Fingerprints.of("ab", "c", "x")).isNotEqualTo(Fingerprints.of("a", "bc", "x"));
    }

    @Test
    void isHexOfFixedLength() {
        assertThat(Fingerprints.of(null, null, null)).matches("[0-9a-f]{32}");
    }
}
