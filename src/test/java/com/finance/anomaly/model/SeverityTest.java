package com.finance.anomaly.model;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class SeverityTest {

    private Locale originalLocale;

    @BeforeEach
    void setUp() {
        originalLocale = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
    }

    @AfterEach
    void tearDown() {
        Locale.setDefault(originalLocale);
    }

    @Test
    void toJson_isLowerCaseUnderTurkishLocale() {
        assertThat(Severity.HIGH.toJson()).isEqualTo("high");
        assertThat(Severity.MEDIUM.toJson()).isEqualTo("medium");
    }

    @Test
    void fromJson_parsesLowerCaseUnderTurkishLocale() {
        assertThat(Severity.fromJson("high")).isEqualTo(Severity.HIGH);
        assertThat(Severity.fromJson(" medium ")).isEqualTo(Severity.MEDIUM);
        assertThat(Severity.fromJson(null)).isNull();
    }

    @Test
    void fromConfidence_strictlyAboveIsHigh() {
        assertThat(Severity.fromConfidence(0.71, 0.7)).isEqualTo(Severity.HIGH);
        assertThat(Severity.fromConfidence(0.7, 0.7)).isEqualTo(Severity.MEDIUM);
    }
}
