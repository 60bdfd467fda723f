package com.odedia.contracts.utils;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScriptCountsTest {

    @Test
    void of_shouldCountLettersByScript() {
        ScriptCounts counts = ScriptCounts.of("رقم Contract 12");

        assertThat(counts.arabicLetters()).isEqualTo(3);
        assertThat(counts.latinLetters()).isEqualTo(8);
        assertThat(counts.digits()).isEqualTo(2);
        assertThat(counts.hasLatin()).isTrue();
        assertThat(counts.arabicDominates()).isFalse();
    }

    @Test
    void of_shouldNotCountDiacriticsOrArabicIndicDigitsAsLetters() {
        ScriptCounts counts = ScriptCounts.of("\u0633\u064E\u0644\u0627\u0645 \u0661\u0662");

        assertThat(counts.arabicLetters()).isEqualTo(4);
        assertThat(counts.digits()).isEqualTo(2);
        assertThat(counts.arabicDominates()).isTrue();
    }

    @Test
    void of_shouldHandleEmptyInput() {
        assertThat(ScriptCounts.of(null)).isEqualTo(new ScriptCounts(0, 0, 0));
        assertThat(ScriptCounts.of("")).isEqualTo(new ScriptCounts(0, 0, 0));
    }
}
