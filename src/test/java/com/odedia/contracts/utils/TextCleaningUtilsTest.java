package com.odedia.contracts.utils;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextCleaningUtilsTest {

    @Test
    void toAsciiDigits_shouldMapBothArabicDigitBlocks() {
        assertThat(TextCleaningUtils.toAsciiDigits("\u0662\u0660\u0662\u0664-\u06F0\u06F9")).isEqualTo("2024-09");
        assertThat(TextCleaningUtils.toAsciiDigits("abc 123")).isEqualTo("abc 123");
    }

    @Test
    void stripDirectionalMarks_shouldRemoveBidiControls() {
        assertThat(TextCleaningUtils.stripDirectionalMarks("\u200F\u0631\u0642\u0645\u200E \u202B12\u202C\u2067"))
                .isEqualTo("\u0631\u0642\u0645 12");
    }

    @Test
    void compatibilityNormalize_shouldFoldPresentationForms() {
        assertThat(TextCleaningUtils.compatibilityNormalize("\uFEDF\uFEE0\uFEEA")).isEqualTo("\u0644\u0644\u0647");
    }

    @Test
    void reverse_shouldHandleShortAndNullInput() {
        assertThat(TextCleaningUtils.reverse("abc")).isEqualTo("cba");
        assertThat(TextCleaningUtils.reverse("a")).isEqualTo("a");
        assertThat(TextCleaningUtils.reverse(null)).isEmpty();
    }

    @Test
    void reverse_shouldKeepHarakatBehindTheirBaseLetter() {
        // dal with shadda and fatha, then teh marbuta
        assertThat(TextCleaningUtils.reverse("\u062F\u0651\u064E\u0629"))
                .isEqualTo("\u0629\u062F\u0651\u064E");
        assertThat(TextCleaningUtils.reverse(TextCleaningUtils.reverse("\u0645\u062F\u0651\u064E\u0629")))
                .isEqualTo("\u0645\u062F\u0651\u064E\u0629");
    }

    @Test
    void cleanExtractedText_shouldDropBlankLinesAndBinaryRuns() {
        String binary = "QUJDREVGR0hJSktMTU5PUFFSU1RVVldYWVphYmNkZWZnaGlqa2xtbm9wcXJzdHV2d3h5eg==";
        String raw = "  Contract   Number: 1 \n\n\u0001" + binary + "\n\tName: Ali  \r\n";

        assertThat(TextCleaningUtils.cleanExtractedText(raw)).isEqualTo("Contract Number: 1\nName: Ali");
    }
}
