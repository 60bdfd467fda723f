package com.odedia.contracts.rtl;

import org.junit.jupiter.api.Test;

import com.odedia.contracts.utils.TextCleaningUtils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContractTextNormalizerTest {

    private static final String SENTENCE = "تبدأ مدة العقد من تاريخ المباشرة";

    // "مدة" written with shadda then fatha on the dal
    private static final String VOCALIZED_SENTENCE = "تبدأ \u0645\u062F\u0651\u064E\u0629 العقد من تاريخ المباشرة";

    private final ContractTextNormalizer normalizer = new ContractTextNormalizer(10);

    @Test
    void normalize_shouldKeepLabelInReadingOrder() {
        assertThat(normalizer.normalize("رقم العقد: 22477445")).isEqualTo("رقم العقد: 22477445");
    }

    @Test
    void normalize_shouldReverseMirroredLabelOnTheLeft() {
        assertThat(normalizer.normalize("دقعلا مقر: 22477445")).isEqualTo("رقم العقد: 22477445");
    }

    @Test
    void normalize_shouldMoveMirroredLabelFromTheRight() {
        assertThat(normalizer.normalize("22477445 :دقعلا مقر")).isEqualTo("رقم العقد: 22477445");
    }

    @Test
    void normalize_shouldKeepLabelWithEmptyValue() {
        assertThat(normalizer.normalize("ةيسنجلا:")).isEqualTo("الجنسية:");
    }

    @Test
    void normalize_shouldReverseMirroredSentence() {
        String mirrored = TextCleaningUtils.reverse(SENTENCE);

        assertThat(normalizer.normalize(mirrored)).isEqualTo(SENTENCE);
        assertThat(normalizer.normalize(SENTENCE)).isEqualTo(SENTENCE);
    }

    @Test
    void normalize_shouldReverseVisualDateSentence() {
        // glyph order with the date runs kept left to right
        String visual = "2025-09-21 يف يهتنيو 2024-09-22 خيرات نم أدبي";

        assertThat(normalizer.normalize(visual))
                .isEqualTo("يبدأ من تاريخ 22-90-4202 وينتهي في 12-90-5202");
    }

    @Test
    void normalize_shouldLeaveShortArabicLinesAlone() {
        // under the sentence threshold
        String shortMirrored = TextCleaningUtils.reverse("العقد");

        assertThat(normalizer.normalize(shortMirrored)).isEqualTo(shortMirrored);
    }

    @Test
    void normalize_shouldLeaveLinesWithSeveralColonsAlone() {
        String line = "دقعلا: 10:30";

        assertThat(normalizer.normalize(line)).isEqualTo(line);
    }

    @Test
    void normalize_shouldLeaveEnglishLinesAlone() {
        assertThat(normalizer.normalize("Contract Number: 22477445\nEmployee Name: Ahmed Ali"))
                .isEqualTo("Contract Number: 22477445\nEmployee Name: Ahmed Ali");
    }

    @Test
    void normalize_shouldStripBidiMarksAndMapDigits() {
        String raw = "\u200Fرقم العقد\u200E: \u0662\u0662\u0664\u0667\u0667\u0664\u0664\u0665\u202C";

        assertThat(normalizer.normalize(raw)).isEqualTo("رقم العقد: 22477445");
    }

    @Test
    void normalize_shouldCollapseSpacesAndDropBlankLines() {
        String raw = "  Contract   Number:\t22477445  \r\n\n   \nIBAN:  SA03 8000\n";

        assertThat(normalizer.normalize(raw)).isEqualTo("Contract Number: 22477445\nIBAN: SA03 8000");
    }

    @Test
    void normalize_shouldFoldPresentationForms() {
        // isolated lam, alef and meem
        String presentation = "\uFEDD\uFE8D\uFEE1";

        assertThat(normalizer.normalize(presentation)).isEqualTo("\u0644\u0627\u0645");
    }

    @Test
    void normalize_shouldBeIdempotent() {
        String raw = String.join("\n",
                "دقعلا مقر: 22477445",
                "22477445 :دقعلا مقر",
                "ةيسنجلا: يدوعس",
                TextCleaningUtils.reverse(SENTENCE),
                SENTENCE,
                TextCleaningUtils.reverse(VOCALIZED_SENTENCE),
                "Email: hr@company.com",
                "رقم الجوال: 966 0505606061",
                "دقعلا: 10:30");

        String once = normalizer.normalize(raw);

        assertThat(normalizer.normalize(once)).isEqualTo(once);
    }

    @Test
    void normalize_shouldBeIdempotentWithStackedHarakat() {
        String glyphOrder = new StringBuilder(VOCALIZED_SENTENCE).reverse().toString();
        String clusterOrder = TextCleaningUtils.reverse(VOCALIZED_SENTENCE);

        for (String raw : new String[] { glyphOrder, clusterOrder }) {
            String once = normalizer.normalize(raw);

            assertThat(normalizer.normalize(once)).isEqualTo(once);
            assertThat(once).startsWith("تبدأ \u0645\u062F");
        }
    }

    @Test
    void normalize_shouldReturnEmptyForNullOrEmpty() {
        assertThat(normalizer.normalize(null)).isEmpty();
        assertThat(normalizer.normalize("")).isEmpty();
        assertThat(normalizer.normalize("  \n \n")).isEmpty();
    }

    @Test
    void constructor_shouldRejectNonPositiveThreshold() {
        assertThatThrownBy(() -> new ContractTextNormalizer(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
