package com.odedia.contracts.extraction;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LabelLocatorTest {

    @Test
    void locate_shouldReadValueAfterLabel() {
        LabelLocator locator = LabelLocator.of("رقم الهوية", "ID Number");

        assertThat(locator.locate("الاسم: x\nرقم الهوية: 1012345678\n")).isEqualTo("1012345678");
        assertThat(locator.locate("id number : 1012345678")).isEqualTo("1012345678");
    }

    @Test
    void locate_shouldReadToLineEndIncludingColons() {
        LabelLocator locator = LabelLocator.of("Nationality");

        assertThat(locator.locate("Nationality: Saudi\nReligion: Muslim")).isEqualTo("Saudi");
        assertThat(locator.locate("Nationality: Saudi Gender: Male\nReligion: Muslim"))
                .isEqualTo("Saudi Gender: Male");
        assertThat(LabelLocator.of("Working Hours").locate("Working Hours: 08:00-17:00"))
                .isEqualTo("08:00-17:00");
    }

    @Test
    void locate_shouldReadValueBeforeLabel() {
        LabelLocator locator = LabelLocator.of("Employee Number");

        assertThat(locator.locate("5521 : Employee Number")).isEqualTo("5521");
    }

    @Test
    void locate_shouldFindMirroredLabels() {
        LabelLocator locator = LabelLocator.of("رقم الهوية");

        assertThat(locator.locate(SampleContracts.mirror("رقم الهوية") + ": 1012345678"))
                .isEqualTo("1012345678");
    }

    @Test
    void locate_shouldNotMatchInsideLongerWords() {
        LabelLocator locator = LabelLocator.of("الجنس");

        assertThat(locator.locate("الجنسية: سعودي")).isEmpty();
        assertThat(locator.locate("الجنسية: سعودي\nالجنس: ذكر")).isEqualTo("ذكر");
    }

    @Test
    void locate_shouldAnchorLineStartLabels() {
        LabelLocator locator = LabelLocator.of(Label.lineStart("Name"));

        assertThat(locator.locate("Bank Name: Al Rajhi")).isEmpty();
        assertThat(locator.locate("Bank Name: Al Rajhi\nName: Ahmed Ali")).isEqualTo("Ahmed Ali");
    }

    @Test
    void locate_shouldSkipEmptyValues() {
        LabelLocator locator = LabelLocator.of("Religion");

        assertThat(locator.locate("Religion:\nReligion: Muslim")).isEqualTo("Muslim");
    }

    @Test
    void locate_shouldReturnEmptyWhenAbsent() {
        assertThat(LabelLocator.of("IBAN").locate("nothing here")).isEmpty();
        assertThat(LabelLocator.of("IBAN").locate(null)).isEmpty();
    }

    @Test
    void constructor_shouldRequireALabel() {
        assertThatThrownBy(() -> LabelLocator.of(new String[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
