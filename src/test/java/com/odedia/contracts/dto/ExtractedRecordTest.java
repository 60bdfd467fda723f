package com.odedia.contracts.dto;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.odedia.contracts.schema.ContractField;
import com.odedia.contracts.schema.ContractSchema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExtractedRecordTest {

    @Test
    void empty_shouldHoldEveryFieldAsEmptyString() {
        ExtractedRecord record = ExtractedRecord.empty(ContractSchema.standard());

        assertThat(record.asRow()).hasSize(40).allMatch(String::isEmpty);
        assertThat(record.asHeaderMap().keySet()).containsExactlyElementsOf(ContractSchema.standard().headers());
    }

    @Test
    void set_shouldTrimAndMapNullToEmpty() {
        ExtractedRecord record = ExtractedRecord.empty(ContractSchema.standard());

        record.set(ContractField.GENDER, "  ذكر ");
        record.set(ContractField.IBAN, null);

        assertThat(record.get(ContractField.GENDER)).isEqualTo("ذكر");
        assertThat(record.get(ContractField.IBAN)).isEmpty();
    }

    @Test
    void set_shouldRejectFieldsOutsideTheSchema() {
        ExtractedRecord record = ExtractedRecord.empty(ContractSchema.of(List.of(ContractField.GENDER)));

        assertThatThrownBy(() -> record.set(ContractField.IBAN, "SA03"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void json_shouldBeHeaderMapInSchemaOrder() throws Exception {
        ExtractedRecord record = ExtractedRecord.empty(
                ContractSchema.of(List.of(ContractField.CONTRACT_NUMBER, ContractField.GENDER)));
        record.set(ContractField.CONTRACT_NUMBER, "22477445");

        String json = new ObjectMapper().writeValueAsString(record);

        assertThat(json).isEqualTo("{\"رقم العقد\":\"22477445\",\"الجنس\":\"\"}");
    }

    @Test
    void fallbackMerge_shouldNeverOverwriteFilledFields() {
        ExtractedRecord record = ExtractedRecord.empty(ContractSchema.standard());
        record.set(ContractField.CONTRACT_NUMBER, "22477445");

        FallbackResult result = new FallbackResult(
                Map.of(ContractField.CONTRACT_NUMBER, "999",
                        ContractField.GENDER, "ذكر",
                        ContractField.IBAN, " "),
                Map.of(), Map.of(), "{}");

        int filled = result.mergeInto(record);

        assertThat(filled).isEqualTo(1);
        assertThat(record.get(ContractField.CONTRACT_NUMBER)).isEqualTo("22477445");
        assertThat(record.get(ContractField.GENDER)).isEqualTo("ذكر");
        assertThat(record.get(ContractField.IBAN)).isEmpty();
    }
}
