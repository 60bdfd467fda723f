package com.odedia.contracts.dto;

import java.util.Map;

import com.odedia.contracts.schema.ContractField;

/**
 * Values the fallback model returned for the fields it was asked about.
 *
 * @param values     Requested fields only; a field the model could not find maps
 *                   to {@code ""}
 * @param evidence   Short text snippets backing each value, when provided
 * @param confidence Model confidence in [0, 1] per field, when provided
 * @param rawText    The model's unparsed reply
 */
public record FallbackResult(
		Map<ContractField, String> values,
		Map<ContractField, String> evidence,
		Map<ContractField, Double> confidence,
		String rawText) {

	public FallbackResult {
		values = Map.copyOf(values);
		evidence = Map.copyOf(evidence);
		confidence = Map.copyOf(confidence);
		rawText = rawText == null ? "" : rawText;
	}

	/**
	 * Writes each non-empty value into the record, but only where the record's
	 * field is still empty. Fields already filled are never overwritten.
	 *
	 * @return Number of fields filled
	 */
	public int mergeInto(ExtractedRecord record) {
		int filled = 0;
		for (ContractField field : record.fields()) {
			String value = values.get(field);
			if (value == null || value.isBlank() || !record.isBlank(field)) {
				continue;
			}
			record.set(field, value);
			filled++;
		}
		return filled;
	}
}
