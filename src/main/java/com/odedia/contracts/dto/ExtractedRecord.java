package com.odedia.contracts.dto;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonValue;
import com.odedia.contracts.schema.ContractField;
import com.odedia.contracts.schema.ContractSchema;

/**
 * One contract's extracted values, keyed by {@link ContractField}.
 *
 * Every schema field is present from construction and holds a non-null string;
 * unknown values are represented by the empty string.
 */
public class ExtractedRecord {

	private final ContractSchema schema;
	private final EnumMap<ContractField, String> values = new EnumMap<>(ContractField.class);

	private ExtractedRecord(ContractSchema schema) {
		this.schema = schema;
		for (ContractField field : schema.fields()) {
			values.put(field, "");
		}
	}

	/**
	 * Creates a record with every field of the schema set to {@code ""}.
	 */
	public static ExtractedRecord empty(ContractSchema schema) {
		return new ExtractedRecord(schema);
	}

	public String get(ContractField field) {
		String value = values.get(field);
		return value == null ? "" : value;
	}

	/**
	 * Sets a field value; {@code null} is stored as {@code ""} and values are
	 * trimmed. Fields outside the schema are rejected.
	 */
	public void set(ContractField field, String value) {
		if (!values.containsKey(field)) {
			throw new IllegalArgumentException(field + " is not part of " + schema);
		}
		values.put(field, value == null ? "" : value.strip());
	}

	public boolean isBlank(ContractField field) {
		return get(field).isBlank();
	}

	public List<ContractField> fields() {
		return schema.fields();
	}

	/**
	 * Header to value, in schema order.
	 */
	@JsonValue
	public Map<String, String> asHeaderMap() {
		Map<String, String> ordered = new LinkedHashMap<>();
		for (ContractField field : schema.fields()) {
			ordered.put(field.getHeader(), get(field));
		}
		return ordered;
	}

	/**
	 * Values in schema order, for row-oriented consumers.
	 */
	public List<String> asRow() {
		return schema.fields().stream().map(this::get).toList();
	}

	@Override
	public String toString() {
		return "ExtractedRecord" + asHeaderMap();
	}
}
