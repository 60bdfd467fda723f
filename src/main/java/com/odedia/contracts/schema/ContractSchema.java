package com.odedia.contracts.schema;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, ordered set of the fields every extracted record carries.
 *
 * The standard schema lists all {@link ContractField} constants in declaration
 * order. Instances are created once and injected wherever the field order
 * matters (extraction, scoring, fallback prompts, export).
 */
public final class ContractSchema {

	private final List<ContractField> fields;
	private final Map<String, ContractField> byHeader;

	private ContractSchema(List<ContractField> fields) {
		if (fields.isEmpty()) {
			throw new IllegalArgumentException("A contract schema needs at least one field");
		}
		this.fields = List.copyOf(fields);
		Map<String, ContractField> headers = new LinkedHashMap<>();
		for (ContractField field : this.fields) {
			if (headers.put(field.getHeader(), field) != null) {
				throw new IllegalArgumentException("Duplicate field in schema: " + field);
			}
		}
		this.byHeader = Map.copyOf(headers);
	}

	public static ContractSchema standard() {
		return new ContractSchema(Arrays.asList(ContractField.values()));
	}

	public static ContractSchema of(List<ContractField> fields) {
		return new ContractSchema(fields);
	}

	public List<ContractField> fields() {
		return fields;
	}

	public int size() {
		return fields.size();
	}

	public boolean contains(ContractField field) {
		return byHeader.containsKey(field.getHeader());
	}

	/**
	 * Column headers in schema order.
	 */
	public List<String> headers() {
		return fields.stream().map(ContractField::getHeader).toList();
	}

	/**
	 * Resolves a header back to its field, used when reading model responses
	 * keyed by header text.
	 */
	public Optional<ContractField> fieldForHeader(String header) {
		if (header == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(byHeader.get(header.trim()));
	}

	@Override
	public String toString() {
		return "ContractSchema" + headers();
	}
}
