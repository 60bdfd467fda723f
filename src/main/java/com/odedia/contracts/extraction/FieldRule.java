package com.odedia.contracts.extraction;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

import com.odedia.contracts.schema.ContractField;

/**
 * Single-field rule: ordered locators plus the sanitizer that turns the located
 * text into the canonical value.
 *
 * Locators are tried in order; a locator whose sanitized value is empty does
 * not stop the search.
 */
public final class FieldRule implements ExtractionRule {

	private final ContractField field;
	private final List<ValueLocator> locators;
	private final UnaryOperator<String> sanitizer;

	public FieldRule(ContractField field, List<ValueLocator> locators, UnaryOperator<String> sanitizer) {
		if (locators.isEmpty()) {
			throw new IllegalArgumentException("No locator for " + field);
		}
		this.field = field;
		this.locators = List.copyOf(locators);
		this.sanitizer = sanitizer;
	}

	public static FieldRule of(ContractField field, UnaryOperator<String> sanitizer, ValueLocator... locators) {
		return new FieldRule(field, Arrays.asList(locators), sanitizer);
	}

	@Override
	public Set<ContractField> targets() {
		return Set.of(field);
	}

	@Override
	public Map<ContractField, String> apply(String text) {
		for (ValueLocator locator : locators) {
			String raw = locator.locate(text);
			if (raw.isEmpty()) {
				continue;
			}
			String value = sanitizer.apply(raw);
			if (value != null && !value.isBlank()) {
				return Map.of(field, value.strip());
			}
		}
		return Map.of();
	}

	/**
	 * Convenience for tests and diagnostics.
	 */
	public String extract(String text) {
		return apply(text).getOrDefault(field, "");
	}

	@Override
	public String toString() {
		return "FieldRule[" + field + " " + locators + "]";
	}
}
