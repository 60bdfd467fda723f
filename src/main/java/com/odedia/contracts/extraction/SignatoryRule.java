package com.odedia.contracts.extraction;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

import com.odedia.contracts.schema.ContractField;

/**
 * Splits the "represented in signing by" line into the signatory's name and
 * title, e.g. "عبدالرحمن محمد بصفته مدير الموارد البشرية".
 *
 * The value is un-mirrored first and then split on the joining keyword. Without
 * the keyword the whole value is the name.
 */
public final class SignatoryRule implements ExtractionRule {

	static final String JOINING_KEYWORD = "بصفته";

	private final ValueLocator locator;
	private final UnaryOperator<String> sanitizer;
	private final String joiningKeyword;

	public SignatoryRule(ValueLocator locator, UnaryOperator<String> sanitizer) {
		this(locator, sanitizer, JOINING_KEYWORD);
	}

	public SignatoryRule(ValueLocator locator, UnaryOperator<String> sanitizer, String joiningKeyword) {
		this.locator = locator;
		this.sanitizer = sanitizer;
		this.joiningKeyword = joiningKeyword;
	}

	@Override
	public Set<ContractField> targets() {
		return Set.of(ContractField.SIGNATORY_NAME, ContractField.SIGNATORY_TITLE);
	}

	@Override
	public Map<ContractField, String> apply(String text) {
		Map<ContractField, String> out = new EnumMap<>(ContractField.class);
		String raw = locator.locate(text);
		if (raw.isEmpty()) {
			return out;
		}
		String value = sanitizer.apply(raw);
		int split = value.indexOf(joiningKeyword);
		if (split < 0) {
			out.put(ContractField.SIGNATORY_NAME, value.strip());
			return out;
		}
		out.put(ContractField.SIGNATORY_NAME, value.substring(0, split).strip());
		out.put(ContractField.SIGNATORY_TITLE, value.substring(split + joiningKeyword.length()).strip());
		return out;
	}
}
