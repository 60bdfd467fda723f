package com.odedia.contracts.extraction;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.odedia.contracts.schema.ContractField;

/**
 * Assigns the employer and employee email addresses.
 *
 * Contracts print both addresses under the same label, so the label alone
 * cannot tell them apart. See {@link EmailStrategy} for the two assignment
 * strategies.
 */
public final class EmailAssignmentRule implements ExtractionRule {

	static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+\\-]+@[A-Za-z0-9.\\-]+\\.[A-Za-z]{2,}");

	static final String FIRST_PARTY = "الطرف الأول";
	static final String SECOND_PARTY = "الطرف الثاني";
	static final String AGREEMENT = "اتفق الطرفان";

	private final EmailStrategy strategy;

	public EmailAssignmentRule(EmailStrategy strategy) {
		this.strategy = strategy;
	}

	@Override
	public Set<ContractField> targets() {
		return Set.of(ContractField.COMPANY_EMAIL, ContractField.EMPLOYEE_EMAIL);
	}

	@Override
	public Map<ContractField, String> apply(String text) {
		Map<ContractField, String> out = new EnumMap<>(ContractField.class);
		if (text == null || text.isEmpty()) {
			return out;
		}
		if (strategy == EmailStrategy.SECTION && text.contains(FIRST_PARTY) && text.contains(SECOND_PARTY)) {
			emails(sliceBetween(text, FIRST_PARTY, SECOND_PARTY)).stream().findFirst()
					.ifPresent(email -> out.put(ContractField.COMPANY_EMAIL, email));
			emails(sliceBetween(text, SECOND_PARTY, AGREEMENT)).stream().findFirst()
					.ifPresent(email -> out.put(ContractField.EMPLOYEE_EMAIL, email));
			return out;
		}

		List<String> all = emails(text);
		if (!all.isEmpty()) {
			out.put(ContractField.COMPANY_EMAIL, all.get(0));
		}
		if (all.size() > 1) {
			out.put(ContractField.EMPLOYEE_EMAIL, all.get(1));
		}
		return out;
	}

	static List<String> emails(String text) {
		List<String> found = new ArrayList<>();
		Matcher m = EMAIL.matcher(text);
		while (m.find()) {
			found.add(m.group());
		}
		return found;
	}

	/**
	 * Text from the start keyword up to the end keyword, or to the end of the
	 * text when the end keyword is missing.
	 */
	static String sliceBetween(String text, String startKeyword, String endKeyword) {
		int start = text.indexOf(startKeyword);
		if (start < 0) {
			return "";
		}
		int end = text.indexOf(endKeyword, start + startKeyword.length());
		return end < 0 ? text.substring(start) : text.substring(start, end);
	}
}
