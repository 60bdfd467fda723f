package com.odedia.contracts.extraction;

import java.util.Map;
import java.util.Set;

import com.odedia.contracts.schema.ContractField;

/**
 * One entry of the extraction rule table. A rule fills one or more fields and
 * is evaluated independently of every other rule.
 */
public interface ExtractionRule {

	/**
	 * Fields this rule can fill.
	 */
	Set<ContractField> targets();

	/**
	 * @param text Normalized contract text
	 * @return Canonical values for the fields found; fields not found are absent
	 *         or map to {@code ""}
	 */
	Map<ContractField, String> apply(String text);
}
