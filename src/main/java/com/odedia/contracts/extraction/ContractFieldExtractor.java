package com.odedia.contracts.extraction;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.odedia.contracts.dto.ExtractedRecord;
import com.odedia.contracts.schema.ContractField;
import com.odedia.contracts.schema.ContractSchema;

/**
 * Builds an {@link ExtractedRecord} from normalized contract text by running
 * every rule of the rule table.
 *
 * Rules run independently: a rule that finds nothing, or fails, leaves its
 * fields empty and does not affect the others. {@link #extract(String)} never
 * throws and always returns a record holding every schema field.
 */
public class ContractFieldExtractor {

	private static final Logger logger = LoggerFactory.getLogger(ContractFieldExtractor.class);

	private final ContractSchema schema;
	private final FieldRuleTable ruleTable;

	public ContractFieldExtractor(ContractSchema schema, FieldRuleTable ruleTable) {
		this.schema = schema;
		this.ruleTable = ruleTable;
	}

	public ExtractedRecord extract(String normalizedText) {
		ExtractedRecord record = ExtractedRecord.empty(schema);
		if (normalizedText == null || normalizedText.isBlank()) {
			return record;
		}

		int found = 0;
		for (ExtractionRule rule : ruleTable.rules()) {
			Map<ContractField, String> values;
			try {
				values = rule.apply(normalizedText);
			} catch (RuntimeException e) {
				logger.debug("Rule {} failed, leaving {} empty: {}", rule, rule.targets(), e.toString());
				continue;
			}
			for (Map.Entry<ContractField, String> entry : values.entrySet()) {
				String value = entry.getValue();
				if (value != null && !value.isBlank() && schema.contains(entry.getKey())) {
					record.set(entry.getKey(), value);
					found++;
				}
			}
		}

		logger.debug("Extracted {}/{} fields", found, schema.size());
		return record;
	}
}
