package com.odedia.contracts.quality;

import java.util.ArrayList;
import java.util.List;

import com.odedia.contracts.dto.ExtractedRecord;
import com.odedia.contracts.schema.ContractField;
import com.odedia.contracts.schema.ContractSchema;

/**
 * Scores how complete an extracted record is.
 */
public class QualityScorer {

	private final ContractSchema schema;

	public QualityScorer(ContractSchema schema) {
		this.schema = schema;
	}

	public QualityReport score(ExtractedRecord record) {
		List<ContractField> missing = new ArrayList<>();
		int filled = 0;
		for (ContractField field : schema.fields()) {
			if (record.isBlank(field)) {
				missing.add(field);
			} else {
				filled++;
			}
		}
		int total = schema.size();
		double percent = Math.round(filled * 1000.0 / total) / 10.0;
		return new QualityReport(filled, total, percent, missing);
	}
}
