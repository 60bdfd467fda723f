package com.odedia.contracts.quality;

import java.util.List;

import com.odedia.contracts.schema.ContractField;

/**
 * Completeness of one extracted record.
 *
 * @param filled  Number of fields with a non-blank value
 * @param total   Schema size
 * @param percent {@code filled / total * 100}, rounded to one decimal
 * @param missing Empty fields in schema order
 */
public record QualityReport(int filled, int total, double percent, List<ContractField> missing) {

	public QualityReport {
		missing = List.copyOf(missing);
	}

	public List<String> missingHeaders() {
		return missing.stream().map(ContractField::getHeader).toList();
	}

	/**
	 * First {@code limit} missing headers joined by ", ", with " ..." when more
	 * are missing.
	 */
	public String missingSummary(int limit) {
		List<String> headers = missingHeaders();
		String shown = String.join(", ", headers.subList(0, Math.min(limit, headers.size())));
		return headers.size() > limit ? shown + " ..." : shown;
	}
}
