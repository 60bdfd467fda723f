package com.odedia.contracts.dto;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcomes of a batch run, one per input document in input order.
 */
public record BatchReport(List<DocumentOutcome> outcomes, long elapsedMillis) {

	public static final String REPORT_TITLE = "PDF Contracts Extraction Report";

	public BatchReport {
		outcomes = List.copyOf(outcomes);
	}

	public Map<DocumentStatus, Long> countsByStatus() {
		Map<DocumentStatus, Long> counts = new EnumMap<>(DocumentStatus.class);
		for (DocumentStatus status : DocumentStatus.values()) {
			counts.put(status, 0L);
		}
		outcomes.forEach(o -> counts.merge(o.status(), 1L, Long::sum));
		return counts;
	}

	/**
	 * Plain-text report: a title line followed by one line per document.
	 */
	public String toReportText() {
		StringBuilder sb = new StringBuilder(REPORT_TITLE);
		for (DocumentOutcome outcome : outcomes) {
			sb.append('\n').append(outcome.reportLine());
		}
		return sb.toString();
	}
}
