package com.odedia.contracts.dto;

import java.time.Instant;

import com.odedia.contracts.quality.QualityReport;

/**
 * Result of processing one document.
 *
 * @param fileName       Uploaded file name
 * @param timestamp      When processing finished
 * @param status         Document status
 * @param record         Extracted record, all-empty for SKIPPED and ERROR
 * @param quality        Completeness of {@code record}
 * @param note           Human-readable explanation of the status
 * @param fallbackFilled Fields filled by the fallback model
 * @param fallbackError  Why the fallback was not applied, or {@code ""}
 */
public record DocumentOutcome(
		String fileName,
		Instant timestamp,
		DocumentStatus status,
		ExtractedRecord record,
		QualityReport quality,
		String note,
		int fallbackFilled,
		String fallbackError) {

	public DocumentOutcome {
		note = note == null ? "" : note;
		fallbackError = fallbackError == null ? "" : fallbackError;
	}

	/**
	 * One line of the plain-text report.
	 */
	public String reportLine() {
		if (status == DocumentStatus.SKIPPED) {
			return "- " + fileName + ": SKIPPED (" + note + ")";
		}
		if (status == DocumentStatus.ERROR) {
			return "- " + fileName + ": ERROR -> " + note;
		}
		return "- " + fileName + ": " + status + " | Quality " + quality.percent()
				+ "% | Missing " + quality.missing().size() + " fields";
	}
}
