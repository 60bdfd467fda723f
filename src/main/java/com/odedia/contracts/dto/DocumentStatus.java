package com.odedia.contracts.dto;

/**
 * Processing status of one document.
 */
public enum DocumentStatus {
	/** Completeness reached the quality threshold. */
	OK,
	/** Parsed, but below the quality threshold. */
	LOW_QUALITY,
	/** Input empty or too small to be a contract. */
	SKIPPED,
	/** Processing failed; the record is empty. */
	ERROR
}
