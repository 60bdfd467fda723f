package com.odedia.contracts.extraction;

/**
 * Finds the raw text of one value inside normalized contract text.
 */
@FunctionalInterface
public interface ValueLocator {

	/**
	 * @param text Normalized contract text, never null
	 * @return The raw value, or {@code ""} when nothing was found
	 */
	String locate(String text);
}
