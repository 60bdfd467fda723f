package com.odedia.contracts.extraction;

import java.util.List;
import java.util.Locale;

/**
 * Returns the whole first line that mentions one of the keywords, for values
 * whose pieces can land on either side of the label (phone numbers).
 */
public class LineLocator implements ValueLocator {

	private final List<String> keywords;

	public LineLocator(List<String> keywords) {
		if (keywords.isEmpty()) {
			throw new IllegalArgumentException("At least one keyword is required");
		}
		this.keywords = keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
	}

	public static LineLocator of(String... keywords) {
		return new LineLocator(List.of(keywords));
	}

	@Override
	public String locate(String text) {
		if (text == null || text.isEmpty()) {
			return "";
		}
		String[] lines = text.split("\n");
		for (String keyword : keywords) {
			for (String line : lines) {
				if (line.toLowerCase(Locale.ROOT).contains(keyword)) {
					return line.strip();
				}
			}
		}
		return "";
	}

	@Override
	public String toString() {
		return "LineLocator" + keywords;
	}
}
