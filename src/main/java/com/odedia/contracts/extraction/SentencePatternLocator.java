package com.odedia.contracts.extraction;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates a value inside a contract sentence, e.g. the start date in
 * "يبدأ من تاريخ 2024-09-21". The first capture group is the value.
 */
public class SentencePatternLocator implements ValueLocator {

	private final Pattern pattern;

	public SentencePatternLocator(Pattern pattern) {
		if (pattern.matcher("").groupCount() < 1) {
			throw new IllegalArgumentException("Sentence pattern needs a capture group: " + pattern);
		}
		this.pattern = pattern;
	}

	public static SentencePatternLocator of(String regex) {
		return new SentencePatternLocator(Pattern.compile(regex, Pattern.UNICODE_CASE | Pattern.CASE_INSENSITIVE));
	}

	@Override
	public String locate(String text) {
		if (text == null || text.isEmpty()) {
			return "";
		}
		Matcher m = pattern.matcher(text);
		while (m.find()) {
			String value = m.group(1);
			if (value != null && !value.isBlank()) {
				return value.strip();
			}
		}
		return "";
	}

	@Override
	public String toString() {
		return "SentencePatternLocator[" + pattern.pattern() + "]";
	}
}
