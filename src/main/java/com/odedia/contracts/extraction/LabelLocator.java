package com.odedia.contracts.extraction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.odedia.contracts.utils.TextCleaningUtils;

/**
 * Locates a value by its label, trying the aliases in order.
 *
 * Lookup order, first non-empty value wins:
 * 1. {@code alias: value} for each alias
 * 2. {@code value :alias} for each alias
 * 3. both orders again with each alias mirrored, for lines the normalizer
 *    could not repair
 *
 * After a label the value runs to the end of the line, colons included
 * ({@code "Time: 10:30"}). Before a label it runs back to the previous colon or
 * line start.
 */
public class LabelLocator implements ValueLocator {

	private static final String NOT_AFTER_LETTER = "(?<![\\p{L}\\p{M}])";
	private static final String NOT_BEFORE_LETTER = "(?![\\p{L}\\p{M}])";
	private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.MULTILINE;

	private final List<Label> labels;
	private final List<Pattern> patterns;

	public LabelLocator(List<Label> labels) {
		if (labels.isEmpty()) {
			throw new IllegalArgumentException("At least one label is required");
		}
		this.labels = List.copyOf(labels);

		List<Pattern> valueAfter = new ArrayList<>();
		List<Pattern> valueBefore = new ArrayList<>();
		List<Pattern> mirrored = new ArrayList<>();
		for (Label label : this.labels) {
			valueAfter.add(valueAfter(label.text(), label.lineStart()));
			valueBefore.add(valueBefore(label.text(), label.lineStart()));
		}
		for (Label label : this.labels) {
			String reversed = TextCleaningUtils.reverse(label.text());
			if (!reversed.equals(label.text())) {
				mirrored.add(valueAfter(reversed, label.lineStart()));
				mirrored.add(valueBefore(reversed, label.lineStart()));
			}
		}

		List<Pattern> all = new ArrayList<>(valueAfter);
		all.addAll(valueBefore);
		all.addAll(mirrored);
		this.patterns = List.copyOf(all);
	}

	public static LabelLocator of(String... labels) {
		return new LabelLocator(Arrays.stream(labels).map(Label::of).toList());
	}

	public static LabelLocator of(Label... labels) {
		return new LabelLocator(Arrays.asList(labels));
	}

	@Override
	public String locate(String text) {
		if (text == null || text.isEmpty()) {
			return "";
		}
		for (Pattern pattern : patterns) {
			Matcher m = pattern.matcher(text);
			while (m.find()) {
				String value = m.group(1).strip();
				if (!value.isEmpty()) {
					return value;
				}
			}
		}
		return "";
	}

	private static Pattern valueAfter(String label, boolean lineStart) {
		String prefix = lineStart ? "^[ \\t]*" : NOT_AFTER_LETTER;
		return Pattern.compile(prefix + Pattern.quote(label) + "[ \\t]*:[ \\t]*([^\\n]*)", FLAGS);
	}

	private static Pattern valueBefore(String label, boolean lineStart) {
		String suffix = lineStart ? "[ \\t]*$" : NOT_BEFORE_LETTER;
		return Pattern.compile("([^\\n:]*?)[ \\t]*:[ \\t]*" + Pattern.quote(label) + suffix, FLAGS);
	}

	@Override
	public String toString() {
		return "LabelLocator" + labels.stream().map(Label::text).toList();
	}
}
