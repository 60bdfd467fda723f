package com.odedia.contracts.extraction;

/**
 * A label alias as it appears in front of a value.
 *
 * @param text      The label text
 * @param lineStart Whether the label must open its line. Used for short English
 *                  labels such as "Name" that also end longer labels ("Bank Name").
 */
public record Label(String text, boolean lineStart) {

	public Label {
		if (text == null || text.isBlank()) {
			throw new IllegalArgumentException("Label text must not be blank");
		}
		text = text.strip();
	}

	public static Label of(String text) {
		return new Label(text, false);
	}

	public static Label lineStart(String text) {
		return new Label(text, true);
	}
}
