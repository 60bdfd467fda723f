package com.odedia.contracts.utils;

/**
 * Letter and digit counts of a piece of text, split by script.
 *
 * Arabic letters are code points of the Arabic script that are letters
 * (diacritics and Arabic-Indic digits are not counted as letters). Latin
 * letters are letters of the Latin script.
 */
public record ScriptCounts(int arabicLetters, int latinLetters, int digits) {

	public static ScriptCounts of(String text) {
		if (text == null || text.isEmpty()) {
			return new ScriptCounts(0, 0, 0);
		}
		int arabic = 0;
		int latin = 0;
		int digits = 0;
		int i = 0;
		while (i < text.length()) {
			int cp = text.codePointAt(i);
			if (Character.isDigit(cp)) {
				digits++;
			} else if (Character.isLetter(cp)) {
				Character.UnicodeScript script = Character.UnicodeScript.of(cp);
				if (script == Character.UnicodeScript.ARABIC) {
					arabic++;
				} else if (script == Character.UnicodeScript.LATIN) {
					latin++;
				}
			}
			i += Character.charCount(cp);
		}
		return new ScriptCounts(arabic, latin, digits);
	}

	public boolean hasLatin() {
		return latinLetters > 0;
	}

	public boolean arabicDominates() {
		return arabicLetters > latinLetters;
	}
}
