package com.odedia.contracts.rtl;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Judges whether a run of Arabic text is in reading order or mirrored.
 *
 * Arabic words carry positional cues: the definite article (optionally behind a
 * one-letter proclitic) and hamza on alef only open a word, teh marbuta and
 * alef maksura only close one. In mirrored text these cues appear on the
 * opposite end. Common particles such as "في" and "من" count as a cue when they
 * appear whole, so sentences built from dates and bare nouns still have
 * evidence. The score is the number of mirrored cues minus the number of
 * reading-order cues, so reversing a string negates its score exactly.
 */
final class ArabicOrientation {

	// harakat have the Inherited script, so marks are matched separately
	private static final Pattern ARABIC_WORD = Pattern.compile("[\\p{IsArabic}&&\\p{L}](?:[\\p{IsArabic}&&\\p{L}]|\\p{Mn})*");
	private static final Pattern MARKS = Pattern.compile("\\p{Mn}");

	private static final String ARTICLE = "ال";
	private static final String ARTICLE_MIRRORED = "لا";
	private static final String PROCLITICS = "وبفك";
	private static final char TEH_MARBUTA = 'ة';
	private static final char ALEF_MAKSURA = 'ى';
	private static final String HAMZA_ALEF = "أإ";

	private static final Set<String> PARTICLES = Set.of("في", "من", "عن", "هذا", "ذلك", "يوم", "بين");
	private static final Set<String> PARTICLES_MIRRORED = Set.of("يف", "نم", "نع", "اذه", "كلذ", "موي", "نيب");

	private ArabicOrientation() {
	}

	/**
	 * Positive when the text reads mirrored, negative when it reads in order,
	 * zero when there is no evidence either way.
	 */
	static int score(String text) {
		if (text == null || text.isEmpty()) {
			return 0;
		}
		int forward = 0;
		int mirrored = 0;
		Matcher m = ARABIC_WORD.matcher(text);
		while (m.find()) {
			String word = MARKS.matcher(m.group()).replaceAll("");
			forward += forwardCues(word);
			mirrored += mirroredCues(word);
		}
		return mirrored - forward;
	}

	static boolean isMirrored(String text) {
		return score(text) > 0;
	}

	static boolean isInReadingOrder(String text) {
		return score(text) < 0;
	}

	private static int forwardCues(String word) {
		int cues = 0;
		int len = word.length();
		if (len >= 3 && word.startsWith(ARTICLE)) {
			cues++;
		} else if (len >= 4 && PROCLITICS.indexOf(word.charAt(0)) >= 0 && word.startsWith(ARTICLE, 1)) {
			cues++;
		}
		if (len >= 2) {
			char last = word.charAt(len - 1);
			if (last == TEH_MARBUTA || last == ALEF_MAKSURA) {
				cues++;
			}
			if (HAMZA_ALEF.indexOf(word.charAt(0)) >= 0) {
				cues++;
			}
		}
		if (PARTICLES.contains(word)) {
			cues++;
		}
		return cues;
	}

	private static int mirroredCues(String word) {
		int cues = 0;
		int len = word.length();
		if (len >= 3 && word.endsWith(ARTICLE_MIRRORED)) {
			cues++;
		} else if (len >= 4 && PROCLITICS.indexOf(word.charAt(len - 1)) >= 0
				&& word.startsWith(ARTICLE_MIRRORED, len - 3)) {
			cues++;
		}
		if (len >= 2) {
			char first = word.charAt(0);
			if (first == TEH_MARBUTA || first == ALEF_MAKSURA) {
				cues++;
			}
			if (HAMZA_ALEF.indexOf(word.charAt(len - 1)) >= 0) {
				cues++;
			}
		}
		if (PARTICLES_MIRRORED.contains(word)) {
			cues++;
		}
		return cues;
	}
}
