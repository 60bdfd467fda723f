package com.odedia.contracts.rtl;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.odedia.contracts.utils.ScriptCounts;
import com.odedia.contracts.utils.TextCleaningUtils;

/**
 * Repairs right-to-left extraction artifacts in contract text, line by line.
 *
 * Key features:
 * - Unicode compatibility normalization and bidi mark removal
 * - Mirrored label repair on {@code label: value} lines, including the
 *   {@code value :label} visual order produced by RTL extraction
 * - Mirrored sentence repair on long Arabic lines without a colon
 *
 * Normalization is idempotent: a line is only reversed when it reads mirrored,
 * and a reversed line reads in order.
 */
public class ContractTextNormalizer {

	private static final Logger logger = LoggerFactory.getLogger(ContractTextNormalizer.class);

	private static final int MAX_LABEL_DIGITS = 3;

	private final int sentenceFlipMinArabic;

	public ContractTextNormalizer(int sentenceFlipMinArabic) {
		if (sentenceFlipMinArabic < 1) {
			throw new IllegalArgumentException("sentenceFlipMinArabic must be positive");
		}
		this.sentenceFlipMinArabic = sentenceFlipMinArabic;
	}

	/**
	 * Normalizes a whole document.
	 *
	 * @param rawText Text as produced by the PDF extractor, may be null
	 * @return Repaired non-empty lines joined by {@code \n}
	 */
	public String normalize(String rawText) {
		if (rawText == null || rawText.isEmpty()) {
			return "";
		}

		String text = TextCleaningUtils.compatibilityNormalize(rawText);
		text = TextCleaningUtils.stripDirectionalMarks(text);
		text = TextCleaningUtils.toAsciiDigits(text);

		List<String> lines = new ArrayList<>();
		int repaired = 0;
		for (String line : text.split("\\r?\\n|\\r")) {
			String cleaned = TextCleaningUtils.collapseSpaces(line).trim();
			if (cleaned.isEmpty()) {
				continue;
			}
			String fixed = repairLine(cleaned);
			if (!fixed.equals(cleaned)) {
				repaired++;
			}
			lines.add(fixed);
		}

		logger.debug("Normalized {} lines, repaired {}", lines.size(), repaired);
		return String.join("\n", lines);
	}

	String repairLine(String line) {
		int colon = line.indexOf(':');
		if (colon >= 0 && colon == line.lastIndexOf(':')) {
			return repairLabelValue(line, colon);
		}
		if (colon < 0) {
			return repairFreeText(line);
		}
		return line;
	}

	private String repairLabelValue(String line, int colon) {
		String left = line.substring(0, colon).trim();
		String right = line.substring(colon + 1).trim();

		if (isLabelShaped(left) && ArabicOrientation.isInReadingOrder(left)) {
			return line;
		}
		if (isLabelShaped(right) && ArabicOrientation.isMirrored(right)) {
			return joinLabelValue(TextCleaningUtils.reverse(right), left);
		}
		if (isLabelShaped(left) && ArabicOrientation.isMirrored(left)) {
			return joinLabelValue(TextCleaningUtils.reverse(left), right);
		}
		return line;
	}

	private String repairFreeText(String line) {
		ScriptCounts counts = ScriptCounts.of(line);
		if (counts.arabicLetters() >= sentenceFlipMinArabic
				&& counts.arabicDominates()
				&& ArabicOrientation.isMirrored(line)) {
			return TextCleaningUtils.reverse(line);
		}
		return line;
	}

	/**
	 * A label is Arabic, carries no Latin letters and at most a couple of digits.
	 */
	private static boolean isLabelShaped(String side) {
		ScriptCounts counts = ScriptCounts.of(side);
		return counts.arabicLetters() >= 1 && !counts.hasLatin() && counts.digits() < MAX_LABEL_DIGITS;
	}

	private static String joinLabelValue(String label, String value) {
		return value.isEmpty() ? label + ":" : label + ": " + value;
	}
}
