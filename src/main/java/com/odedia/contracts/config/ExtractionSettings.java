package com.odedia.contracts.config;

import java.util.regex.Pattern;

import com.odedia.contracts.extraction.EmailStrategy;

/**
 * Tunable thresholds of the repair heuristics.
 *
 * The defaults were fitted to one contract template family; deployments that
 * see other templates override them through {@code app.extraction.*}.
 *
 * @param valueFlipMinArabic     minimum Arabic letters before a field value is
 *                               treated as mirrored
 * @param sentenceFlipMinArabic  minimum Arabic letters before a colon-free line
 *                               is considered for reversal
 * @param swappedDigitPattern    tokens matching this pattern are digit-swapped
 *                               short numbers
 * @param maxPlausibleYear       parsed years above this are treated as
 *                               digit-reversed
 * @param emailStrategy          how employer and employee emails are told apart
 */
public record ExtractionSettings(
		int valueFlipMinArabic,
		int sentenceFlipMinArabic,
		Pattern swappedDigitPattern,
		int maxPlausibleYear,
		EmailStrategy emailStrategy) {

	public static final int DEFAULT_VALUE_FLIP_MIN_ARABIC = 3;
	public static final int DEFAULT_SENTENCE_FLIP_MIN_ARABIC = 10;
	public static final String DEFAULT_SWAPPED_DIGIT_PATTERN = "0\\d";
	public static final int DEFAULT_MAX_PLAUSIBLE_YEAR = 2100;

	public ExtractionSettings {
		if (valueFlipMinArabic < 1 || sentenceFlipMinArabic < 1) {
			throw new IllegalArgumentException("Flip thresholds must be positive");
		}
		if (swappedDigitPattern == null) {
			swappedDigitPattern = Pattern.compile(DEFAULT_SWAPPED_DIGIT_PATTERN);
		}
		if (emailStrategy == null) {
			emailStrategy = EmailStrategy.POSITIONAL;
		}
	}

	public static ExtractionSettings defaults() {
		return new ExtractionSettings(
				DEFAULT_VALUE_FLIP_MIN_ARABIC,
				DEFAULT_SENTENCE_FLIP_MIN_ARABIC,
				Pattern.compile(DEFAULT_SWAPPED_DIGIT_PATTERN),
				DEFAULT_MAX_PLAUSIBLE_YEAR,
				EmailStrategy.POSITIONAL);
	}
}
