package com.odedia.contracts.utils;

import java.text.BreakIterator;
import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Character-level cleanup shared by the PDF extractor and the text normalizer.
 *
 * Removes content that breaks label matching:
 * - Invisible bidi control characters
 * - Control characters and long base64 runs from embedded images
 * - Arabic-Indic digits (mapped to ASCII)
 * - Repeated spaces and tabs
 */
public final class TextCleaningUtils {

    private static final Logger logger = LoggerFactory.getLogger(TextCleaningUtils.class);

    // LRM, RLM, ALM, embeddings/overrides and isolates
    private static final Pattern BIDI_MARKS = Pattern.compile(
            "[\\u200E\\u200F\\u061C\\u202A-\\u202E\\u2066-\\u2069]");

    // Pattern for base64-like strings (long sequences of alphanumeric + /+=)
    private static final Pattern BASE64_PATTERN = Pattern.compile(
            "[A-Za-z0-9+/]{50,}={0,2}");

    private static final Pattern CONTROL_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    private static final Pattern MULTI_SPACE = Pattern.compile("[ \\t\\u00A0]{2,}|\\t|\\u00A0");

    private TextCleaningUtils() {
    }

    /**
     * NFKC normalization. Folds Arabic presentation forms and full-width
     * punctuation into their base characters.
     */
    public static String compatibilityNormalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return Normalizer.normalize(text, Normalizer.Form.NFKC);
    }

    public static String stripDirectionalMarks(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return BIDI_MARKS.matcher(text).replaceAll("");
    }

    /**
     * Maps Arabic-Indic (U+0660..U+0669) and extended Arabic-Indic
     * (U+06F0..U+06F9) digits to ASCII digits.
     */
    public static String toAsciiDigits(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder sb = null;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            char mapped = c;
            if (c >= '٠' && c <= '٩') {
                mapped = (char) ('0' + (c - '٠'));
            } else if (c >= '۰' && c <= '۹') {
                mapped = (char) ('0' + (c - '۰'));
            }
            if (mapped != c && sb == null) {
                sb = new StringBuilder(text);
            }
            if (sb != null) {
                sb.setCharAt(i, mapped);
            }
        }
        return sb == null ? text : sb.toString();
    }

    public static String collapseSpaces(String line) {
        if (line == null || line.isEmpty()) {
            return "";
        }
        return MULTI_SPACE.matcher(line).replaceAll(" ");
    }

    /**
     * Reverses the order of user-perceived characters. Combining marks such as
     * harakat stay behind their base letter, so a reversed line is still in
     * canonical order and NFKC leaves it alone.
     */
    public static String reverse(String text) {
        if (text == null || text.length() < 2) {
            return text == null ? "" : text;
        }
        BreakIterator clusters = BreakIterator.getCharacterInstance(Locale.ROOT);
        clusters.setText(text);
        StringBuilder sb = new StringBuilder(text.length());
        int end = clusters.last();
        for (int start = clusters.previous(); start != BreakIterator.DONE; end = start, start = clusters.previous()) {
            sb.append(text, start, end);
        }
        return sb.toString();
    }

    /**
     * Clean text extracted from a PDF page before it is normalized.
     *
     * @param text Raw extracted text
     * @return Text without control characters or embedded binary runs, one
     *         trimmed non-blank line per line
     */
    public static String cleanExtractedText(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String original = text;

        text = BASE64_PATTERN.matcher(text).replaceAll(" ");
        text = CONTROL_CHARS.matcher(text).replaceAll("");

        String[] lines = text.split("\\r?\\n");
        StringBuilder result = new StringBuilder();
        for (String line : lines) {
            String trimmed = collapseSpaces(line).trim();
            if (!trimmed.isEmpty()) {
                result.append(trimmed).append("\n");
            }
        }
        text = result.toString().trim();

        int removed = original.length() - text.length();
        if (removed > 100) {
            logger.info("Cleaned text: removed {} characters ({} -> {})",
                    removed, original.length(), text.length());
        }

        return text;
    }
}
