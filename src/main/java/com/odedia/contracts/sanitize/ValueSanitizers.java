package com.odedia.contracts.sanitize;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.odedia.contracts.config.ExtractionSettings;
import com.odedia.contracts.utils.ScriptCounts;
import com.odedia.contracts.utils.TextCleaningUtils;

/**
 * Turns raw located substrings into canonical field values.
 *
 * All methods are side-effect free, accept null and never throw on malformed
 * input: anything that cannot be interpreted yields {@code ""}.
 */
public class ValueSanitizers {

    private static final Pattern NON_DIGITS = Pattern.compile("\\D+");
    private static final Pattern DIGIT_RUN = Pattern.compile("\\d+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern DATE_TOKEN = Pattern.compile("(\\d{1,4})[-/](\\d{1,2})[-/](\\d{1,4})");

    private static final Pattern AMOUNT_TOKEN = Pattern.compile("\\d[\\d,.]*");
    private static final Pattern AMOUNT_INTEGER_PART = Pattern.compile("(\\d[\\d,]*)(?:\\.\\d+)?");
    // "9,720.00" read back to front: a two-digit fraction leads the token
    private static final Pattern MIRRORED_AMOUNT = Pattern.compile("(\\d{2})\\.(\\d+(?:,\\d+)*)");
    // "9.720,00": grouping and decimal separators swapped
    private static final Pattern SWAPPED_SEPARATORS = Pattern.compile("\\d{1,3}(?:\\.\\d{3})+,\\d{1,2}");

    private static final String SAUDI_CODE = "966";

    private final ExtractionSettings settings;

    public ValueSanitizers(ExtractionSettings settings) {
        this.settings = settings;
    }

    public static ValueSanitizers withDefaults() {
        return new ValueSanitizers(ExtractionSettings.defaults());
    }

    public String trim(String raw) {
        return raw == null ? "" : raw.strip();
    }

    /**
     * Keeps only the digits: {@code "1010-123 456"} becomes {@code "1010123456"}.
     */
    public String digitsOnly(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        return NON_DIGITS.matcher(raw).replaceAll("");
    }

    /**
     * First run of digits, for counts embedded in words ("سنة 1").
     */
    public String firstNumber(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        Matcher m = DIGIT_RUN.matcher(raw);
        return m.find() ? m.group() : "";
    }

    /**
     * Formats the first date token as {@code DD/MM/YYYY}.
     *
     * Accepts year-first and day-first orders with {@code -} or {@code /}
     * separators. A year beyond the plausible maximum means the token was read
     * back to front; it is reversed and parsed again. Out-of-range months or
     * days produce {@code ""}.
     */
    public String formatDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        Matcher m = DATE_TOKEN.matcher(raw);
        if (!m.find()) {
            return "";
        }
        String token = m.group();
        int[] ymd = parseDateToken(token);
        if (ymd != null && ymd[0] > settings.maxPlausibleYear()) {
            ymd = parseDateToken(TextCleaningUtils.reverse(token));
        }
        if (ymd == null) {
            return "";
        }
        int year = ymd[0];
        int month = ymd[1];
        int day = ymd[2];
        if (year > settings.maxPlausibleYear() || month < 1 || month > 12 || day < 1 || day > 31) {
            return "";
        }
        return String.format(Locale.ROOT, "%02d/%02d/%04d", day, month, year);
    }

    private static int[] parseDateToken(String token) {
        Matcher m = DATE_TOKEN.matcher(token);
        if (!m.matches()) {
            return null;
        }
        String a = m.group(1);
        String b = m.group(2);
        String c = m.group(3);
        int year;
        int month = Integer.parseInt(b);
        int day;
        if (a.length() == 4) {
            year = Integer.parseInt(a);
            day = Integer.parseInt(c);
        } else {
            // a three-digit year is a truncated token, not a year
            if (c.length() == 3) {
                return null;
            }
            day = Integer.parseInt(a);
            year = Integer.parseInt(c);
            if (c.length() <= 2) {
                year += 2000;
            }
        }
        return new int[] { year, month, day };
    }

    /**
     * Integer amount as a digit string: {@code "2,000.00"} becomes {@code "2000"}.
     *
     * Repairs tokens read back to front ({@code "00.027,9"}) and tokens whose
     * grouping and decimal separators are swapped ({@code "9.720,00"}).
     */
    public String cleanAmount(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        Matcher m = AMOUNT_TOKEN.matcher(raw);
        if (!m.find()) {
            return "";
        }
        String token = trimTrailingSeparators(m.group());
        token = repairAmountToken(token);
        Matcher integer = AMOUNT_INTEGER_PART.matcher(token);
        if (!integer.find()) {
            return "";
        }
        return integer.group(1).replace(",", "");
    }

    private static String repairAmountToken(String token) {
        Matcher mirrored = MIRRORED_AMOUNT.matcher(token);
        boolean mirroredShape = mirrored.matches();
        // a "00" fraction leading the token is always a reversed read
        if (mirroredShape && "00".equals(mirrored.group(1))) {
            return TextCleaningUtils.reverse(token);
        }
        if (SWAPPED_SEPARATORS.matcher(token).matches()) {
            return token.replace('.', '#').replace(',', '.').replace('#', ',');
        }
        if (mirroredShape) {
            String rest = mirrored.group(2);
            // "50.00" and "10.5" are plain amounts; "25.005" and "12.000,2" are mirrored
            if (rest.indexOf(',') >= 0 || rest.length() >= 3) {
                return TextCleaningUtils.reverse(token);
            }
        }
        return token;
    }

    private static String trimTrailingSeparators(String token) {
        int end = token.length();
        while (end > 0 && (token.charAt(end - 1) == ',' || token.charAt(end - 1) == '.')) {
            end--;
        }
        return token.substring(0, end);
    }

    /**
     * Repairs a two-digit count whose digits were swapped: {@code "09"}
     * becomes {@code "90"}. Other tokens are returned trimmed.
     */
    public String repairSwappedDigits(String raw) {
        String token = trim(raw);
        if (settings.swappedDigitPattern().matcher(token).matches()) {
            return TextCleaningUtils.reverse(token);
        }
        return token;
    }

    /**
     * Reverses a value that reads mirrored.
     *
     * Values with an {@code @} or any Latin letter are left untouched; otherwise a
     * value with enough Arabic letters (and more Arabic than Latin letters) is
     * reversed.
     */
    public String rtlFlip(String raw) {
        String value = trim(raw);
        if (value.isEmpty() || value.indexOf('@') >= 0) {
            return value;
        }
        ScriptCounts counts = ScriptCounts.of(value);
        if (counts.hasLatin()) {
            return value;
        }
        if (counts.arabicLetters() >= settings.valueFlipMinArabic() && counts.arabicDominates()) {
            return TextCleaningUtils.reverse(value);
        }
        return value;
    }

    /**
     * Free-text field value: trimmed and un-mirrored.
     */
    public String text(String raw) {
        return rtlFlip(raw);
    }

    /**
     * Canonical Saudi mobile number, digits only, with the {@code 966} country
     * code and no trunk zero when a country code is present.
     */
    public String normalizeMobile(String line) {
        if (line == null || line.isBlank()) {
            return "";
        }
        List<String> groups = new ArrayList<>();
        Matcher m = DIGIT_RUN.matcher(line);
        while (m.find()) {
            groups.add(m.group());
        }
        if (groups.isEmpty()) {
            return "";
        }

        boolean hasCountryCode = groups.stream().anyMatch(g -> g.startsWith(SAUDI_CODE));

        String local = "";
        for (String g : groups) {
            if (g.length() == 10 && g.startsWith("05")) {
                local = g;
                break;
            }
            if (g.length() == 9 && g.startsWith("5")) {
                local = "0" + g;
                break;
            }
        }

        if (hasCountryCode && !local.isEmpty()) {
            return SAUDI_CODE + local.substring(1);
        }

        String joined = String.join("", groups);
        if (joined.startsWith(SAUDI_CODE + "0")) {
            joined = SAUDI_CODE + joined.substring(4);
        }
        return joined;
    }

    /**
     * IBAN without spaces, upper-cased.
     */
    public String compactIban(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        return WHITESPACE.matcher(raw).replaceAll("").toUpperCase(Locale.ROOT);
    }
}
