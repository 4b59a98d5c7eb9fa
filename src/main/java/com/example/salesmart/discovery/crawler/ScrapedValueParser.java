package com.example.salesmart.discovery.crawler;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort readers for marketplace strings: "149.000 ₫", "Đã bán 1,2k",
 * "4.8/5". Marketplaces change formats without notice, so nothing here throws.
 */
public final class ScrapedValueParser {

    public static final BigDecimal UNKNOWN_PRICE = BigDecimal.ZERO.setScale(2);

    private static final Pattern GROUPED_DOTS = Pattern.compile("\\d{1,3}(\\.\\d{3})+");
    private static final Pattern GROUPED_COMMAS = Pattern.compile("\\d{1,3}(,\\d{3})+");
    // suffix must end the word: "3 mẫu" is 3, not 3 million
    private static final Pattern COUNT = Pattern.compile("(\\d+(?:[.,]\\d+)*)\\s*(?:(k|tr|triệu|m)(?!\\p{L}))?");
    private static final Pattern RANGE_SEPARATOR = Pattern.compile("\\s*[-\u2013\u2014]\\s*");
    private static final Pattern DECIMAL = Pattern.compile("\\d+(?:\\.\\d+)?");

    private ScrapedValueParser() {
    }

    /**
     * @return price with scale 2; {@link #UNKNOWN_PRICE} when blank, negative or unreadable
     */
    public static BigDecimal parsePrice(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN_PRICE;
        }
        String s = raw.replace('\u00A0', ' ').trim();
        if (s.startsWith("-")) {
            return UNKNOWN_PRICE;
        }
        // "100.000 ₫ - 200.000 ₫", "₫100.000-₫200.000": lower bound
        s = RANGE_SEPARATOR.split(s, 2)[0];
        s = s.replaceAll("[^0-9.,]", "");
        if (s.isEmpty()) {
            return UNKNOWN_PRICE;
        }

        int lastDot = s.lastIndexOf('.');
        int lastComma = s.lastIndexOf(',');
        if (lastDot >= 0 && lastComma >= 0) {
            if (lastDot > lastComma) {
                s = s.replace(",", "");
            } else {
                s = s.replace(".", "").replace(',', '.');
            }
        } else if (lastComma >= 0) {
            if (GROUPED_COMMAS.matcher(s).matches() || s.indexOf(',') != lastComma) {
                s = s.replace(",", "");
            } else {
                s = s.replace(',', '.');
            }
        } else if (lastDot >= 0) {
            if (GROUPED_DOTS.matcher(s).matches() || s.indexOf('.') != lastDot) {
                s = s.replace(".", "");
            }
        }

        try {
            BigDecimal value = new BigDecimal(s);
            if (value.signum() < 0) {
                return UNKNOWN_PRICE;
            }
            return value.setScale(2, RoundingMode.HALF_UP);
        } catch (NumberFormatException e) {
            return UNKNOWN_PRICE;
        }
    }

    /**
     * "1.2k" = 1200, "3,4k" = 3400, "2tr" = 2000000, "1.234" = 1234.
     *
     * @return null when no number is present
     */
    public static Long parseCount(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String s = raw.replace('\u00A0', ' ').toLowerCase(Locale.ROOT).replace("+", "").trim();
        Matcher m = COUNT.matcher(s);
        if (!m.find()) {
            return null;
        }
        String number = m.group(1);
        String suffix = m.group(2);
        try {
            if (suffix == null) {
                return Long.parseLong(number.replace(".", "").replace(",", ""));
            }
            long multiplier = "k".equals(suffix) ? 1_000L : 1_000_000L;
            BigDecimal value = new BigDecimal(number.replace(',', '.'));
            return value.multiply(BigDecimal.valueOf(multiplier)).setScale(0, RoundingMode.HALF_UP).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }

    public static Integer parseIntCount(String raw) {
        Long v = parseCount(raw);
        if (v == null || v > Integer.MAX_VALUE) {
            return null;
        }
        return v.intValue();
    }

    /**
     * @return rating clamped to 0..5, null when absent
     */
    public static Double parseRating(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        Matcher m = DECIMAL.matcher(raw.replace(',', '.'));
        if (!m.find()) {
            return null;
        }
        double v = Double.parseDouble(m.group());
        if (Double.isNaN(v)) {
            return null;
        }
        return Math.max(0.0, Math.min(5.0, v));
    }
}
