package com.kinoscope.metadata.resolve.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class YearMatcher {
    private static final Pattern YEAR = Pattern.compile("\\b(\\d{4})\\b");
    private static final Pattern PARENTHESIZED_YEAR = Pattern.compile("\\((\\d{4})\\)");

    private YearMatcher() {
    }

    /**
     * First standalone four digit number in the value, or null.
     */
    public static String extractYear(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        Matcher matcher = YEAR.matcher(value);
        return matcher.find() ? matcher.group(1) : null;
    }

    public static String extractParenthesizedYear(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        Matcher matcher = PARENTHESIZED_YEAR.matcher(value);
        return matcher.find() ? matcher.group(1) : null;
    }

    public static List<String> extractAllYears(String value) {
        List<String> years = new ArrayList<>();
        if (value == null || value.isBlank()) {
            return years;
        }
        Matcher matcher = YEAR.matcher(value);
        while (matcher.find()) {
            years.add(matcher.group(1));
        }
        return years;
    }

    public static boolean yearsMatch(String first, String second, int tolerance) {
        if (first == null || second == null) {
            return false;
        }
        String a = first.trim();
        String b = second.trim();
        if (a.equals(b)) {
            return true;
        }
        try {
            return Math.abs(Integer.parseInt(a) - Integer.parseInt(b)) <= tolerance;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
