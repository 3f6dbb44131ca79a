package com.kinoscope.metadata.resolve.util;

import com.kinoscope.metadata.resolve.model.SeedRecord;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class TitleNormalizer {
    private TitleNormalizer() {
    }

    /**
     * Canonical comparison key for a title: diacritics removed, letters and digits only, lower case.
     */
    public static String normalizeTitle(String title) {
        if (title == null || title.isBlank()) {
            return "";
        }
        String decomposed = Normalizer.normalize(title, Normalizer.Form.NFD);
        StringBuilder out = new StringBuilder(decomposed.length());
        for (int i = 0; i < decomposed.length(); ) {
            int codePoint = decomposed.codePointAt(i);
            i += Character.charCount(codePoint);
            if (Character.getType(codePoint) == Character.NON_SPACING_MARK) {
                continue;
            }
            if (Character.isLetterOrDigit(codePoint)) {
                out.appendCodePoint(Character.toLowerCase(codePoint));
            }
        }
        return out.toString();
    }

    /**
     * Like {@link #normalizeTitle(String)} but keeps word boundaries and drops digits.
     * Runs of whitespace collapse to a single space.
     */
    public static String normalizePersonName(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String decomposed = Normalizer.normalize(name, Normalizer.Form.NFD);
        StringBuilder out = new StringBuilder(decomposed.length());
        boolean pendingSpace = false;
        for (int i = 0; i < decomposed.length(); ) {
            int codePoint = decomposed.codePointAt(i);
            i += Character.charCount(codePoint);
            if (Character.getType(codePoint) == Character.NON_SPACING_MARK) {
                continue;
            }
            if (Character.isWhitespace(codePoint)) {
                pendingSpace = out.length() > 0;
                continue;
            }
            if (Character.isLetter(codePoint)) {
                if (pendingSpace) {
                    out.append(' ');
                    pendingSpace = false;
                }
                out.appendCodePoint(Character.toLowerCase(codePoint));
            }
        }
        return out.toString();
    }

    /**
     * Word-order independent form of a normalized person name ("wong karwai" and "karwai wong" agree).
     */
    public static String sortedNameKey(String normalizedName) {
        if (normalizedName == null || normalizedName.isBlank()) {
            return "";
        }
        List<String> words = new ArrayList<>(List.of(normalizedName.trim().split("\\s+")));
        words.sort(null);
        return String.join(" ", words);
    }

    public static Set<String> buildNormalizedTitleSet(SeedRecord seed, String queryTitle) {
        List<String> candidates = new ArrayList<>();
        candidates.add(seed.title());
        candidates.add(queryTitle);
        candidates.addAll(seed.localizedTitles().values());

        Set<String> normalized = new LinkedHashSet<>();
        for (String candidate : candidates) {
            String key = normalizeTitle(candidate);
            if (!key.isEmpty()) {
                normalized.add(key);
            }
        }
        return normalized;
    }

    public static String lowerCase(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }
}
