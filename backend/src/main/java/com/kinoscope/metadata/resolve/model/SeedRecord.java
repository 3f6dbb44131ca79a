package com.kinoscope.metadata.resolve.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * A movie as scraped from the primary regional database, before the IMDb id is resolved.
 * Localized title keys are matched case-insensitively.
 */
public record SeedRecord(
    Integer id,
    String title,
    String originalTitle,
    String year,
    String duration,
    String rating,
    String description,
    String origin,
    List<String> origins,
    List<String> genres,
    List<String> directors,
    List<String> cast,
    Map<String, String> localizedTitles,
    String posterUrl,
    String imdbId,
    Double imdbRating,
    Integer imdbRatingCount
) {
    public SeedRecord {
        origins = origins == null ? List.of() : List.copyOf(origins);
        genres = genres == null ? List.of() : List.copyOf(genres);
        directors = directors == null ? List.of() : List.copyOf(directors);
        cast = cast == null ? List.of() : List.copyOf(cast);
        localizedTitles = copyLocalizedTitles(localizedTitles);
    }

    public static SeedRecord empty() {
        return new SeedRecord(null, null, null, null, null, null, null, null,
            null, null, null, null, null, null, null, null, null);
    }

    public boolean hasYear() {
        return year != null && !year.isBlank();
    }

    public boolean hasDirectors() {
        return !directors.isEmpty();
    }

    public SeedRecord withImdb(String newImdbId, Double newRating, Integer newRatingCount) {
        return new SeedRecord(id, title, originalTitle, year, duration, rating, description, origin,
            origins, genres, directors, cast, localizedTitles, posterUrl, newImdbId, newRating, newRatingCount);
    }

    /**
     * Returns the first non-blank localized title stored under any of the given keys, ignoring key case.
     */
    public String localizedTitle(String... keys) {
        for (String key : keys) {
            for (Map.Entry<String, String> entry : localizedTitles.entrySet()) {
                if (entry.getKey().equalsIgnoreCase(key)) {
                    return entry.getValue();
                }
            }
        }
        return null;
    }

    private static Map<String, String> copyLocalizedTitles(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, String> ordered = new LinkedHashMap<>();
        Set<String> seenKeys = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (Map.Entry<String, String> entry : source.entrySet()) {
            String key = entry.getKey();
            String value = entry.getValue();
            if (key == null || key.isBlank() || value == null || value.isBlank() || !seenKeys.add(key)) {
                continue;
            }
            ordered.put(key, value);
        }
        return Collections.unmodifiableMap(ordered);
    }
}
