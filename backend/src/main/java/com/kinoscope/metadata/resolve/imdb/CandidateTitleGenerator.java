package com.kinoscope.metadata.resolve.imdb;

import com.kinoscope.metadata.resolve.model.SeedRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Orders the titles to search for. Titles from the origin countries come first, then the English one,
 * then the USA and UK titles, the primary title and whatever localized titles remain.
 */
@Component
public class CandidateTitleGenerator {
    static final String[] ENGLISH_KEYS = {"angličtina", "English", "USA", "United States", "UK", "United Kingdom"};
    static final String[] USA_KEYS = {"USA", "United States", "Spojené státy"};
    static final String[] UK_KEYS = {"Velká Británie", "United Kingdom", "UK", "Spojené království"};

    public List<String> searchTitles(SeedRecord seed) {
        List<String> candidates = new ArrayList<>();
        candidates.add(seed.localizedTitle(USA_KEYS));
        candidates.add(seed.localizedTitle(UK_KEYS));
        candidates.add(seed.title());

        for (String country : originCountries(seed.origin())) {
            String originTitle = seed.localizedTitle(country);
            if (originTitle != null && !originTitle.isBlank()) {
                candidates.add(0, originTitle);
            }
        }

        String englishTitle = seed.localizedTitle(ENGLISH_KEYS);
        if (englishTitle != null && !englishTitle.isBlank()) {
            candidates.add(0, englishTitle);
        }

        candidates.addAll(seed.localizedTitles().values());
        return dedupe(candidates);
    }

    static List<String> originCountries(String origin) {
        List<String> countries = new ArrayList<>();
        if (origin == null || origin.isBlank()) {
            return countries;
        }
        for (String part : origin.split("[/,]")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                countries.add(trimmed);
            }
        }
        return countries;
    }

    private List<String> dedupe(List<String> candidates) {
        Map<String, String> seen = new LinkedHashMap<>();
        for (String candidate : candidates) {
            if (candidate == null || candidate.isBlank()) {
                continue;
            }
            String trimmed = candidate.trim();
            seen.putIfAbsent(trimmed.toLowerCase(Locale.ROOT), trimmed);
        }
        return new ArrayList<>(seen.values());
    }
}
