package com.kinoscope.metadata.resolve.imdb;

import com.kinoscope.metadata.config.ResolverProperties;
import com.kinoscope.metadata.resolve.http.PageFetcher;
import com.kinoscope.metadata.resolve.model.DirectorCheck;
import com.kinoscope.metadata.resolve.model.HttpFetchResult;
import com.kinoscope.metadata.resolve.model.SeedRecord;
import com.kinoscope.metadata.resolve.model.TitleMetadata;
import com.kinoscope.metadata.resolve.model.ValidationResult;
import com.kinoscope.metadata.resolve.model.YearCheck;
import com.kinoscope.metadata.resolve.util.RomanizationConverter;
import com.kinoscope.metadata.resolve.util.TitleNormalizer;
import com.kinoscope.metadata.resolve.util.TitleTypes;
import com.kinoscope.metadata.resolve.util.YearMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Component
public class ImdbMetadataValidator {
    private static final Logger log = LoggerFactory.getLogger(ImdbMetadataValidator.class);

    private final ResolverProperties properties;
    private final ImdbTitlePageParser pageParser;

    public ImdbMetadataValidator(ResolverProperties properties, ImdbTitlePageParser pageParser) {
        this.properties = properties;
        this.pageParser = pageParser;
    }

    /**
     * Fetches the title page of {@code imdbId} and decides whether it is the same film as {@code seed}.
     * The search result year, when given, is a second chance for the year check.
     */
    public ValidationResult validateAndGetMetadata(PageFetcher fetcher, String imdbId, SeedRecord seed, String candidateYearHint) {
        TitleMetadata metadata = fetchMetadata(fetcher, imdbId);

        if (metadata != null && !isTitleTypeAcceptable(metadata.titleType())) {
            log.debug("Rejecting {}: incompatible title type '{}'", imdbId, metadata.titleType());
            return ValidationResult.rejected();
        }

        boolean hasYear = seed.hasYear();
        boolean hasDirectors = seed.hasDirectors();
        if (!hasYear && !hasDirectors) {
            return ValidationResult.accepted(metadata);
        }
        if (metadata == null) {
            log.debug("No metadata for {}, accepting by default", imdbId);
            return ValidationResult.accepted(null);
        }

        YearCheck year = checkYear(seed.year(), metadata.year(), candidateYearHint);
        DirectorCheck directors = checkDirectors(seed.directors(), metadata.directors());
        log.debug(
            "Validation for {}: type='{}' year={} (seed={} imdb={} hint={}) directors={}",
            imdbId,
            metadata.titleType(),
            year,
            seed.year(),
            metadata.year(),
            candidateYearHint,
            directors
        );

        boolean accepted;
        if (hasYear && hasDirectors) {
            accepted = switch (directors) {
                case VACUOUS, MATCH -> year.passed();
                // A page without director data is a fallback artifact, not a disagreement.
                case NO_CANDIDATE_DIRECTORS -> year.passed();
                case MISMATCH -> false;
            };
        } else if (hasYear) {
            accepted = year.passed();
        } else {
            accepted = directors.passed();
        }
        return accepted ? ValidationResult.accepted(metadata) : ValidationResult.rejected();
    }

    public static boolean isTitleTypeAcceptable(String titleType) {
        return TitleTypes.isAcceptable(titleType);
    }

    YearCheck checkYear(String seedYear, String imdbYear, String candidateYearHint) {
        String seedDigits = YearMatcher.extractYear(seedYear);
        if (seedDigits == null) {
            return YearCheck.VACUOUS;
        }
        int tolerance = properties.getImdb().getYearTolerance();
        String imdbDigits = YearMatcher.extractYear(imdbYear);
        if (imdbDigits != null && YearMatcher.yearsMatch(seedDigits, imdbDigits, tolerance)) {
            return YearCheck.MATCH;
        }
        // Search results often show the production year while the title page carries a later release.
        String hintDigits = YearMatcher.extractYear(candidateYearHint);
        if (hintDigits != null && YearMatcher.yearsMatch(seedDigits, hintDigits, tolerance)) {
            return YearCheck.MATCH;
        }
        return YearCheck.MISMATCH;
    }

    DirectorCheck checkDirectors(List<String> seedDirectors, List<String> imdbDirectors) {
        if (seedDirectors == null || seedDirectors.isEmpty()) {
            return DirectorCheck.VACUOUS;
        }
        if (imdbDirectors == null || imdbDirectors.isEmpty()) {
            return DirectorCheck.NO_CANDIDATE_DIRECTORS;
        }

        Set<String> imdbKeys = new HashSet<>();
        for (String director : imdbDirectors) {
            String key = nameKey(director);
            if (!key.isEmpty()) {
                imdbKeys.add(key);
            }
        }
        if (imdbKeys.isEmpty()) {
            return DirectorCheck.MISMATCH;
        }

        for (String director : seedDirectors) {
            String key = nameKey(director);
            if (key.isEmpty() || imdbKeys.contains(key)) {
                continue;
            }
            String romanized = nameKey(RomanizationConverter.transliterateToEnglish(TitleNormalizer.lowerCase(director)));
            if (!romanized.isEmpty() && imdbKeys.contains(romanized)) {
                continue;
            }
            return DirectorCheck.MISMATCH;
        }
        return DirectorCheck.MATCH;
    }

    private TitleMetadata fetchMetadata(PageFetcher fetcher, String imdbId) {
        String url = properties.getImdb().getBaseUrl() + "/title/" + imdbId + "/";
        HttpFetchResult result = fetcher.get(url);
        if (!result.hasBody()) {
            log.warn("Title page fetch failed for {} status={} error={}", imdbId, result.statusCode(), result.errorCode());
            return null;
        }
        return pageParser.parse(result.body());
    }

    private static String nameKey(String name) {
        return TitleNormalizer.sortedNameKey(TitleNormalizer.normalizePersonName(name));
    }
}
