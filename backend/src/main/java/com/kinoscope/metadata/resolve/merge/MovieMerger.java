package com.kinoscope.metadata.resolve.merge;

import com.kinoscope.metadata.config.ResolverProperties;
import com.kinoscope.metadata.resolve.model.MergedMovie;
import com.kinoscope.metadata.resolve.model.SeedRecord;
import com.kinoscope.metadata.resolve.model.SupplementalMovie;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Combines the regional record with the TMDB record. Text, people and localization come from the
 * regional record; images, votes and credits from TMDB. Pure: same inputs, same output.
 */
@Component
public class MovieMerger {
    private final ResolverProperties properties;
    private final CountryCodeMapper countryCodeMapper;

    public MovieMerger(ResolverProperties properties, CountryCodeMapper countryCodeMapper) {
        this.properties = properties;
        this.countryCodeMapper = countryCodeMapper;
    }

    public MergedMovie merge(SeedRecord seed, SupplementalMovie supplemental) {
        if (seed == null) {
            throw new IllegalArgumentException("seed is required");
        }
        SupplementalMovie tmdb = supplemental;
        String tmdbPoster = tmdb == null ? null : imageUrl(tmdb.posterPath());

        return new MergedMovie(
            seed.id(),
            tmdb == null ? null : tmdb.tmdbId(),
            tmdb == null ? null : tmdb.title(),
            seed.imdbId(),
            firstNonBlank(seed.title(), tmdb == null ? null : tmdb.title()),
            firstNonBlank(seed.originalTitle(), tmdb == null ? null : tmdb.originalTitle()),
            seed.year(),
            seed.duration(),
            seed.rating(),
            seed.description(),
            tmdb == null ? null : tmdb.overview(),
            seed.origin(),
            countryCodeMapper.toIsoCodes(originNames(seed)),
            seed.genres(),
            seed.directors(),
            seed.cast(),
            firstNonBlank(tmdbPoster, seed.posterUrl()),
            seed.posterUrl(),
            tmdb == null ? null : imageUrl(tmdb.backdropPath()),
            seed.imdbRating(),
            seed.imdbRatingCount(),
            tmdb == null ? null : tmdb.voteAverage(),
            tmdb == null ? null : tmdb.voteCount(),
            tmdb == null ? null : tmdb.popularity(),
            tmdb == null ? null : tmdb.originalLanguage(),
            tmdb == null ? null : tmdb.adult(),
            tmdb == null ? null : tmdb.homepage(),
            tmdb == null ? null : tmdb.trailerUrl(),
            tmdb == null ? List.of() : tmdb.credits(),
            seed.localizedTitles(),
            tmdb == null ? null : parseReleaseDate(tmdb.releaseDate())
        );
    }

    String imageUrl(String path) {
        if (path == null || path.isBlank()) {
            return null;
        }
        String trimmed = path.trim();
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            return trimmed;
        }
        return properties.getTmdb().getImageBaseUrl() + (trimmed.startsWith("/") ? trimmed : "/" + trimmed);
    }

    static LocalDate parseReleaseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        String datePart = trimmed.length() > 10 ? trimmed.substring(0, 10) : trimmed;
        try {
            return LocalDate.parse(datePart);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private List<String> originNames(SeedRecord seed) {
        if (!seed.origins().isEmpty()) {
            return seed.origins();
        }
        List<String> names = new ArrayList<>();
        if (seed.origin() == null || seed.origin().isBlank()) {
            return names;
        }
        for (String part : seed.origin().split("[/,]")) {
            if (!part.isBlank()) {
                names.add(part.trim());
            }
        }
        return names;
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second;
    }
}
