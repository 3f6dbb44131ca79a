package com.kinoscope.metadata.resolve.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record MergedMovie(
    Integer sourceId,
    Integer tmdbId,
    String tmdbTitle,
    String imdbId,
    String title,
    String originalTitle,
    String year,
    String duration,
    String rating,
    String description,
    String secondaryDescription,
    String origin,
    List<String> originCountryCodes,
    List<String> genres,
    List<String> directors,
    List<String> cast,
    String posterUrl,
    String sourcePosterUrl,
    String backdropUrl,
    Double imdbRating,
    Integer imdbRatingCount,
    Double voteAverage,
    Integer voteCount,
    Double popularity,
    String originalLanguage,
    Boolean adult,
    String homepage,
    String trailerUrl,
    List<CrewCredit> credits,
    Map<String, String> localizedTitles,
    LocalDate releaseDate
) {
    public MergedMovie {
        originCountryCodes = originCountryCodes == null ? List.of() : List.copyOf(originCountryCodes);
        genres = genres == null ? List.of() : List.copyOf(genres);
        directors = directors == null ? List.of() : List.copyOf(directors);
        cast = cast == null ? List.of() : List.copyOf(cast);
        credits = credits == null ? List.of() : List.copyOf(credits);
        localizedTitles = localizedTitles == null ? Map.of() : localizedTitles;
    }
}
