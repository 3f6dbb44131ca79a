package com.kinoscope.metadata.resolve.model;

import java.util.List;

public record SupplementalMovie(
    Integer tmdbId,
    String title,
    String originalTitle,
    String overview,
    String releaseDate,
    String posterPath,
    String backdropPath,
    Double voteAverage,
    Integer voteCount,
    Double popularity,
    String originalLanguage,
    Boolean adult,
    String homepage,
    String trailerUrl,
    List<CrewCredit> credits
) {
    public SupplementalMovie {
        credits = credits == null ? List.of() : List.copyOf(credits);
    }
}
