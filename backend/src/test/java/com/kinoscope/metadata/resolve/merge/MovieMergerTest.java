package com.kinoscope.metadata.resolve.merge;

import com.kinoscope.metadata.config.ResolverProperties;
import com.kinoscope.metadata.resolve.model.CrewCredit;
import com.kinoscope.metadata.resolve.model.MergedMovie;
import com.kinoscope.metadata.resolve.model.SeedRecord;
import com.kinoscope.metadata.resolve.model.SupplementalMovie;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MovieMergerTest {
    private final MovieMerger merger = new MovieMerger(new ResolverProperties(), new CzechCountryCodeMapper());

    @Test
    void seedTextAndSupplementalMediaTakePrecedence() {
        MergedMovie merged = merger.merge(seed(), supplemental("1996-05-15"));

        assertThat(merged.sourceId()).isEqualTo(9046);
        assertThat(merged.tmdbId()).isEqualTo(1779);
        assertThat(merged.tmdbTitle()).isEqualTo("Kolya");
        assertThat(merged.imdbId()).isEqualTo("tt0118849");
        assertThat(merged.title()).isEqualTo("Kolja");
        assertThat(merged.originalTitle()).isEqualTo("Kolja");
        assertThat(merged.year()).isEqualTo("1996");
        assertThat(merged.description()).isEqualTo("Příběh violoncellisty.");
        assertThat(merged.secondaryDescription()).isEqualTo("A story of a cellist.");
        assertThat(merged.originCountryCodes()).containsExactly("CZ", "GB", "FR");
        assertThat(merged.directors()).containsExactly("Jan Svěrák");
        assertThat(merged.posterUrl()).isEqualTo("https://image.tmdb.org/t/p/original/poster.jpg");
        assertThat(merged.sourcePosterUrl()).isEqualTo("https://img.example.cz/kolja.jpg");
        assertThat(merged.backdropUrl()).isEqualTo("https://image.tmdb.org/t/p/original/backdrop.jpg");
        assertThat(merged.imdbRating()).isEqualTo(7.9);
        assertThat(merged.voteAverage()).isEqualTo(7.6);
        assertThat(merged.credits()).extracting(CrewCredit::name).containsExactly("Jan Svěrák");
        assertThat(merged.localizedTitles()).containsEntry("USA", "Kolya");
        assertThat(merged.releaseDate()).isEqualTo(LocalDate.of(1996, 5, 15));
    }

    @Test
    void missingSupplementalKeepsSeedPoster() {
        MergedMovie merged = merger.merge(seed(), null);

        assertThat(merged.tmdbId()).isNull();
        assertThat(merged.posterUrl()).isEqualTo("https://img.example.cz/kolja.jpg");
        assertThat(merged.backdropUrl()).isNull();
        assertThat(merged.credits()).isEmpty();
        assertThat(merged.releaseDate()).isNull();
    }

    @Test
    void blankSeedTitleFallsBackToSupplemental() {
        SeedRecord seed = new SeedRecord(1, " ", null, null, null, null, null, null,
            null, null, null, null, null, null, null, null, null);

        MergedMovie merged = merger.merge(seed, supplemental(null));

        assertThat(merged.title()).isEqualTo("Kolya");
        assertThat(merged.originalTitle()).isEqualTo("Kolja");
    }

    @Test
    void releaseDateKeepsDateAndDropsGarbage() {
        assertThat(merger.merge(seed(), supplemental("1996-05-15T00:00:00Z")).releaseDate()).isEqualTo(LocalDate.of(1996, 5, 15));
        assertThat(merger.merge(seed(), supplemental("sometime in 1996")).releaseDate()).isNull();
        assertThat(merger.merge(seed(), supplemental("")).releaseDate()).isNull();
    }

    @Test
    void mergingTwiceGivesEqualResults() {
        assertThat(merger.merge(seed(), supplemental("1996-05-15")))
            .isEqualTo(merger.merge(seed(), supplemental("1996-05-15")));
    }

    private static SeedRecord seed() {
        return new SeedRecord(
            9046,
            "Kolja",
            null,
            "1996",
            "105 min",
            "87%",
            "Příběh violoncellisty.",
            "Česko / Velká Británie / Francie",
            null,
            List.of("Drama"),
            List.of("Jan Svěrák"),
            List.of("Zdeněk Svěrák"),
            Map.of("USA", "Kolya"),
            "https://img.example.cz/kolja.jpg",
            "tt0118849",
            7.9,
            40000
        );
    }

    private static SupplementalMovie supplemental(String releaseDate) {
        return new SupplementalMovie(
            1779,
            "Kolya",
            "Kolja",
            "A story of a cellist.",
            releaseDate,
            "/poster.jpg",
            "backdrop.jpg",
            7.6,
            512,
            9.3,
            "cs",
            false,
            null,
            "https://www.youtube.com/watch?v=kolja",
            List.of(new CrewCredit(56, "Jan Svěrák", "Director", null))
        );
    }
}
