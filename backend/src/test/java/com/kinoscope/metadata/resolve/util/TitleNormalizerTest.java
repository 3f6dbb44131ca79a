package com.kinoscope.metadata.resolve.util;

import com.kinoscope.metadata.resolve.model.SeedRecord;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TitleNormalizerTest {

    @Test
    void stripsDiacriticsPunctuationAndCase() {
        assertThat(TitleNormalizer.normalizeTitle("Amélie")).isEqualTo("amelie");
        assertThat(TitleNormalizer.normalizeTitle("Krysař")).isEqualTo("krysar");
        assertThat(TitleNormalizer.normalizeTitle("Spider-Man: No Way Home 2")).isEqualTo("spidermannowayhome2");
        assertThat(TitleNormalizer.normalizeTitle("   ")).isEmpty();
        assertThat(TitleNormalizer.normalizeTitle(null)).isEmpty();
    }

    @Test
    void normalizationIsIdempotent() {
        for (String title : List.of("Amélie", "Kolja", "Pelíšky", "Crouching Tiger, Hidden Dragon", "Šílení")) {
            String once = TitleNormalizer.normalizeTitle(title);
            assertThat(TitleNormalizer.normalizeTitle(once)).isEqualTo(once);
        }
    }

    @Test
    void personNameKeepsWordBoundaries() {
        assertThat(TitleNormalizer.normalizePersonName("Jan  Svěrák")).isEqualTo("jan sverak");
        assertThat(TitleNormalizer.normalizePersonName("Wong Kar-wai")).isEqualTo("wong karwai");
        assertThat(TitleNormalizer.normalizePersonName("  Jiří   Barta ")).isEqualTo("jiri barta");
    }

    @Test
    void sortedNameKeyIgnoresWordOrder() {
        assertThat(TitleNormalizer.sortedNameKey("karwai wong"))
            .isEqualTo(TitleNormalizer.sortedNameKey("wong karwai"));
    }

    @Test
    void normalizedTitleSetCoversPrimaryQueryAndLocalizedTitles() {
        Map<String, String> localized = new LinkedHashMap<>();
        localized.put("USA", "The Pied Piper");
        localized.put("Německo", "Der Rattenfänger");
        SeedRecord seed = new SeedRecord(1, "Krysař", null, "1985", null, null, null, null,
            null, null, List.of("Jiří Barta"), null, localized, null, null, null, null);

        assertThat(TitleNormalizer.buildNormalizedTitleSet(seed, "Pied Piper"))
            .containsExactly("krysar", "piedpiper", "thepiedpiper", "derrattenfanger");
    }
}
