package com.kinoscope.metadata.resolve.service;

import com.kinoscope.metadata.resolve.model.SeedRecord;
import com.kinoscope.metadata.resolve.model.SupplementalMovie;

/**
 * Access to the supplemental catalog (TMDB). Both lookups return null when nothing is found.
 */
public interface SupplementalSourceClient {
    SupplementalSourceClient NONE = new SupplementalSourceClient() {
        @Override
        public SupplementalMovie findById(int tmdbId) {
            return null;
        }

        @Override
        public SupplementalMovie search(SeedRecord seed) {
            return null;
        }
    };

    SupplementalMovie findById(int tmdbId);

    SupplementalMovie search(SeedRecord seed);
}
