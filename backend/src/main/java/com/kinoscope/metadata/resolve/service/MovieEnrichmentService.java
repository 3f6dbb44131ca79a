package com.kinoscope.metadata.resolve.service;

import com.kinoscope.metadata.config.ResolverProperties;
import com.kinoscope.metadata.resolve.imdb.ImdbResolver;
import com.kinoscope.metadata.resolve.imdb.ResolutionAbortedException;
import com.kinoscope.metadata.resolve.imdb.ResolutionBudget;
import com.kinoscope.metadata.resolve.merge.MovieMerger;
import com.kinoscope.metadata.resolve.model.MergedMovie;
import com.kinoscope.metadata.resolve.model.ResolutionResult;
import com.kinoscope.metadata.resolve.model.SeedRecord;
import com.kinoscope.metadata.resolve.model.SupplementalMovie;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

@Service
public class MovieEnrichmentService {
    private static final Logger log = LoggerFactory.getLogger(MovieEnrichmentService.class);

    private final ResolverProperties properties;
    private final ImdbResolver imdbResolver;
    private final SupplementalSourceClient supplementalClient;
    private final MovieMerger merger;
    private final ExecutorService resolveExecutor;

    public MovieEnrichmentService(
        ResolverProperties properties,
        ImdbResolver imdbResolver,
        SupplementalSourceClient supplementalClient,
        MovieMerger merger,
        @Qualifier("resolveExecutor") ExecutorService resolveExecutor
    ) {
        this.properties = properties;
        this.imdbResolver = imdbResolver;
        this.supplementalClient = supplementalClient;
        this.merger = merger;
        this.resolveExecutor = resolveExecutor;
    }

    /**
     * Resolves or refreshes the IMDb data, looks the movie up in TMDB and merges everything.
     * A failing step leaves its fields empty; fields of the stored record fill the gaps.
     */
    public MergedMovie enrich(EnrichmentRequest request) {
        SeedRecord seed = request.seed();
        MergedMovie existing = request.existing();
        ResolutionBudget budget = new ResolutionBudget(Duration.ofSeconds(properties.getMaxResolutionSeconds()));

        try {
            seed = withImdbData(seed, request, budget);
        } catch (ResolutionAbortedException e) {
            log.warn("IMDb resolution aborted for '{}': {}", seed.title(), e.getMessage());
        }

        SupplementalMovie supplemental = lookupSupplemental(seed, existing);
        MergedMovie merged = merger.merge(seed, supplemental);
        return existing == null ? merged : preserveStoredFields(merged, existing);
    }

    /**
     * Enriches independent movies in parallel. A failed movie degrades to its seed data alone.
     */
    public List<MergedMovie> enrichAll(List<EnrichmentRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            return List.of();
        }
        List<CompletableFuture<MergedMovie>> futures = new ArrayList<>();
        for (EnrichmentRequest request : requests) {
            futures.add(CompletableFuture.supplyAsync(() -> enrich(request), resolveExecutor));
        }

        List<MergedMovie> results = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            EnrichmentRequest request = requests.get(i);
            try {
                results.add(futures.get(i).join());
            } catch (CompletionException e) {
                log.warn("Enrichment failed for '{}'", request.seed().title(), e.getCause());
                results.add(merger.merge(request.seed(), null));
            }
        }
        log.info("Enriched {} movies", results.size());
        return results;
    }

    private SeedRecord withImdbData(SeedRecord seed, EnrichmentRequest request, ResolutionBudget budget) {
        String knownId = knownImdbId(seed, request.existing());
        if (knownId != null) {
            ResolutionResult refreshed = imdbResolver.fetchRating(knownId, budget);
            log.debug("Refreshed IMDb rating for {}: {} ({} votes)", knownId, refreshed.rating(), refreshed.ratingCount());
            return seed.withImdb(knownId, refreshed.rating(), refreshed.ratingCount());
        }
        ResolutionResult resolved = imdbResolver.resolveExternalId(request.sourceDocument(), seed, budget);
        if (!resolved.isResolved()) {
            return seed;
        }
        return seed.withImdb(resolved.imdbId(), resolved.rating(), resolved.ratingCount());
    }

    private String knownImdbId(SeedRecord seed, MergedMovie existing) {
        if (existing != null && ImdbResolver.isValidImdbId(existing.imdbId())) {
            return existing.imdbId().trim();
        }
        if (ImdbResolver.isValidImdbId(seed.imdbId())) {
            return seed.imdbId().trim();
        }
        return null;
    }

    private SupplementalMovie lookupSupplemental(SeedRecord seed, MergedMovie existing) {
        try {
            if (existing != null && existing.tmdbId() != null) {
                return supplementalClient.findById(existing.tmdbId());
            }
            return supplementalClient.search(seed);
        } catch (RuntimeException e) {
            log.warn("TMDB lookup failed for '{}': {}", seed.title(), e.getMessage());
            return null;
        }
    }

    private MergedMovie preserveStoredFields(MergedMovie merged, MergedMovie existing) {
        boolean keepImdbRating = merged.imdbRating() == null && existing.imdbRating() != null;
        return new MergedMovie(
            merged.sourceId(),
            merged.tmdbId() != null ? merged.tmdbId() : existing.tmdbId(),
            merged.tmdbTitle(),
            isBlank(merged.imdbId()) ? existing.imdbId() : merged.imdbId(),
            merged.title(),
            merged.originalTitle(),
            merged.year(),
            merged.duration(),
            merged.rating(),
            merged.description(),
            merged.secondaryDescription(),
            merged.origin(),
            merged.originCountryCodes().isEmpty() ? existing.originCountryCodes() : merged.originCountryCodes(),
            merged.genres(),
            merged.directors(),
            merged.cast(),
            merged.posterUrl(),
            isBlank(merged.sourcePosterUrl()) ? existing.sourcePosterUrl() : merged.sourcePosterUrl(),
            merged.backdropUrl(),
            keepImdbRating ? existing.imdbRating() : merged.imdbRating(),
            keepImdbRating ? existing.imdbRatingCount() : merged.imdbRatingCount(),
            merged.voteAverage(),
            merged.voteCount(),
            merged.popularity(),
            merged.originalLanguage(),
            merged.adult(),
            merged.homepage(),
            isBlank(merged.trailerUrl()) ? existing.trailerUrl() : merged.trailerUrl(),
            merged.credits(),
            merged.localizedTitles(),
            merged.releaseDate()
        );
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
