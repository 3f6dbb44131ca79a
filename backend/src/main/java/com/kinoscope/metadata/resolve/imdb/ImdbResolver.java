package com.kinoscope.metadata.resolve.imdb;

import com.kinoscope.metadata.config.ResolverProperties;
import com.kinoscope.metadata.resolve.http.BrowserSessionFactory;
import com.kinoscope.metadata.resolve.http.PageFetcher;
import com.kinoscope.metadata.resolve.model.ResolutionResult;
import com.kinoscope.metadata.resolve.model.SearchCandidate;
import com.kinoscope.metadata.resolve.model.SeedRecord;
import com.kinoscope.metadata.resolve.model.ValidationResult;
import com.kinoscope.metadata.resolve.util.TitleNormalizer;
import com.kinoscope.metadata.resolve.util.TitleTypes;
import com.kinoscope.metadata.resolve.util.YearMatcher;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Finds the IMDb id of a seed movie. Every invocation opens its own browser session, walks the
 * candidate titles in priority order and stops at the first validated match.
 */
@Service
public class ImdbResolver {
    private static final Logger log = LoggerFactory.getLogger(ImdbResolver.class);
    private static final Pattern STANDALONE_YEAR = Pattern.compile("^\\d{4}$");

    private final ResolverProperties properties;
    private final BrowserSessionFactory sessionFactory;
    private final CandidateTitleGenerator titleGenerator;
    private final ImdbSearchClient searchClient;
    private final ImdbMetadataValidator validator;

    public ImdbResolver(
        ResolverProperties properties,
        BrowserSessionFactory sessionFactory,
        CandidateTitleGenerator titleGenerator,
        ImdbSearchClient searchClient,
        ImdbMetadataValidator validator
    ) {
        this.properties = properties;
        this.sessionFactory = sessionFactory;
        this.titleGenerator = titleGenerator;
        this.searchClient = searchClient;
        this.validator = validator;
    }

    public ResolutionResult resolveExternalId(Document sourceDocument, SeedRecord seed) {
        return resolveExternalId(sourceDocument, seed, newBudget());
    }

    public ResolutionResult resolveExternalId(Document sourceDocument, SeedRecord seed, ResolutionBudget budget) {
        if (seed == null) {
            throw new IllegalArgumentException("seed is required");
        }
        ResolutionBudget activeBudget = budget == null ? ResolutionBudget.unlimited() : budget;
        PageFetcher session = sessionFactory.openSession();

        String directId = directLinkId(sourceDocument);
        if (directId != null) {
            activeBudget.checkActive();
            ValidationResult direct = validator.validateAndGetMetadata(session, directId, seed, null);
            if (direct.accepted()) {
                log.info("Resolved '{}' to {} via direct link", seed.title(), directId);
                return ResolutionResult.of(directId, direct.metadata());
            }
            log.debug("Direct link {} for '{}' failed validation", directId, seed.title());
        }

        for (String candidateTitle : titleGenerator.searchTitles(seed)) {
            ResolutionResult result = searchTitle(session, candidateTitle, seed, activeBudget);
            if (result.isResolved()) {
                log.info("Resolved '{}' to {} via search '{}'", seed.title(), result.imdbId(), candidateTitle);
                return result;
            }
        }

        log.info("No IMDb match for '{}' ({})", seed.title(), seed.year());
        return ResolutionResult.empty();
    }

    /**
     * Refreshes rating and vote count of an already known id. No search is made and the year and
     * director checks are vacuous; only the title type gate applies.
     */
    public ResolutionResult fetchRating(String imdbId) {
        return fetchRating(imdbId, newBudget());
    }

    public ResolutionResult fetchRating(String imdbId, ResolutionBudget budget) {
        if (!isValidImdbId(imdbId)) {
            throw new IllegalArgumentException("invalid IMDb id: " + imdbId);
        }
        ResolutionBudget activeBudget = budget == null ? ResolutionBudget.unlimited() : budget;
        activeBudget.checkActive();
        String id = imdbId.trim();
        ValidationResult result = validator.validateAndGetMetadata(sessionFactory.openSession(), id, SeedRecord.empty(), null);
        if (!result.accepted()) {
            log.info("Rating refresh for {} rejected by title type gate", id);
            return ResolutionResult.empty();
        }
        return ResolutionResult.of(id, result.metadata());
    }

    public static boolean isValidImdbId(String imdbId) {
        return imdbId != null && ImdbSearchResultParser.TITLE_ID.matcher(imdbId.trim()).matches();
    }

    private ResolutionResult searchTitle(PageFetcher session, String query, SeedRecord seed, ResolutionBudget budget) {
        budget.checkActive();
        log.debug("Searching IMDb for '{}'", query);
        List<SearchCandidate> results = searchClient.search(session, query, null);
        log.debug("Found {} results for '{}'", results.size(), query);
        if (results.isEmpty()) {
            return ResolutionResult.empty();
        }

        Set<String> targets = TitleNormalizer.buildNormalizedTitleSet(seed, queryTitle(query));
        List<SearchCandidate> prioritized = new ArrayList<>();
        List<SearchCandidate> secondary = new ArrayList<>();
        for (SearchCandidate candidate : results) {
            if (TitleTypes.isRejected(candidate.titleType())) {
                log.debug("Skipping {} '{}': type {}", candidate.id(), candidate.title(), candidate.titleType());
                continue;
            }
            if (!targets.isEmpty() && targets.contains(TitleNormalizer.normalizeTitle(candidate.title()))) {
                prioritized.add(candidate);
            } else if (sharesYear(seed.year(), candidate)) {
                secondary.add(candidate);
            }
        }

        ResolutionResult match = firstAccepted(session, prioritized, seed, budget);
        if (match.isResolved()) {
            return match;
        }
        return firstAccepted(session, secondary, seed, budget);
    }

    private ResolutionResult firstAccepted(PageFetcher session, List<SearchCandidate> candidates, SeedRecord seed, ResolutionBudget budget) {
        for (SearchCandidate candidate : candidates) {
            budget.checkActive();
            ValidationResult result = validator.validateAndGetMetadata(session, candidate.id(), seed, candidate.year());
            if (result.accepted()) {
                return ResolutionResult.of(candidate.id(), result.metadata());
            }
            log.debug("Candidate {} '{}' ({}) rejected", candidate.id(), candidate.title(), candidate.year());
        }
        return ResolutionResult.empty();
    }

    boolean sharesYear(String seedYear, SearchCandidate candidate) {
        String seedDigits = YearMatcher.extractYear(seedYear);
        if (seedDigits == null) {
            return true;
        }
        int tolerance = properties.getImdb().getCandidateYearTolerance();
        if (candidate.year() != null && !candidate.year().isBlank()) {
            if (YearMatcher.yearsMatch(seedDigits, candidate.year(), tolerance)) {
                return true;
            }
        }
        // Episodes list the series year next to their own, so any year in the raw text counts.
        for (String year : YearMatcher.extractAllYears(candidate.rawText())) {
            if (YearMatcher.yearsMatch(seedDigits, year, tolerance)) {
                return true;
            }
        }
        return false;
    }

    static String queryTitle(String query) {
        List<String> parts = new ArrayList<>();
        for (String part : query.trim().split("\\s+")) {
            if (!part.isEmpty() && !STANDALONE_YEAR.matcher(part).matches()) {
                parts.add(part);
            }
        }
        return String.join(" ", parts);
    }

    private String directLinkId(Document sourceDocument) {
        if (sourceDocument == null) {
            return null;
        }
        Element link = sourceDocument.selectFirst("a[href*=imdb.com/title/tt]");
        return link == null ? null : ImdbSearchResultParser.titleId(link.attr("href"));
    }

    private ResolutionBudget newBudget() {
        return new ResolutionBudget(Duration.ofSeconds(properties.getMaxResolutionSeconds()));
    }
}
