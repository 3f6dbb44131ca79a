package com.kinoscope.metadata.resolve.api;

import com.kinoscope.metadata.resolve.imdb.ImdbResolver;
import com.kinoscope.metadata.resolve.model.MergedMovie;
import com.kinoscope.metadata.resolve.model.ResolutionResult;
import com.kinoscope.metadata.resolve.service.EnrichmentRequest;
import com.kinoscope.metadata.resolve.service.MovieEnrichmentService;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class ResolutionController {
    private final ImdbResolver imdbResolver;
    private final MovieEnrichmentService enrichmentService;

    public ResolutionController(ImdbResolver imdbResolver, MovieEnrichmentService enrichmentService) {
        this.imdbResolver = imdbResolver;
        this.enrichmentService = enrichmentService;
    }

    @PostMapping("/resolve")
    public ResolutionResult resolve(@RequestBody(required = false) ResolveApiRequest request) {
        requireSeed(request);
        return imdbResolver.resolveExternalId(sourceDocument(request.sourceHtml()), request.seed());
    }

    @PostMapping("/ratings/{imdbId}/refresh")
    public ResolutionResult refreshRating(@PathVariable("imdbId") String imdbId) {
        if (!ImdbResolver.isValidImdbId(imdbId)) {
            throw new ResponseStatusException(BAD_REQUEST, "imdbId must look like tt1234567");
        }
        return imdbResolver.fetchRating(imdbId);
    }

    @PostMapping("/enrich")
    public MergedMovie enrich(@RequestBody(required = false) ResolveApiRequest request) {
        requireSeed(request);
        return enrichmentService.enrich(new EnrichmentRequest(
            request.seed(),
            sourceDocument(request.sourceHtml()),
            request.existing()
        ));
    }

    private void requireSeed(ResolveApiRequest request) {
        if (request == null || request.seed() == null) {
            throw new ResponseStatusException(BAD_REQUEST, "seed is required");
        }
    }

    private Document sourceDocument(String sourceHtml) {
        if (sourceHtml == null || sourceHtml.isBlank()) {
            return null;
        }
        return Jsoup.parse(sourceHtml);
    }
}
