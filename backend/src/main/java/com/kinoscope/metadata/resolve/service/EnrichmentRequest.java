package com.kinoscope.metadata.resolve.service;

import com.kinoscope.metadata.resolve.model.MergedMovie;
import com.kinoscope.metadata.resolve.model.SeedRecord;
import org.jsoup.nodes.Document;

/**
 * One movie to enrich. {@code sourceDocument} is the scraped regional page, {@code existing} the
 * previously stored result; both may be null.
 */
public record EnrichmentRequest(SeedRecord seed, Document sourceDocument, MergedMovie existing) {
    public EnrichmentRequest {
        if (seed == null) {
            throw new IllegalArgumentException("seed is required");
        }
    }
}
