package com.kinoscope.metadata.resolve.imdb;

import com.kinoscope.metadata.config.ResolverProperties;
import com.kinoscope.metadata.resolve.http.PageFetcher;
import com.kinoscope.metadata.resolve.model.HttpFetchResult;
import com.kinoscope.metadata.resolve.model.SearchCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

@Component
public class ImdbSearchClient {
    private static final Logger log = LoggerFactory.getLogger(ImdbSearchClient.class);

    private final ResolverProperties properties;
    private final ImdbSearchResultParser parser;

    public ImdbSearchClient(ResolverProperties properties, ImdbSearchResultParser parser) {
        this.properties = properties;
        this.parser = parser;
    }

    /**
     * Runs one catalog search. Transport failures yield an empty list.
     */
    public List<SearchCandidate> search(PageFetcher fetcher, String query, String titleType) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String url = searchUrl(query, titleType);
        HttpFetchResult result = fetcher.get(url);
        if (!result.isSuccessful()) {
            log.warn(
                "IMDb search failed for '{}' status={} error={}",
                query,
                result.statusCode(),
                result.errorCode()
            );
            return List.of();
        }
        return parser.parse(result.body());
    }

    String searchUrl(String query, String titleType) {
        String base = properties.getImdb().getBaseUrl() + "/find/?q=" + URLEncoder.encode(query.trim(), StandardCharsets.UTF_8);
        if (titleType == null || titleType.isBlank()) {
            return base;
        }
        return base + "&s=tt&ttype=" + URLEncoder.encode(titleType.trim(), StandardCharsets.UTF_8);
    }
}
