package com.kinoscope.metadata.resolve.http;

import com.kinoscope.metadata.resolve.model.HttpFetchResult;

/**
 * Fetches one HTML page. Failures come back as an unsuccessful {@link HttpFetchResult}, never as exceptions.
 */
public interface PageFetcher {
    HttpFetchResult get(String url);
}
