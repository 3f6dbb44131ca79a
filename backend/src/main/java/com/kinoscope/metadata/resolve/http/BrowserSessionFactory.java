package com.kinoscope.metadata.resolve.http;

import com.kinoscope.metadata.config.ResolverProperties;
import org.springframework.stereotype.Component;

@Component
public class BrowserSessionFactory {
    private final ResolverProperties properties;

    public BrowserSessionFactory(ResolverProperties properties) {
        this.properties = properties;
    }

    /**
     * Each session owns its cookie jar, so concurrent resolutions never share state.
     */
    public PageFetcher openSession() {
        return new BrowserSession(properties);
    }
}
