package com.kinoscope.metadata.resolve.model;

public record ResolutionResult(String imdbId, Double rating, Integer ratingCount) {
    private static final ResolutionResult EMPTY = new ResolutionResult(null, null, null);

    public static ResolutionResult empty() {
        return EMPTY;
    }

    public static ResolutionResult of(String imdbId, TitleMetadata metadata) {
        if (metadata == null) {
            return new ResolutionResult(imdbId, null, null);
        }
        return new ResolutionResult(imdbId, metadata.rating(), metadata.ratingCount());
    }

    public boolean isResolved() {
        return imdbId != null && !imdbId.isBlank();
    }
}
