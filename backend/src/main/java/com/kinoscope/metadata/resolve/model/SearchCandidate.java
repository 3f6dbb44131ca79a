package com.kinoscope.metadata.resolve.model;

public record SearchCandidate(
    String id,
    String title,
    String year,
    String rawText,
    String titleType
) {
}
