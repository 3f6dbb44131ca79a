package com.kinoscope.metadata.resolve.model;

import java.util.List;

public record TitleMetadata(
    String year,
    List<String> directors,
    Double rating,
    Integer ratingCount,
    String titleType
) {
    public TitleMetadata {
        directors = directors == null ? List.of() : List.copyOf(directors);
    }
}
