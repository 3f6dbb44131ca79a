package com.kinoscope.metadata.resolve.model;

public record ValidationResult(boolean accepted, TitleMetadata metadata) {
    private static final ValidationResult REJECTED = new ValidationResult(false, null);

    public static ValidationResult accepted(TitleMetadata metadata) {
        return new ValidationResult(true, metadata);
    }

    public static ValidationResult rejected() {
        return REJECTED;
    }
}
