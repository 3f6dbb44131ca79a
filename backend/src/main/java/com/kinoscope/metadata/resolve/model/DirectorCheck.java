package com.kinoscope.metadata.resolve.model;

public enum DirectorCheck {
    VACUOUS,
    MATCH,
    MISMATCH,
    NO_CANDIDATE_DIRECTORS;

    public boolean passed() {
        return this == VACUOUS || this == MATCH;
    }
}
