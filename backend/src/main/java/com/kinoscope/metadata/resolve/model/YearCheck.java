package com.kinoscope.metadata.resolve.model;

public enum YearCheck {
    VACUOUS,
    MATCH,
    MISMATCH;

    public boolean passed() {
        return this != MISMATCH;
    }
}
