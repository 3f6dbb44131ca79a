package com.kinoscope.metadata.resolve.imdb;

public class ResolutionAbortedException extends RuntimeException {
    public ResolutionAbortedException(String message) {
        super(message);
    }
}
