package com.kinoscope.metadata.resolve.model;

public record CrewCredit(int tmdbId, String name, String role, String photoUrl) {
}
