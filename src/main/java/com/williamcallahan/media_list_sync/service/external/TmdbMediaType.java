package com.williamcallahan.media_list_sync.service.external;

/**
 * TMDB media kinds with their path segment and search year parameter.
 */
public enum TmdbMediaType {
    MOVIE("movie", "year"),
    SHOW("tv", "first_air_date_year");

    private final String pathSegment;
    private final String yearParameter;

    TmdbMediaType(String pathSegment, String yearParameter) {
        this.pathSegment = pathSegment;
        this.yearParameter = yearParameter;
    }

    public String pathSegment() {
        return pathSegment;
    }

    public String yearParameter() {
        return yearParameter;
    }
}
