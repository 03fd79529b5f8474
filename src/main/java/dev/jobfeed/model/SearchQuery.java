package dev.jobfeed.model;

/**
 * One search issued against a source: keywords plus an optional location.
 */
public record SearchQuery(String keywords, String location) {

    public boolean hasLocation() {
        return location != null && !location.isBlank();
    }

    @Override
    public String toString() {
        return hasLocation() ? keywords + " @ " + location : keywords;
    }
}
