package com.delta.listingtracker.crawl.model;

public record PageSnapshot(String url, int statusCode, String html) {
    public boolean ok() {
        return statusCode == 0 || (statusCode >= 200 && statusCode < 400);
    }

    public boolean blocked() {
        return statusCode == 401 || statusCode == 403 || statusCode == 429 || statusCode == 503;
    }
}
