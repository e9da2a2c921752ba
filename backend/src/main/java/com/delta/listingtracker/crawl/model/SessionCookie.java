package com.delta.listingtracker.crawl.model;

public record SessionCookie(
    String name,
    String value,
    String domain,
    String path,
    boolean secure,
    boolean httpOnly,
    Double expires
) {
}
