package com.delta.listingtracker.crawl.render;

public class NavigationException extends RuntimeException {
    private final String reasonCode;

    public NavigationException(String reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }

    public NavigationException(String reasonCode, String message, Throwable cause) {
        super(message, cause);
        this.reasonCode = reasonCode;
    }

    public String reasonCode() {
        return reasonCode;
    }
}
