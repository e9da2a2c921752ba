package com.delta.listingtracker.crawl.resolver;

public class ResolverUnavailableException extends ResolverException {
    public ResolverUnavailableException(String message) {
        super(message);
    }

    public ResolverUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reasonCode() {
        return "resolver_unavailable";
    }
}
