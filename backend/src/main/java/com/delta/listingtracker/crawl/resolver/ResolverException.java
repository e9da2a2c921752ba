package com.delta.listingtracker.crawl.resolver;

public abstract class ResolverException extends RuntimeException {
    protected ResolverException(String message) {
        super(message);
    }

    protected ResolverException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String reasonCode();
}
