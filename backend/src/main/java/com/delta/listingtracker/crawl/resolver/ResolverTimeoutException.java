package com.delta.listingtracker.crawl.resolver;

public class ResolverTimeoutException extends ResolverException {
    public ResolverTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reasonCode() {
        return "resolver_timeout";
    }
}
