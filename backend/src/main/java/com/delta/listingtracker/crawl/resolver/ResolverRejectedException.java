package com.delta.listingtracker.crawl.resolver;

public class ResolverRejectedException extends ResolverException {
    private final int status;

    public ResolverRejectedException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int status() {
        return status;
    }

    @Override
    public String reasonCode() {
        return "resolver_rejected";
    }
}
