package com.delta.listingtracker.crawl.util;

public final class ReasonCodes {
    public static final String UNKNOWN_PLATFORM = "unknown_platform";

    private ReasonCodes() {
    }

    public static String describe(Throwable error) {
        if (error == null) {
            return null;
        }
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return root.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
