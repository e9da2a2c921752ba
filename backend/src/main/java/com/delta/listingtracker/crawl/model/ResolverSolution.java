package com.delta.listingtracker.crawl.model;

import java.util.List;

public record ResolverSolution(
    String url,
    int status,
    String html,
    List<SessionCookie> cookies,
    String userAgent
) {
    public ResolverSolution {
        cookies = cookies == null ? List.of() : List.copyOf(cookies);
    }

    public boolean hasHtml() {
        return html != null && !html.isBlank();
    }
}
