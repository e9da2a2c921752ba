package com.delta.listingtracker.crawl.render;

import com.delta.listingtracker.crawl.http.PoliteHttpClient;

public class HttpRenderSessionFactory implements RenderSessionFactory {
    private final PoliteHttpClient httpClient;

    public HttpRenderSessionFactory(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public RenderSession open() {
        return new HttpRenderSession(httpClient);
    }
}
