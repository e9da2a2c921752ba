package com.delta.listingtracker.crawl.render;

import com.delta.listingtracker.config.CrawlerProperties;

public class PlaywrightRenderSessionFactory implements RenderSessionFactory {
    private final CrawlerProperties.Browser settings;

    public PlaywrightRenderSessionFactory(CrawlerProperties.Browser settings) {
        this.settings = settings;
    }

    @Override
    public RenderSession open() {
        return new PlaywrightRenderSession(settings);
    }
}
