package com.delta.listingtracker.crawl.render;

public interface RenderSessionFactory {
    RenderSession open();
}
