package com.delta.listingtracker.crawl.render;

import com.delta.listingtracker.crawl.model.PageSnapshot;
import com.delta.listingtracker.crawl.model.SessionCookie;

import java.util.List;

/**
 * One browsing session against a marketplace. Selectors are plain CSS so the same platform
 * definitions drive both the browser and the static HTML engine.
 */
public interface RenderSession extends AutoCloseable {

    PageSnapshot navigate(String url);

    /**
     * Clicks the first visible element matching the selector and waits for the page to settle.
     *
     * @return false when nothing matched or the element could not be activated
     */
    boolean click(String selector);

    /**
     * Replaces the current document with externally obtained HTML, keeping the current URL.
     */
    PageSnapshot setContent(String html);

    List<String> outerHtml(String selector);

    boolean exists(String selector);

    String content();

    String currentUrl();

    void addCookies(List<SessionCookie> cookies, String userAgent);

    @Override
    void close();
}
