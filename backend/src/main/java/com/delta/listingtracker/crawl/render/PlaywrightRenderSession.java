package com.delta.listingtracker.crawl.render;

import com.delta.listingtracker.config.CrawlerProperties;
import com.delta.listingtracker.crawl.model.PageSnapshot;
import com.delta.listingtracker.crawl.model.SessionCookie;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.Cookie;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Chromium-backed session. Each session owns its Playwright driver since Playwright objects are
 * not thread safe and targets crawl concurrently.
 */
public class PlaywrightRenderSession implements RenderSession {
    private static final Logger log = LoggerFactory.getLogger(PlaywrightRenderSession.class);
    private static final int CLICK_SETTLE_MS = 1500;

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;
    private final int timeoutMs;
    private final int maxScrollPasses;
    private final LazyLoadScroller scroller;

    public PlaywrightRenderSession(CrawlerProperties.Browser settings) {
        this.timeoutMs = settings.getNavigationTimeoutMs();
        this.maxScrollPasses = settings.getMaxScrollPasses();
        this.playwright = Playwright.create();
        try {
            this.browser = playwright.chromium().launch(new BrowserType.LaunchOptions()
                .setHeadless(settings.isHeadless())
                .setArgs(List.of("--disable-blink-features=AutomationControlled")));
            this.context = browser.newContext(new Browser.NewContextOptions()
                .setLocale(settings.getLocale())
                .setViewportSize(1366, 900));
            this.page = context.newPage();
            page.setDefaultTimeout(timeoutMs);
        } catch (PlaywrightException e) {
            playwright.close();
            throw new NavigationException("browser_launch_failed", "unable to start chromium: " + e.getMessage(), e);
        }
        int pauseMs = settings.getScrollPauseMs();
        this.scroller = new LazyLoadScroller(
            () -> ((Number) page.evaluate("() => document.body ? document.body.scrollHeight : 0")).intValue(),
            () -> page.evaluate("() => window.scrollTo(0, document.body ? document.body.scrollHeight : 0)"),
            () -> page.waitForTimeout(pauseMs)
        );
    }

    @Override
    public PageSnapshot navigate(String url) {
        try {
            Response response = page.navigate(url, new Page.NavigateOptions()
                .setTimeout(timeoutMs)
                .setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
            int status = response == null ? 0 : response.status();
            settle();
            return new PageSnapshot(page.url(), status, page.content());
        } catch (TimeoutError e) {
            throw new NavigationException("timeout", "navigation timed out for " + url, e);
        } catch (PlaywrightException e) {
            throw new NavigationException("navigation_error", "navigation failed for " + url + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean click(String selector) {
        try {
            ElementHandle element = page.querySelector(selector);
            if (element == null || !element.isVisible()) {
                return false;
            }
            element.click(new ElementHandle.ClickOptions().setTimeout(timeoutMs));
            try {
                page.waitForLoadState(LoadState.DOMCONTENTLOADED, new Page.WaitForLoadStateOptions().setTimeout(timeoutMs));
            } catch (TimeoutError e) {
                log.debug("Load state wait timed out after clicking {}", selector);
            }
            page.waitForTimeout(CLICK_SETTLE_MS);
            settle();
            return true;
        } catch (PlaywrightException e) {
            log.debug("Click on {} failed: {}", selector, e.getMessage());
            return false;
        }
    }

    @Override
    public PageSnapshot setContent(String html) {
        try {
            page.setContent(html == null ? "" : html);
            return new PageSnapshot(page.url(), 200, page.content());
        } catch (PlaywrightException e) {
            throw new NavigationException("content_error", "unable to load resolver content: " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> outerHtml(String selector) {
        List<String> out = new ArrayList<>();
        try {
            for (ElementHandle element : page.querySelectorAll(selector)) {
                Object html = element.evaluate("e => e.outerHTML");
                if (html != null) {
                    out.add(html.toString());
                }
            }
        } catch (PlaywrightException e) {
            throw new NavigationException("extraction_error", "unable to read " + selector + ": " + e.getMessage(), e);
        }
        return out;
    }

    @Override
    public boolean exists(String selector) {
        try {
            return page.querySelector(selector) != null;
        } catch (PlaywrightException e) {
            return false;
        }
    }

    @Override
    public String content() {
        try {
            return page.content();
        } catch (PlaywrightException e) {
            throw new NavigationException("content_error", "unable to read page content: " + e.getMessage(), e);
        }
    }

    @Override
    public String currentUrl() {
        try {
            return page.url();
        } catch (PlaywrightException e) {
            throw new NavigationException("content_error", "unable to read page url: " + e.getMessage(), e);
        }
    }

    @Override
    public void addCookies(List<SessionCookie> cookies, String userAgent) {
        try {
            applyCookies(cookies, userAgent);
        } catch (PlaywrightException e) {
            throw new NavigationException("cookie_error", "unable to apply resolver cookies: " + e.getMessage(), e);
        }
    }

    /**
     * Moves the mouse once and scrolls lazily rendered cards into the DOM. Best effort.
     */
    private void settle() {
        try {
            page.mouse().move(ThreadLocalRandom.current().nextInt(100, 800), ThreadLocalRandom.current().nextInt(100, 600));
            int passes = scroller.scroll(maxScrollPasses);
            log.debug("Scrolled {} passes on {}", passes, page.url());
        } catch (PlaywrightException e) {
            log.debug("Scrolling stopped early on {}: {}", page.url(), e.getMessage());
        }
    }

    private void applyCookies(List<SessionCookie> cookies, String userAgent) {
        List<Cookie> converted = new ArrayList<>();
        for (SessionCookie source : cookies == null ? List.<SessionCookie>of() : cookies) {
            Cookie cookie = new Cookie(source.name(), source.value());
            if (source.domain() != null && !source.domain().isBlank()) {
                cookie.setDomain(source.domain()).setPath(source.path() == null ? "/" : source.path());
            } else {
                cookie.setUrl(page.url());
            }
            cookie.setSecure(source.secure()).setHttpOnly(source.httpOnly());
            if (source.expires() != null && source.expires() > 0) {
                cookie.setExpires(source.expires());
            }
            converted.add(cookie);
        }
        if (!converted.isEmpty()) {
            context.addCookies(converted);
        }
        if (userAgent != null && !userAgent.isBlank()) {
            page.setExtraHTTPHeaders(Map.of("User-Agent", userAgent));
        }
    }

    @Override
    public void close() {
        try {
            context.close();
            browser.close();
        } catch (PlaywrightException e) {
            log.warn("Error closing browser: {}", e.getMessage());
        } finally {
            playwright.close();
        }
    }
}
