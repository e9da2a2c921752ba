package com.delta.listingtracker.crawl.render;

import com.delta.listingtracker.crawl.http.PoliteHttpClient;
import com.delta.listingtracker.crawl.model.HttpFetchResult;
import com.delta.listingtracker.crawl.model.PageSnapshot;
import com.delta.listingtracker.crawl.model.SessionCookie;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static HTML session on top of {@link PoliteHttpClient}. Clicking follows the href of the
 * matched element; script-driven controls are reported as not clickable.
 */
public class HttpRenderSession implements RenderSession {
    private final PoliteHttpClient httpClient;
    private final Map<String, String> cookieJar = new LinkedHashMap<>();
    private String userAgent;
    private String currentUrl;
    private Document document;

    public HttpRenderSession(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public PageSnapshot navigate(String url) {
        HttpFetchResult result = httpClient.get(url, requestHeaders());
        if (result.errorCode() != null) {
            throw new NavigationException(result.errorCode(), "fetch failed for " + url + ": " + result.errorMessage());
        }
        rememberCookies(result.setCookieHeaders());
        currentUrl = result.finalUrlOrRequested();
        String body = result.body() == null ? "" : result.body();
        document = Jsoup.parse(body, currentUrl);
        return new PageSnapshot(currentUrl, result.statusCode(), body);
    }

    @Override
    public boolean click(String selector) {
        if (document == null) {
            return false;
        }
        Element element = document.selectFirst(selector);
        if (element == null) {
            return false;
        }
        String href = element.absUrl("href");
        if (href.isBlank()) {
            return false;
        }
        navigate(href);
        return true;
    }

    @Override
    public PageSnapshot setContent(String html) {
        String body = html == null ? "" : html;
        document = Jsoup.parse(body, currentUrl == null ? "" : currentUrl);
        return new PageSnapshot(currentUrl, 200, body);
    }

    @Override
    public List<String> outerHtml(String selector) {
        if (document == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (Element element : document.select(selector)) {
            out.add(element.outerHtml());
        }
        return out;
    }

    @Override
    public boolean exists(String selector) {
        return document != null && document.selectFirst(selector) != null;
    }

    @Override
    public String content() {
        return document == null ? "" : document.outerHtml();
    }

    @Override
    public String currentUrl() {
        return currentUrl;
    }

    @Override
    public void addCookies(List<SessionCookie> cookies, String userAgent) {
        if (cookies != null) {
            for (SessionCookie cookie : cookies) {
                cookieJar.put(cookie.name(), cookie.value());
            }
        }
        if (userAgent != null && !userAgent.isBlank()) {
            this.userAgent = userAgent;
        }
    }

    @Override
    public void close() {
        cookieJar.clear();
        document = null;
    }

    Map<String, String> cookieJar() {
        return cookieJar;
    }

    private Map<String, String> requestHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        if (!cookieJar.isEmpty()) {
            StringBuilder cookieHeader = new StringBuilder();
            for (Map.Entry<String, String> entry : cookieJar.entrySet()) {
                if (cookieHeader.length() > 0) {
                    cookieHeader.append("; ");
                }
                cookieHeader.append(entry.getKey()).append('=').append(entry.getValue());
            }
            headers.put("Cookie", cookieHeader.toString());
        }
        if (userAgent != null) {
            headers.put("User-Agent", userAgent);
        }
        return headers;
    }

    private void rememberCookies(List<String> setCookieHeaders) {
        if (setCookieHeaders == null) {
            return;
        }
        for (String header : setCookieHeaders) {
            String pair = header.split(";", 2)[0];
            int eq = pair.indexOf('=');
            if (eq > 0) {
                cookieJar.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
            }
        }
    }
}
