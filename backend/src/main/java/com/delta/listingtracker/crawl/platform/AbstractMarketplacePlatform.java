package com.delta.listingtracker.crawl.platform;

import com.delta.listingtracker.crawl.model.Listing;
import com.delta.listingtracker.crawl.model.PaginationEstimate;
import com.delta.listingtracker.crawl.util.PriceParser;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public abstract class AbstractMarketplacePlatform implements MarketplacePlatform {
    private static final Logger log = LoggerFactory.getLogger(AbstractMarketplacePlatform.class);

    protected static final List<String> COMMON_OVERLAY_SELECTORS = List.of(
        "#onetrust-accept-btn-handler",
        "[data-testid='cookie-accept']",
        ".js-cookie-accept",
        ".cookie-banner button",
        ".close-button",
        ".modal-close",
        "[aria-label='Close']",
        "[class*='overlay'] button",
        "[class*='modal'] button",
        "[role='dialog'] button"
    );

    protected static final List<String> COMMON_CHALLENGE_SELECTORS = List.of(
        "#challenge-running",
        "#cf-challenge-running",
        "#challenge-stage",
        ".cf-browser-verification",
        "div.cf-turnstile"
    );

    private static final Pattern PAGE_PARAM = Pattern.compile("([?&])page=\\d+");

    private final String baseUrl;

    protected AbstractMarketplacePlatform(String baseUrl) {
        this.baseUrl = stripTrailingSlash(baseUrl);
    }

    @Override
    public String baseUrl() {
        return baseUrl;
    }

    @Override
    public List<String> overlaySelectors() {
        return COMMON_OVERLAY_SELECTORS;
    }

    @Override
    public List<String> challengeSelectors() {
        return COMMON_CHALLENGE_SELECTORS;
    }

    @Override
    public Optional<String> pageSizeSelector() {
        return Optional.empty();
    }

    @Override
    public boolean hasNextPage(Document document) {
        if (document == null) {
            return false;
        }
        for (String selector : nextPageSelectors()) {
            if (document.selectFirst(selector) != null) {
                return true;
            }
        }
        return false;
    }

    @Override
    public List<Listing> parseListings(List<String> cardFragments, String pageUrl, int pageNumber) {
        List<Listing> out = new ArrayList<>();
        if (cardFragments == null) {
            return out;
        }
        for (String fragment : cardFragments) {
            Element card = Jsoup.parseBodyFragment(fragment, pageUrl == null ? baseUrl : pageUrl).body().children().first();
            if (card == null) {
                continue;
            }
            try {
                parseCard(card, pageNumber).ifPresent(out::add);
            } catch (RuntimeException e) {
                log.warn("{}: failed to parse card on page {}: {}", name(), pageNumber, e.getMessage());
            }
        }
        return out;
    }

    protected abstract Optional<Listing> parseCard(Element card, int pageNumber);

    /**
     * Highest numeric label inside any of the pagination containers.
     */
    protected Integer maxPageNumber(Document document, List<String> containerSelectors) {
        Integer max = null;
        for (String containerSelector : containerSelectors) {
            for (Element container : document.select(containerSelector)) {
                for (Element label : container.select("a, button, span, li")) {
                    String text = label.ownText().trim();
                    if (text.matches("\\d{1,4}")) {
                        int value = Integer.parseInt(text);
                        if (max == null || value > max) {
                            max = value;
                        }
                    }
                }
            }
        }
        return max;
    }

    protected PaginationEstimate combine(Integer totalPages, Integer totalItems) {
        Integer pages = totalPages;
        Integer items = totalItems;
        if (pages == null && items != null && items > 0) {
            pages = (items + pageSize() - 1) / pageSize();
        }
        if (items == null && pages != null) {
            items = pages * pageSize();
        }
        return new PaginationEstimate(pages, items);
    }

    protected static String withPageParam(String url, int pageNumber) {
        Matcher matcher = PAGE_PARAM.matcher(url);
        if (matcher.find()) {
            return matcher.replaceFirst(matcher.group(1) + "page=" + pageNumber);
        }
        return url + (url.contains("?") ? "&" : "?") + "page=" + pageNumber;
    }

    protected static String firstText(Element root, List<String> selectors) {
        for (String selector : selectors) {
            Element element = root.selectFirst(selector);
            if (element != null && !element.text().isBlank()) {
                return element.text().trim();
            }
        }
        return null;
    }

    protected static String imageUrl(Element card, List<String> attributes) {
        for (Element img : card.select("img")) {
            for (String attribute : attributes) {
                String value = img.attr(attribute);
                if (value == null || value.isBlank()) {
                    continue;
                }
                if ("srcset".equals(attribute)) {
                    String[] parts = value.split(",");
                    value = parts[parts.length - 1].trim().split("\\s+")[0];
                }
                if (value.startsWith("//")) {
                    value = "https:" + value;
                }
                if (value.startsWith("http")) {
                    return value;
                }
            }
        }
        return null;
    }

    protected String absolute(Element link) {
        String href = link.absUrl("href");
        if (href.isBlank()) {
            href = link.attr("href");
            if (href.startsWith("/")) {
                href = baseUrl + href;
            }
        }
        return href;
    }

    protected static String priceCurrency(String priceText) {
        return PriceParser.currency(priceText, "EUR");
    }

    protected static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value.trim(), StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
