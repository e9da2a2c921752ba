package com.delta.listingtracker.crawl.platform;

import com.delta.listingtracker.crawl.model.Listing;
import com.delta.listingtracker.crawl.model.PaginationEstimate;
import com.delta.listingtracker.crawl.util.PriceParser;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Auction lots in the wristwatch category. Prices are current bids.
 */
public class CatawikiPlatform extends AbstractMarketplacePlatform {
    public static final String NAME = "catawiki";
    public static final String DEFAULT_BASE_URL = "https://www.catawiki.com";

    private static final int PAGE_SIZE = 24;
    private static final Pattern LOT_ID = Pattern.compile("/l/(\\d+)");

    public CatawikiPlatform(String baseUrl) {
        super(baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String searchUrl(String target) {
        return baseUrl() + "/es/l/401-relojes-de-pulsera?q=" + encode(target);
    }

    @Override
    public String pageUrl(String landedUrl, int pageNumber) {
        if (pageNumber <= 1) {
            return landedUrl;
        }
        return withPageParam(landedUrl, pageNumber);
    }

    @Override
    public int pageSize() {
        return PAGE_SIZE;
    }

    @Override
    public String listingSelector() {
        return "[data-testid='lot-card']";
    }

    @Override
    public List<String> fallbackListingSelectors() {
        return List.of(".lot-card", "article[class*='lot']", "[class*='LotCard']");
    }

    @Override
    public List<String> nextPageSelectors() {
        return List.of(
            "a[aria-label='Next']",
            "a[aria-label='Siguiente']",
            "a[rel='next']",
            "[data-testid='pagination-next']"
        );
    }

    @Override
    public PaginationEstimate estimatePagination(Document document) {
        if (document == null) {
            return PaginationEstimate.unknown();
        }
        return combine(maxPageNumber(document, List.of("[class*='pagination']", "[data-testid='pagination']")), null);
    }

    @Override
    protected Optional<Listing> parseCard(Element card, int pageNumber) {
        Element link = card.is("a[href*='/l/']") ? card : card.selectFirst("a[href*='/l/']");
        if (link == null) {
            return Optional.empty();
        }
        String url = absolute(link);
        Matcher matcher = LOT_ID.matcher(url);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String priceText = firstText(card, List.of(
            "[data-testid='current-bid']",
            "[data-testid='lot-price']",
            ".current-bid",
            "[class*='price']",
            "[class*='bid']"
        ));
        return Optional.of(new Listing(
            NAME,
            matcher.group(1),
            firstText(card, List.of("[data-testid='lot-title']", ".lot-title", "h3", "h4", "[class*='title']")),
            PriceParser.parse(priceText),
            priceCurrency(priceText),
            null,
            null,
            imageUrl(card, List.of("data-src", "data-lazy", "srcset", "src")),
            url,
            pageNumber
        ));
    }
}
