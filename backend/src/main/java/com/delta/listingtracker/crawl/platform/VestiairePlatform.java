package com.delta.listingtracker.crawl.platform;

import com.delta.listingtracker.crawl.model.Listing;
import com.delta.listingtracker.crawl.model.PaginationEstimate;
import com.delta.listingtracker.crawl.util.PriceParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Seller inventories; a target is a seller id.
 */
public class VestiairePlatform extends AbstractMarketplacePlatform {
    public static final String NAME = "vestiaire";
    public static final String DEFAULT_BASE_URL = "https://es.vestiairecollective.com";

    private static final int PAGE_SIZE = 60;
    private static final Pattern SHTML_ID = Pattern.compile("/product/[^?#]*-(\\d+)\\.shtml");
    private static final Pattern PATH_ID = Pattern.compile("/product/(\\d+)");

    private final ObjectMapper objectMapper;

    public VestiairePlatform(String baseUrl, ObjectMapper objectMapper) {
        super(baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl);
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String searchUrl(String target) {
        return baseUrl() + "/profile/" + encode(target) + "/?tab=items-for-sale";
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
        return "[data-testid='product-card']";
    }

    @Override
    public List<String> fallbackListingSelectors() {
        return List.of("[class*='product-card_productCard']", "article[class*='product']");
    }

    @Override
    public List<String> nextPageSelectors() {
        return List.of(
            "a[aria-label='Next']",
            "a[aria-label='Siguiente']",
            "[class*='pagination'] [rel='next']",
            "[class*='pagination'] a[class*='next']"
        );
    }

    @Override
    public PaginationEstimate estimatePagination(Document document) {
        if (document == null) {
            return PaginationEstimate.unknown();
        }
        Element nextData = document.selectFirst("script#__NEXT_DATA__");
        if (nextData != null) {
            PaginationEstimate fromJson = fromNextData(nextData.data());
            if (fromJson != null) {
                return fromJson;
            }
        }
        return combine(maxPageNumber(document, List.of("[class*='pagination']")), null);
    }

    private PaginationEstimate fromNextData(String json) {
        try {
            JsonNode pageProps = objectMapper.readTree(json).path("props").path("pageProps");
            JsonNode pagination = pageProps.path("pagination");
            if (pagination.isMissingNode()) {
                pagination = pageProps.path("userProducts").path("pagination");
            }
            Integer items = positive(pagination, "total", "totalItems");
            Integer pages = positive(pagination, "totalPages", "pageCount");
            if (items == null && pages == null) {
                return null;
            }
            return combine(pages, items);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static Integer positive(JsonNode node, String... fields) {
        for (String field : fields) {
            int value = node.path(field).asInt(0);
            if (value > 0) {
                return value;
            }
        }
        return null;
    }

    @Override
    protected Optional<Listing> parseCard(Element card, int pageNumber) {
        Element link = card.is("a[href*='/product/']") ? card : card.selectFirst("a[href*='/product/']");
        if (link == null) {
            return Optional.empty();
        }
        String url = absolute(link);
        Matcher matcher = SHTML_ID.matcher(url);
        if (!matcher.find()) {
            matcher = PATH_ID.matcher(url);
            if (!matcher.find()) {
                return Optional.empty();
            }
        }
        String name = firstText(card, List.of("[data-testid='product-name']", ".product-name", "[class*='productCard__name']", "h3"));
        String brand = firstText(card, List.of("[data-testid='product-brand']", ".product-brand", "[class*='productCard__brand']"));
        String title = brand == null ? name : (name == null ? brand : brand + " " + name);
        String priceText = firstText(card, List.of("[data-testid='product-price']", ".product-price", "[class*='productCard__price']", "span.price"));
        return Optional.of(new Listing(
            NAME,
            matcher.group(1),
            title,
            PriceParser.parse(priceText),
            priceCurrency(priceText),
            firstText(card, List.of("[data-testid='product-condition']", "[class*='condition']")),
            null,
            imageUrl(card, List.of("data-src", "data-lazy-src", "data-original", "srcset", "src")),
            url,
            pageNumber
        ));
    }
}
