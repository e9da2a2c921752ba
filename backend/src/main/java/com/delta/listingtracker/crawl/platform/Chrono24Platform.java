package com.delta.listingtracker.crawl.platform;

import com.delta.listingtracker.crawl.model.Listing;
import com.delta.listingtracker.crawl.model.PaginationEstimate;
import com.delta.listingtracker.crawl.util.PriceParser;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class Chrono24Platform extends AbstractMarketplacePlatform {
    public static final String NAME = "chrono24";
    public static final String DEFAULT_BASE_URL = "https://www.chrono24.es";

    private static final int PAGE_SIZE = 120;
    private static final Pattern LISTING_ID = Pattern.compile("--id(\\d+)\\.htm");
    private static final Pattern MODEL_PAGE = Pattern.compile("--mod(\\d+)(?:-\\d+)?\\.htm");
    private static final Pattern SHOWPAGE = Pattern.compile("showpage=\\d+");
    private static final Pattern COUNTRY_CODE = Pattern.compile("^[A-Z]{2}$");
    private static final Pattern TOTAL_OF = Pattern.compile("(?:of|de)\\s+([\\d.,\\s]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TOTAL_RESULTS = Pattern.compile(
        "([\\d.,\\s]+)\\s*(?:resultado|result|watch|anuncio)",
        Pattern.CASE_INSENSITIVE
    );
    private static final Map<String, String> CONDITIONS = new LinkedHashMap<>();

    static {
        CONDITIONS.put("sin usar", "new");
        CONDITIONS.put("unworn", "new");
        CONDITIONS.put("nuevo", "new");
        CONDITIONS.put("muy bueno", "very_good");
        CONDITIONS.put("very good", "very_good");
        CONDITIONS.put("bueno", "good");
        CONDITIONS.put("good", "good");
        CONDITIONS.put("aceptable", "fair");
        CONDITIONS.put("fair", "fair");
        CONDITIONS.put("new", "new");
    }

    public Chrono24Platform(String baseUrl) {
        super(baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String searchUrl(String target) {
        return baseUrl() + "/search/index.htm?query=" + encode(target)
            + "&dosearch=true&searchexplain=1&sortorder=5&pageSize=" + PAGE_SIZE;
    }

    /**
     * Model landing pages paginate as {@code --modNN-P.htm}; search result pages use {@code showpage}.
     */
    @Override
    public String pageUrl(String landedUrl, int pageNumber) {
        if (pageNumber <= 1) {
            return landedUrl;
        }
        Matcher model = MODEL_PAGE.matcher(landedUrl);
        if (model.find()) {
            return model.replaceFirst("--mod" + model.group(1) + "-" + pageNumber + ".htm");
        }
        if (SHOWPAGE.matcher(landedUrl).find()) {
            return SHOWPAGE.matcher(landedUrl).replaceFirst("showpage=" + pageNumber);
        }
        return landedUrl + (landedUrl.contains("?") ? "&" : "?") + "showpage=" + pageNumber;
    }

    @Override
    public int pageSize() {
        return PAGE_SIZE;
    }

    @Override
    public String listingSelector() {
        return "article.article-item-container";
    }

    @Override
    public List<String> fallbackListingSelectors() {
        return List.of("article[class*='article']", ".article-item-container", "[class*='article-item']");
    }

    @Override
    public List<String> nextPageSelectors() {
        return List.of(
            "a[aria-label='Next']",
            "a[aria-label='Siguiente']",
            ".pagination a.next",
            ".pagination [rel='next']",
            "a[title='Next page']",
            ".pager-next a"
        );
    }

    @Override
    public Optional<String> pageSizeSelector() {
        return Optional.of("[data-page-size='120']");
    }

    @Override
    public PaginationEstimate estimatePagination(Document document) {
        if (document == null) {
            return PaginationEstimate.unknown();
        }
        Integer pages = maxPageNumber(document, List.of(".pagination", ".pager", "[data-testid='pagination']"));
        Integer items = null;
        for (String selector : List.of(
            "[class*='result-count']",
            "[class*='total-count']",
            "[data-testid='result-count']",
            ".pagination-info"
        )) {
            Element element = document.selectFirst(selector);
            if (element == null) {
                continue;
            }
            items = totalFromText(element.text());
            if (items != null) {
                break;
            }
        }
        return combine(pages, items);
    }

    static Integer totalFromText(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = TOTAL_OF.matcher(text);
        if (!matcher.find()) {
            matcher = TOTAL_RESULTS.matcher(text);
            if (!matcher.find()) {
                return null;
            }
        }
        Integer value = PriceParser.parseCount(matcher.group(1));
        return value == null || value == 0 ? null : value;
    }

    @Override
    protected Optional<Listing> parseCard(Element card, int pageNumber) {
        Element link = card.selectFirst("a[href*='--id']");
        if (link == null) {
            return Optional.empty();
        }
        String url = absolute(link);
        Matcher idMatcher = LISTING_ID.matcher(url);
        if (!idMatcher.find()) {
            return Optional.empty();
        }
        String listingId = idMatcher.group(1);

        String title = firstText(card, List.of("[class*='article-title']", "[class*='title']", "h2", "h3"));
        String priceText = firstText(card, List.of("[class*='price']"));
        String country = firstText(card, List.of("[class*='location']", "[class*='country']"));
        for (Element element : card.getAllElements()) {
            String own = element.ownText().trim();
            if (priceText == null && own.contains("€")) {
                priceText = own;
            }
            if (country == null && COUNTRY_CODE.matcher(own).matches()) {
                country = own;
            }
        }
        return Optional.of(new Listing(
            NAME,
            listingId,
            title,
            PriceParser.parse(priceText),
            priceCurrency(priceText),
            condition(card.text()),
            country,
            imageUrl(card, List.of("data-original", "data-lazy", "data-src", "srcset", "src")),
            url,
            pageNumber
        ));
    }

    private static String condition(String text) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : CONDITIONS.entrySet()) {
            if (lower.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }
}
