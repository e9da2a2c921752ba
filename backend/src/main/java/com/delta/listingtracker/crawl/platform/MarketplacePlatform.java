package com.delta.listingtracker.crawl.platform;

import com.delta.listingtracker.crawl.model.Listing;
import com.delta.listingtracker.crawl.model.PaginationEstimate;
import org.jsoup.nodes.Document;

import java.util.List;
import java.util.Optional;

/**
 * Everything the crawler needs to know about one marketplace: URL layout, selectors and card parsing.
 */
public interface MarketplacePlatform {

    String name();

    String baseUrl();

    String searchUrl(String target);

    /**
     * URL of the given page derived from the URL the search landed on (page 1).
     */
    String pageUrl(String landedUrl, int pageNumber);

    int pageSize();

    String listingSelector();

    List<String> fallbackListingSelectors();

    List<String> overlaySelectors();

    List<String> nextPageSelectors();

    List<String> challengeSelectors();

    Optional<String> pageSizeSelector();

    PaginationEstimate estimatePagination(Document document);

    boolean hasNextPage(Document document);

    List<Listing> parseListings(List<String> cardFragments, String pageUrl, int pageNumber);
}
