package com.delta.listingtracker.crawl.platform;

import com.delta.listingtracker.crawl.model.Listing;
import com.delta.listingtracker.crawl.model.PaginationEstimate;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class VestiairePlatformTest {
    private final VestiairePlatform platform = new VestiairePlatform(null, new ObjectMapper());

    @Test
    void buildsSellerInventoryUrls() {
        String url = platform.searchUrl("3022988");

        assertEquals("https://es.vestiairecollective.com/profile/3022988/?tab=items-for-sale", url);
        assertEquals(url + "&page=2", platform.pageUrl(url, 2));
        assertEquals(url + "&page=5", platform.pageUrl(url + "&page=2", 5));
    }

    @Test
    void readsPaginationFromEmbeddedState() {
        String html = "<html><body><script id=\"__NEXT_DATA__\" type=\"application/json\">"
            + "{\"props\":{\"pageProps\":{\"pagination\":{\"total\":145,\"totalPages\":3}}}}"
            + "</script></body></html>";

        PaginationEstimate estimate = platform.estimatePagination(Jsoup.parse(html));

        assertEquals(3, estimate.totalPages());
        assertEquals(145, estimate.totalItems());
    }

    @Test
    void derivesPagesFromItemTotal() {
        String html = "<html><body><script id=\"__NEXT_DATA__\" type=\"application/json\">"
            + "{\"props\":{\"pageProps\":{\"userProducts\":{\"pagination\":{\"totalItems\":121}}}}}"
            + "</script></body></html>";

        PaginationEstimate estimate = platform.estimatePagination(Jsoup.parse(html));

        assertEquals(3, estimate.totalPages());
        assertEquals(121, estimate.totalItems());
    }

    @Test
    void parsesProductCards() {
        String card = "<div data-testid=\"product-card\">"
            + "<a href=\"/product/cartier-tank-solo-gold-steel-41234567.shtml\">"
            + "<span data-testid=\"product-brand\">Cartier</span>"
            + "<span data-testid=\"product-name\">Tank Solo</span>"
            + "<span data-testid=\"product-price\">2.350 €</span>"
            + "</a></div>";

        List<Listing> listings = platform.parseListings(List.of(card), platform.searchUrl("3022988"), 2);

        assertEquals(1, listings.size());
        Listing listing = listings.get(0);
        assertEquals("41234567", listing.listingId());
        assertEquals("Cartier Tank Solo", listing.title());
        assertEquals(0, new BigDecimal("2350").compareTo(listing.price()));
        assertThat(listing.url()).isEqualTo("https://es.vestiairecollective.com/product/cartier-tank-solo-gold-steel-41234567.shtml");
    }
}
