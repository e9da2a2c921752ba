package com.delta.listingtracker.crawl.http;

import com.delta.listingtracker.config.CrawlerProperties;
import com.delta.listingtracker.crawl.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class PoliteHttpClientRetryTest {
    private MockWebServer server;
    private ExecutorService executor;
    private PoliteHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();

        CrawlerProperties properties = new CrawlerProperties();
        properties.setGlobalConcurrency(1);
        properties.setPerHostDelayMs(1);
        properties.setRequestTimeoutSeconds(5);
        properties.setRequestMaxRetries(2);
        properties.setRequestRetryBaseDelayMs(1);
        properties.setRequestRetryMaxDelayMs(5);

        executor = Executors.newFixedThreadPool(1);
        client = new PoliteHttpClient(properties, executor);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void retriesServerErrorsUntilSuccess() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>ok</html>"));

        HttpFetchResult result = client.getHtml(server.url("/search").toString());

        assertThat(result.statusCode()).isEqualTo(200);
        assertThat(result.isSuccessful()).isTrue();
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void doesNotRetryNotFound() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("missing"));

        HttpFetchResult result = client.getHtml(server.url("/gone").toString());

        assertThat(result.statusCode()).isEqualTo(404);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void forwardsSessionHeadersAndCapturesCookies() throws Exception {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .addHeader("Set-Cookie", "session=xyz; Path=/; HttpOnly")
            .setBody("<html></html>"));

        HttpFetchResult result = client.get(
            server.url("/page").toString(),
            Map.of("Cookie", "cf_clearance=abc", "User-Agent", "Mozilla/5.0 (resolver)")
        );

        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("Cookie")).isEqualTo("cf_clearance=abc");
        assertThat(request.getHeader("User-Agent")).isEqualTo("Mozilla/5.0 (resolver)");
        assertThat(request.getHeader("Accept-Language")).startsWith("es-ES");
        assertThat(result.setCookieHeaders()).containsExactly("session=xyz; Path=/; HttpOnly");
    }
}
