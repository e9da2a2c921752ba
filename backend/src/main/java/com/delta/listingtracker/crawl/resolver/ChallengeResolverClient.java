package com.delta.listingtracker.crawl.resolver;

import com.delta.listingtracker.config.CrawlerProperties;
import com.delta.listingtracker.crawl.model.ResolverSolution;
import com.delta.listingtracker.crawl.model.SessionCookie;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Client for a FlareSolverr-compatible endpoint: {@code POST {cmd:"request.get", url, maxTimeout}}.
 * The HTTP timeout is the solve timeout plus a fixed grace period.
 */
@Service
public class ChallengeResolverClient implements ChallengeResolver {
    private static final Logger log = LoggerFactory.getLogger(ChallengeResolverClient.class);
    private static final Duration HTTP_GRACE = Duration.ofSeconds(10);

    private final CrawlerProperties.Resolver settings;
    private final ObjectMapper objectMapper;
    private final HttpClient client;
    private final Semaphore limiter;

    public ChallengeResolverClient(CrawlerProperties properties, ObjectMapper objectMapper) {
        this.settings = properties.getResolver();
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .version(HttpClient.Version.HTTP_1_1)
            .build();
        this.limiter = new Semaphore(settings.getMaxConcurrent());
    }

    @Override
    public boolean isEnabled() {
        return settings.isEnabled() && settings.getBaseUrl() != null && !settings.getBaseUrl().isBlank();
    }

    @Override
    public ResolverSolution resolve(String url, Duration timeout) {
        if (!isEnabled()) {
            throw new ResolverUnavailableException("challenge resolver is disabled");
        }
        Duration solveTimeout = timeout == null ? Duration.ofSeconds(settings.getTimeoutSeconds()) : timeout;
        boolean acquired;
        try {
            acquired = limiter.tryAcquire(solveTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResolverUnavailableException("interrupted waiting for resolver slot", e);
        }
        if (!acquired) {
            throw new ResolverTimeoutException("no resolver slot within " + solveTimeout.toSeconds() + "s", null);
        }
        try {
            return execute(url, solveTimeout);
        } finally {
            limiter.release();
        }
    }

    private ResolverSolution execute(String url, Duration solveTimeout) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(settings.getBaseUrl()))
            .timeout(solveTimeout.plus(HTTP_GRACE))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(requestBody(url, solveTimeout), StandardCharsets.UTF_8))
            .build();
        long started = System.currentTimeMillis();
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpConnectTimeoutException e) {
            throw new ResolverUnavailableException("resolver connect timeout: " + settings.getBaseUrl(), e);
        } catch (HttpTimeoutException e) {
            throw new ResolverTimeoutException("resolver timed out after " + solveTimeout.toSeconds() + "s", e);
        } catch (IOException e) {
            throw new ResolverUnavailableException("resolver unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResolverUnavailableException("interrupted calling resolver", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new ResolverRejectedException(response.statusCode(), "resolver returned HTTP " + response.statusCode());
        }
        ResolverSolution solution = parse(response.body(), url);
        log.info(
            "Resolver solved {} in {} ms (status={}, cookies={})",
            url,
            System.currentTimeMillis() - started,
            solution.status(),
            solution.cookies().size()
        );
        return solution;
    }

    private String requestBody(String url, Duration solveTimeout) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("cmd", "request.get");
        body.put("url", url);
        body.put("maxTimeout", solveTimeout.toMillis());
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("unable to encode resolver request", e);
        }
    }

    ResolverSolution parse(String body, String requestedUrl) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new ResolverRejectedException(200, "resolver answered with invalid JSON");
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new ResolverRejectedException(200, "resolver answered with an empty body");
        }
        String status = root.path("status").asText("");
        if (!"ok".equalsIgnoreCase(status)) {
            throw new ResolverRejectedException(200, "resolver status '" + status + "': " + root.path("message").asText(""));
        }
        JsonNode solution = root.path("solution");
        if (solution.isMissingNode() || solution.isNull()) {
            throw new ResolverRejectedException(200, "resolver answer has no solution");
        }
        List<SessionCookie> cookies = new ArrayList<>();
        for (JsonNode cookie : solution.path("cookies")) {
            String name = cookie.path("name").asText(null);
            if (name == null || name.isBlank()) {
                continue;
            }
            cookies.add(new SessionCookie(
                name,
                cookie.path("value").asText(""),
                cookie.path("domain").asText(null),
                cookie.path("path").asText("/"),
                cookie.path("secure").asBoolean(false),
                cookie.path("httpOnly").asBoolean(false),
                cookie.hasNonNull("expires") ? cookie.path("expires").asDouble() : null
            ));
        }
        return new ResolverSolution(
            solution.path("url").asText(requestedUrl),
            solution.path("status").asInt(0),
            solution.path("response").asText(null),
            cookies,
            solution.path("userAgent").asText(null)
        );
    }
}
