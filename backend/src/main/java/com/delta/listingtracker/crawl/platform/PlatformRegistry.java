package com.delta.listingtracker.crawl.platform;

import com.delta.listingtracker.config.CrawlerProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Component
public class PlatformRegistry {
    private final CrawlerProperties properties;
    private final Map<String, MarketplacePlatform> platforms = new LinkedHashMap<>();

    public PlatformRegistry(CrawlerProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        register(new Chrono24Platform(properties.platform(Chrono24Platform.NAME).getBaseUrl()));
        register(new VestiairePlatform(properties.platform(VestiairePlatform.NAME).getBaseUrl(), objectMapper));
        register(new CatawikiPlatform(properties.platform(CatawikiPlatform.NAME).getBaseUrl()));
    }

    private void register(MarketplacePlatform platform) {
        platforms.put(platform.name(), platform);
    }

    public Optional<MarketplacePlatform> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(platforms.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    public List<String> names() {
        return new ArrayList<>(platforms.keySet());
    }

    public List<String> enabledNames() {
        List<String> out = new ArrayList<>();
        for (String name : platforms.keySet()) {
            if (properties.platform(name).isEnabled()) {
                out.add(name);
            }
        }
        return out;
    }
}
