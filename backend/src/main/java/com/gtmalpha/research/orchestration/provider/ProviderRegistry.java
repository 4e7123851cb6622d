package com.gtmalpha.research.orchestration.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gtmalpha.research.config.ResearchProperties;
import com.gtmalpha.research.orchestration.http.PoliteHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public class ProviderRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final List<ResearchProvider> providers;

    public ProviderRegistry(List<ResearchProvider> providers) {
        Set<String> seen = new HashSet<>();
        for (ResearchProvider provider : providers) {
            if (!seen.add(provider.id())) {
                throw new IllegalArgumentException("Duplicate provider id: " + provider.id());
            }
        }
        this.providers = List.copyOf(providers);
    }

    public static ProviderRegistry fromConfig(ResearchProperties properties, PoliteHttpClient httpClient, ObjectMapper objectMapper) {
        List<ResearchProvider> providers = new ArrayList<>();
        for (ResearchProperties.Provider config : properties.getProviders()) {
            if (!config.isEnabled()) {
                log.info("Provider {} disabled by configuration", config.getId());
                continue;
            }
            String type = config.getType() == null ? "http" : config.getType().trim().toLowerCase(Locale.ROOT);
            switch (type) {
                case "homepage" -> providers.add(new HomepageScrapeProvider(config, httpClient));
                case "http" -> providers.add(new HttpResearchProvider(config, httpClient, objectMapper));
                default -> throw new IllegalArgumentException("Unknown provider type '" + config.getType() + "' for " + config.getId());
            }
        }
        if (providers.isEmpty()) {
            log.warn("No research providers configured; every task will end unreachable");
        }
        return new ProviderRegistry(providers);
    }

    public List<ResearchProvider> providers() {
        return providers;
    }
}
