package com.gtmalpha.research.orchestration.provider;

import com.gtmalpha.research.config.ResearchProperties;
import com.gtmalpha.research.orchestration.http.PoliteHttpClient;
import com.gtmalpha.research.orchestration.model.CompanyEntity;
import com.gtmalpha.research.orchestration.model.HttpFetchResult;
import com.gtmalpha.research.orchestration.util.OutcomeClassifier;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public class HomepageScrapeProvider extends ConfiguredProvider {
    private static final List<String> SOCIAL_HOSTS = List.of(
        "linkedin.com", "twitter.com", "x.com", "facebook.com", "instagram.com", "youtube.com", "github.com"
    );
    private static final int MAX_HEADINGS = 10;

    private final PoliteHttpClient httpClient;

    public HomepageScrapeProvider(ResearchProperties.Provider config, PoliteHttpClient httpClient) {
        super(config);
        this.httpClient = httpClient;
    }

    @Override
    public ProviderResponse attempt(ProviderRequest request) {
        CompanyEntity entity = request.entity();
        String url = config.getEndpoint() != null && !config.getEndpoint().isBlank()
            ? config.getEndpoint().replace("{domain}", entity.domain() == null ? "" : entity.domain())
            : entity.websiteUrl();
        if (url == null) {
            return ProviderResponse.terminal(OutcomeClassifier.INVALID_REQUEST);
        }
        HttpFetchResult fetch = httpClient.get(url, "text/html,application/xhtml+xml");
        if (!fetch.isSuccessful()) {
            return ProviderResponse.failure(OutcomeClassifier.fromFetchResult(fetch), BigDecimal.ZERO);
        }
        String html = fetch.body();
        if (html == null || html.isBlank()) {
            return ProviderResponse.terminal(OutcomeClassifier.INVALID_PAYLOAD);
        }
        Map<String, Object> content = extract(html, fetch.finalUrlOrRequested());
        return ProviderResponse.success(content, costModel.cost(null, html.length()), html);
    }

    Map<String, Object> extract(String html, String baseUrl) {
        Document doc = Jsoup.parse(html, baseUrl);
        Map<String, Object> content = new LinkedHashMap<>();
        String title = doc.title();
        if (title != null && !title.isBlank()) {
            content.put("title", title.trim());
        }
        String description = firstNonBlank(
            doc.select("meta[name=description]").attr("content"),
            doc.select("meta[property=og:description]").attr("content")
        );
        if (description != null) {
            content.put("description", description);
        }
        List<String> headings = new ArrayList<>();
        for (Element heading : doc.select("h1, h2")) {
            String text = heading.text().trim();
            if (!text.isEmpty() && headings.size() < MAX_HEADINGS) {
                headings.add(text);
            }
        }
        if (!headings.isEmpty()) {
            content.put("headings", headings);
        }
        Set<String> socialLinks = new LinkedHashSet<>();
        for (Element anchor : doc.select("a[href]")) {
            String href = anchor.attr("abs:href");
            if (href != null && isSocial(href)) {
                socialLinks.add(href.trim());
            }
        }
        if (!socialLinks.isEmpty()) {
            content.put("social_links", new ArrayList<>(socialLinks));
        }
        content.put("source_url", baseUrl);
        return content;
    }

    private boolean isSocial(String href) {
        String lower = href.toLowerCase(Locale.ROOT);
        for (String host : SOCIAL_HOSTS) {
            if (lower.contains("://" + host) || lower.contains("://www." + host)) {
                return true;
            }
        }
        return false;
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
