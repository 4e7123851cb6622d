package com.gtmalpha.research.orchestration.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class UrlNormalizer {
    private UrlNormalizer() {
    }

    public static String cleanUrl(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        String value = candidate.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    public static String canonicalDomain(String candidate) {
        String cleaned = cleanUrl(candidate);
        if (cleaned == null) {
            return null;
        }
        URI uri = safeUri(cleaned);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        return host.isBlank() ? null : host;
    }

    public static URI safeUri(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return new URI(value.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
