package com.gtmalpha.research.orchestration.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record CompanyEntity(
    String entityId,
    String name,
    String domain,
    Map<String, String> metadata
) {
    public CompanyEntity {
        Objects.requireNonNull(entityId, "entityId is required");
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public String websiteUrl() {
        return domain == null || domain.isBlank() ? null : "https://" + domain;
    }
}
