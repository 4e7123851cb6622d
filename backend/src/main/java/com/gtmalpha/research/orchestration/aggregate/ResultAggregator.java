package com.gtmalpha.research.orchestration.aggregate;

import com.gtmalpha.research.orchestration.model.CanonicalRecord;
import com.gtmalpha.research.orchestration.model.CompanyEntity;
import com.gtmalpha.research.orchestration.model.FieldProvenance;
import com.gtmalpha.research.orchestration.model.ProviderAttempt;
import com.gtmalpha.research.orchestration.util.UrlNormalizer;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public class ResultAggregator {
    private final Clock clock;

    public ResultAggregator(Clock clock) {
        this.clock = clock;
    }

    public CanonicalRecord aggregate(CompanyEntity entity, List<ProviderAttempt> history) {
        List<ProviderAttempt> contributions = new ArrayList<>();
        BigDecimal totalCost = BigDecimal.ZERO;
        for (ProviderAttempt attempt : history) {
            totalCost = totalCost.add(attempt.cost());
            if (attempt.isSuccess() && attempt.content() != null) {
                contributions.add(attempt);
            }
        }
        if (contributions.isEmpty()) {
            throw new IllegalArgumentException("No successful provider output to aggregate for " + entity.entityId());
        }

        List<Contribution> applied = new ArrayList<>();
        Map<String, Integer> winners = new LinkedHashMap<>();
        for (ProviderAttempt attempt : contributions) {
            for (Map.Entry<String, Object> entry : attempt.content().entrySet()) {
                if (entry.getKey() == null || entry.getValue() == null) {
                    continue;
                }
                winners.put(entry.getKey(), applied.size());
                applied.add(new Contribution(entry.getKey(), attempt, entry.getValue()));
            }
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        Map<String, String> fieldSources = new LinkedHashMap<>();
        List<FieldProvenance> provenance = new ArrayList<>();
        for (int i = 0; i < applied.size(); i++) {
            Contribution contribution = applied.get(i);
            boolean superseded = winners.get(contribution.field()) != i;
            provenance.add(new FieldProvenance(
                contribution.field(),
                contribution.attempt().providerId(),
                contribution.attempt().attemptNumber(),
                contribution.value(),
                superseded
            ));
        }
        winners.forEach((field, index) -> {
            Contribution winner = applied.get(index);
            fields.put(field, winner.value());
            fieldSources.put(field, winner.attempt().providerId());
        });

        Set<String> contributing = new LinkedHashSet<>();
        contributions.forEach(attempt -> contributing.add(attempt.providerId()));
        ProviderAttempt finalAttempt = finalContribution(contributions);

        return new CanonicalRecord(
            entity.entityId(),
            normalizeName(entity.name()),
            normalizeDomain(entity.domain()),
            identity(entity),
            fields,
            fieldSources,
            provenance,
            new ArrayList<>(contributing),
            finalAttempt.providerId(),
            totalCost,
            clock.instant()
        );
    }

    private ProviderAttempt finalContribution(List<ProviderAttempt> contributions) {
        for (int i = contributions.size() - 1; i >= 0; i--) {
            if (contributions.get(i).qualityAccepted()) {
                return contributions.get(i);
            }
        }
        return contributions.get(contributions.size() - 1);
    }

    private Map<String, String> identity(CompanyEntity entity) {
        Map<String, String> identity = new LinkedHashMap<>();
        identity.put("entity_id", entity.entityId());
        putIfPresent(identity, "name", normalizeName(entity.name()));
        String domain = normalizeDomain(entity.domain());
        putIfPresent(identity, "domain", domain);
        putIfPresent(identity, "website", domain == null ? null : "https://" + domain);
        entity.metadata().forEach((key, value) -> {
            if (key != null && !identity.containsKey(key)) {
                putIfPresent(identity, key, value == null ? null : value.trim());
            }
        });
        return identity;
    }

    private void putIfPresent(Map<String, String> target, String key, String value) {
        if (value != null && !value.isBlank()) {
            target.put(key, value);
        }
    }

    private String normalizeName(String name) {
        if (name == null) {
            return null;
        }
        String collapsed = name.trim().replaceAll("\\s+", " ");
        return collapsed.isEmpty() ? null : collapsed;
    }

    private String normalizeDomain(String domain) {
        String canonical = UrlNormalizer.canonicalDomain(domain);
        return canonical == null ? null : canonical.toLowerCase(Locale.ROOT);
    }

    private record Contribution(String field, ProviderAttempt attempt, Object value) {
    }
}
