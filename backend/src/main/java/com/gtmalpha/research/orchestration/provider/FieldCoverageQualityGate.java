package com.gtmalpha.research.orchestration.provider;

import com.gtmalpha.research.config.ResearchProperties;
import com.gtmalpha.research.orchestration.model.CompanyEntity;

import java.util.Collection;
import java.util.List;
import java.util.Map;

public class FieldCoverageQualityGate implements QualityGate {
    private final List<String> requiredFields;
    private final int minContentLength;

    public FieldCoverageQualityGate(List<String> requiredFields, int minContentLength) {
        this.requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
        this.minContentLength = Math.max(0, minContentLength);
    }

    public static QualityGate from(ResearchProperties.QualityGate config) {
        if (config == null || !config.isConfigured()) {
            return QualityGate.ACCEPT_ALL;
        }
        return new FieldCoverageQualityGate(config.getRequiredFields(), config.getMinContentLength());
    }

    @Override
    public boolean accept(CompanyEntity entity, Map<String, Object> content) {
        if (content == null || content.isEmpty()) {
            return false;
        }
        for (String field : requiredFields) {
            if (isBlank(content.get(field))) {
                return false;
            }
        }
        return contentLength(content.values()) >= minContentLength;
    }

    private boolean isBlank(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence text) {
            return text.toString().isBlank();
        }
        if (value instanceof Collection<?> values) {
            return values.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        return false;
    }

    private int contentLength(Collection<Object> values) {
        int total = 0;
        for (Object value : values) {
            if (value instanceof Collection<?> items) {
                for (Object item : items) {
                    total += item == null ? 0 : item.toString().length();
                }
            } else if (value != null) {
                total += value.toString().length();
            }
        }
        return total;
    }
}
