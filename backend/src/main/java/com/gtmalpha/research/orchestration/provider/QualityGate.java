package com.gtmalpha.research.orchestration.provider;

import com.gtmalpha.research.orchestration.model.CompanyEntity;

import java.util.Map;

@FunctionalInterface
public interface QualityGate {
    QualityGate ACCEPT_ALL = (entity, content) -> true;

    boolean accept(CompanyEntity entity, Map<String, Object> content);
}
