package com.gtmalpha.research.orchestration.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gtmalpha.research.config.ResearchProperties;
import com.gtmalpha.research.orchestration.http.PoliteHttpClient;
import com.gtmalpha.research.orchestration.model.CompanyEntity;
import com.gtmalpha.research.orchestration.model.HttpFetchResult;
import com.gtmalpha.research.orchestration.util.OutcomeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

public class HttpResearchProvider extends ConfiguredProvider {
    private static final Logger log = LoggerFactory.getLogger(HttpResearchProvider.class);
    private static final TypeReference<Map<String, Object>> CONTENT_TYPE = new TypeReference<>() {};

    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpResearchProvider(ResearchProperties.Provider config, PoliteHttpClient httpClient, ObjectMapper objectMapper) {
        super(config);
        if (config.getEndpoint() == null || config.getEndpoint().isBlank()) {
            throw new IllegalArgumentException("research.providers[" + config.getId() + "].endpoint is required");
        }
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public ProviderResponse attempt(ProviderRequest request) {
        String body;
        try {
            body = objectMapper.writeValueAsString(requestBody(request.entity()));
        } catch (JsonProcessingException e) {
            return ProviderResponse.terminal(OutcomeClassifier.INVALID_REQUEST);
        }
        Map<String, String> headers = new LinkedHashMap<>();
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            headers.put("Authorization", "Bearer " + config.getApiKey());
        }
        HttpFetchResult fetch = httpClient.postJson(config.getEndpoint(), body, headers);
        if (!fetch.isSuccessful()) {
            return ProviderResponse.failure(OutcomeClassifier.fromFetchResult(fetch), BigDecimal.ZERO);
        }
        String payload = fetch.body() == null ? "" : fetch.body();
        try {
            JsonNode root = objectMapper.readTree(payload);
            JsonNode contentNode = root == null ? null : root.get("content");
            if (contentNode == null || !contentNode.isObject()) {
                log.warn("Provider {} returned a payload without a content object", id());
                return ProviderResponse.terminal(OutcomeClassifier.INVALID_PAYLOAD);
            }
            Map<String, Object> content = objectMapper.convertValue(contentNode, CONTENT_TYPE);
            JsonNode costNode = root.get("cost");
            BigDecimal reported = costNode != null && costNode.isNumber() ? costNode.decimalValue() : null;
            return ProviderResponse.success(content, costModel.cost(reported, payload.length()), payload);
        } catch (JsonProcessingException e) {
            log.warn("Provider {} returned malformed JSON: {}", id(), e.getOriginalMessage());
            return ProviderResponse.terminal(OutcomeClassifier.INVALID_PAYLOAD);
        }
    }

    private Map<String, Object> requestBody(CompanyEntity entity) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("entityId", entity.entityId());
        body.put("name", entity.name());
        body.put("domain", entity.domain());
        body.put("url", entity.websiteUrl());
        body.put("instructions", config.getInstructions());
        body.put("metadata", entity.metadata());
        return body;
    }
}
