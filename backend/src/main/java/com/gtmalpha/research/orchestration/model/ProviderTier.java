package com.gtmalpha.research.orchestration.model;

public enum ProviderTier {
    SCRAPER,
    AI_TRANSFORM,
    DEEP_RESEARCH
}
