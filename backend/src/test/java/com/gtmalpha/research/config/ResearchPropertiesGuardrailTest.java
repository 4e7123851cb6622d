package com.gtmalpha.research.config;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResearchPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        ResearchProperties properties = new ResearchProperties();
        properties.getHttp().setUserAgent("   ");
        assertTrue(properties.getHttp().getUserAgent().startsWith("gtm-research-orchestrator/0.1"));
    }

    @Test
    void schedulingKnobsAreClamped() {
        ResearchProperties properties = new ResearchProperties();
        properties.setBatchSize(0);
        properties.setMaxParallelism(-3);
        properties.setGracePeriodSeconds(-1);
        properties.getHttp().setGlobalConcurrency(0);
        properties.getHttp().setPerHostDelayMs(-10);
        properties.getRetry().setMaxAttempts(0);
        assertEquals(1, properties.getBatchSize());
        assertEquals(1, properties.getMaxParallelism());
        assertEquals(0, properties.getGracePeriodSeconds());
        assertEquals(1, properties.getHttp().getGlobalConcurrency());
        assertEquals(0, properties.getHttp().getPerHostDelayMs());
        assertEquals(1, properties.getRetry().getMaxAttempts());
    }

    @Test
    void circuitMinimumCallsNeverExceedsWindow() {
        ResearchProperties.Circuit circuit = new ResearchProperties.Circuit();
        circuit.setWindowSize(5);
        circuit.setMinimumCalls(20);
        circuit.setFailureRateThreshold(1.7);
        assertEquals(5, circuit.getMinimumCalls());
        assertEquals(1.0, circuit.getFailureRateThreshold());
    }

    @Test
    void providerCostClassDefaultsToId() {
        ResearchProperties.Provider provider = new ResearchProperties.Provider();
        provider.setId("homepage");
        assertEquals("homepage", provider.getCostClass());
        provider.setCostClass(" scraping ");
        assertEquals("scraping", provider.getCostClass());
        provider.setEstimatedCost(new BigDecimal("-1"));
        assertEquals(0, provider.getEstimatedCost().signum());
    }

    @Test
    void deliveryNeedsWebhookUrl() {
        ResearchProperties.Delivery delivery = new ResearchProperties.Delivery();
        delivery.setEnabled(true);
        assertFalse(delivery.isEnabled());
        delivery.setWebhookUrl("https://crm.example.com/hooks/research");
        assertTrue(delivery.isEnabled());
    }
}
