package com.gtmalpha.research.orchestration.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gtmalpha.research.config.ResearchProperties;
import com.gtmalpha.research.orchestration.http.PoliteHttpClient;
import com.gtmalpha.research.orchestration.model.AttemptOutcome;
import com.gtmalpha.research.orchestration.model.CompanyEntity;
import com.gtmalpha.research.orchestration.model.ProviderTier;
import com.gtmalpha.research.orchestration.util.OutcomeClassifier;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpResearchProviderTest {
    private static final CompanyEntity ACME =
        new CompanyEntity("zi-1", "Acme Analytics", "acme.com", Map.of("industry", "Software"));

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private ExecutorService executor;
    private PoliteHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        ResearchProperties properties = new ResearchProperties();
        properties.getHttp().setGlobalConcurrency(1);
        properties.getHttp().setPerHostDelayMs(1);
        properties.getHttp().setRequestTimeoutSeconds(5);
        executor = Executors.newFixedThreadPool(1);
        client = new PoliteHttpClient(properties, executor);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void postsCompanyAndReadsContentWithReportedCost() throws Exception {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody("{\"content\":{\"description\":\"Analytics for retailers\",\"industry\":\"Software\"},\"cost\":0.02}"));
        HttpResearchProvider provider = new HttpResearchProvider(config("ai-transform"), client, objectMapper);

        ProviderResponse response = provider.attempt(new ProviderRequest(ACME, 1));

        assertThat(response.outcome()).isEqualTo(AttemptOutcome.SUCCESS);
        assertThat(response.content())
            .containsEntry("description", "Analytics for retailers")
            .containsEntry("industry", "Software");
        assertThat(response.cost()).isEqualByComparingTo("0.02");
        assertThat(response.rawPayload()).contains("\"cost\":0.02");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer test-key");
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.get("entityId").asText()).isEqualTo("zi-1");
        assertThat(body.get("domain").asText()).isEqualTo("acme.com");
        assertThat(body.get("url").asText()).isEqualTo("https://acme.com");
        assertThat(body.get("instructions").asText()).isEqualTo("Summarize the company");
        assertThat(body.get("metadata").get("industry").asText()).isEqualTo("Software");
    }

    @Test
    void configuredFlatCostAppliesWhenProviderReportsNone() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"content\":{\"summary\":\"x\"}}"));
        ResearchProperties.Provider config = config("ai-transform");
        config.setFlatCost(new BigDecimal("0.01"));
        HttpResearchProvider provider = new HttpResearchProvider(config, client, objectMapper);

        ProviderResponse response = provider.attempt(new ProviderRequest(ACME, 1));

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.cost()).isEqualByComparingTo("0.01");
    }

    @Test
    void serverErrorIsRetryable() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        HttpResearchProvider provider = new HttpResearchProvider(config("deep-research"), client, objectMapper);

        ProviderResponse response = provider.attempt(new ProviderRequest(ACME, 1));

        assertThat(response.outcome()).isEqualTo(AttemptOutcome.RETRYABLE_FAILURE);
        assertThat(response.reasonCode()).isEqualTo(OutcomeClassifier.HTTP_5XX);
        assertThat(response.cost()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void badRequestIsTerminal() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"error\":\"bad input\"}"));
        HttpResearchProvider provider = new HttpResearchProvider(config("deep-research"), client, objectMapper);

        ProviderResponse response = provider.attempt(new ProviderRequest(ACME, 1));

        assertThat(response.outcome()).isEqualTo(AttemptOutcome.TERMINAL_FAILURE);
        assertThat(response.reasonCode()).isEqualTo(OutcomeClassifier.INVALID_REQUEST);
    }

    @Test
    void payloadWithoutContentObjectIsInvalid() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"data\":[1,2,3]}"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("not json"));
        HttpResearchProvider provider = new HttpResearchProvider(config("ai-transform"), client, objectMapper);

        ProviderResponse missing = provider.attempt(new ProviderRequest(ACME, 1));
        ProviderResponse malformed = provider.attempt(new ProviderRequest(ACME, 2));

        assertThat(missing.reasonCode()).isEqualTo(OutcomeClassifier.INVALID_PAYLOAD);
        assertThat(malformed.outcome()).isEqualTo(AttemptOutcome.TERMINAL_FAILURE);
        assertThat(malformed.reasonCode()).isEqualTo(OutcomeClassifier.INVALID_PAYLOAD);
    }

    @Test
    void endpointIsRequired() {
        ResearchProperties.Provider config = config("ai-transform");
        config.setEndpoint(" ");

        assertThatThrownBy(() -> new HttpResearchProvider(config, client, objectMapper))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("ai-transform");
    }

    private ResearchProperties.Provider config(String id) {
        ResearchProperties.Provider config = new ResearchProperties.Provider();
        config.setId(id);
        config.setTier(ProviderTier.AI_TRANSFORM);
        config.setEndpoint(server.url("/v1/research").toString());
        config.setApiKey("test-key");
        config.setInstructions("Summarize the company");
        return config;
    }
}
