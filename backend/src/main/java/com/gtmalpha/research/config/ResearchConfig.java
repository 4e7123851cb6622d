package com.gtmalpha.research.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gtmalpha.research.orchestration.aggregate.ResultAggregator;
import com.gtmalpha.research.orchestration.budget.BudgetLedger;
import com.gtmalpha.research.orchestration.chain.ProviderFallbackChain;
import com.gtmalpha.research.orchestration.circuit.CircuitSettings;
import com.gtmalpha.research.orchestration.circuit.ProviderCircuitBreakers;
import com.gtmalpha.research.orchestration.delivery.DeliverySink;
import com.gtmalpha.research.orchestration.delivery.IdempotentDeliveryService;
import com.gtmalpha.research.orchestration.delivery.LoggingDeliverySink;
import com.gtmalpha.research.orchestration.delivery.WebhookDeliverySink;
import com.gtmalpha.research.orchestration.http.PoliteHttpClient;
import com.gtmalpha.research.orchestration.persistence.ResearchJdbcRepository;
import com.gtmalpha.research.orchestration.provider.ProviderRegistry;
import com.gtmalpha.research.orchestration.retry.BackoffPolicy;
import com.gtmalpha.research.orchestration.retry.RetryController;
import com.gtmalpha.research.orchestration.service.ResearchTaskRunner;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ResearchConfig {

    @Bean(name = "researchExecutor", destroyMethod = "shutdownNow")
    public ExecutorService researchExecutor(ResearchProperties properties) {
        return Executors.newFixedThreadPool(properties.getMaxParallelism());
    }

    @Bean(name = "researchRunExecutor", destroyMethod = "shutdownNow")
    public ExecutorService researchRunExecutor() {
        return Executors.newSingleThreadExecutor();
    }

    @Bean(name = "providerCallExecutor", destroyMethod = "shutdownNow")
    public ExecutorService providerCallExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "provider-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(ResearchProperties properties) {
        int size = Math.max(4, properties.getHttp().getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public BudgetLedger budgetLedger(ResearchProperties properties, Clock clock) {
        ResearchProperties.Budget budget = properties.getBudget();
        return new BudgetLedger(budget.getDailyCaps(), ZoneId.of(budget.getZone()), clock);
    }

    @Bean
    public ProviderCircuitBreakers providerCircuitBreakers(ResearchProperties properties, Clock clock) {
        return new ProviderCircuitBreakers(CircuitSettings.from(properties.getCircuit()), clock);
    }

    @Bean
    public RetryController retryController(
        ResearchProperties properties,
        @Qualifier("providerCallExecutor") ExecutorService providerCallExecutor
    ) {
        ResearchProperties.Retry retry = properties.getRetry();
        return new RetryController(
            retry.getMaxAttempts(),
            new BackoffPolicy(retry.getBaseDelayMs(), retry.getMaxDelayMs()),
            Duration.ofSeconds(retry.getAttemptTimeoutSeconds()),
            providerCallExecutor
        );
    }

    @Bean
    public ProviderRegistry providerRegistry(
        ResearchProperties properties,
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        return ProviderRegistry.fromConfig(properties, httpClient, objectMapper);
    }

    @Bean
    public ProviderFallbackChain providerFallbackChain(
        ProviderRegistry registry,
        BudgetLedger budgetLedger,
        ProviderCircuitBreakers circuitBreakers,
        RetryController retryController,
        Clock clock
    ) {
        return new ProviderFallbackChain(registry, budgetLedger, circuitBreakers, retryController, clock);
    }

    @Bean
    public ResultAggregator resultAggregator(Clock clock) {
        return new ResultAggregator(clock);
    }

    @Bean
    public DeliverySink deliverySink(ResearchProperties properties, PoliteHttpClient httpClient) {
        ResearchProperties.Delivery delivery = properties.getDelivery();
        if (delivery.isEnabled()) {
            return new WebhookDeliverySink(delivery, httpClient);
        }
        return new LoggingDeliverySink();
    }

    @Bean
    public IdempotentDeliveryService idempotentDeliveryService(
        ResearchJdbcRepository repository,
        DeliverySink deliverySink,
        RetryController retryController,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        return new IdempotentDeliveryService(repository, deliverySink, retryController, objectMapper, clock);
    }

    @Bean
    public ResearchTaskRunner researchTaskRunner(
        ProviderFallbackChain chain,
        ResultAggregator aggregator,
        IdempotentDeliveryService deliveryService,
        ResearchJdbcRepository repository,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        return new ResearchTaskRunner(chain, aggregator, deliveryService, repository, objectMapper, clock);
    }
}
