package com.gtmalpha.research.config;

import com.gtmalpha.research.orchestration.model.ProviderTier;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "research")
public class ResearchProperties {
    private static final String DEFAULT_USER_AGENT = "gtm-research-orchestrator/0.1 (+contact)";

    private int batchSize = 5;
    private int maxParallelism = 5;
    private int gracePeriodSeconds = 30;
    private int activeRunMinutes = 30;
    private Retry retry = new Retry();
    private Circuit circuit = new Circuit();
    private Budget budget = new Budget();
    private List<Provider> providers = new ArrayList<>();
    private Delivery delivery = new Delivery();
    private Http http = new Http();
    private Cli cli = new Cli();

    public int getBatchSize() {
        return Math.max(1, batchSize);
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = Math.max(1, batchSize);
    }

    public int getMaxParallelism() {
        return Math.max(1, maxParallelism);
    }

    public void setMaxParallelism(int maxParallelism) {
        this.maxParallelism = Math.max(1, maxParallelism);
    }

    public int getGracePeriodSeconds() {
        return Math.max(0, gracePeriodSeconds);
    }

    public void setGracePeriodSeconds(int gracePeriodSeconds) {
        this.gracePeriodSeconds = Math.max(0, gracePeriodSeconds);
    }

    public int getActiveRunMinutes() {
        return Math.max(1, activeRunMinutes);
    }

    public void setActiveRunMinutes(int activeRunMinutes) {
        this.activeRunMinutes = Math.max(1, activeRunMinutes);
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Circuit getCircuit() {
        return circuit;
    }

    public void setCircuit(Circuit circuit) {
        this.circuit = circuit;
    }

    public Budget getBudget() {
        return budget;
    }

    public void setBudget(Budget budget) {
        this.budget = budget;
    }

    public List<Provider> getProviders() {
        return providers;
    }

    public void setProviders(List<Provider> providers) {
        this.providers = providers == null ? new ArrayList<>() : providers;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public void setDelivery(Delivery delivery) {
        this.delivery = delivery;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Retry {
        private int maxAttempts = 3;
        private int baseDelayMs = 500;
        private int maxDelayMs = 10_000;
        private int attemptTimeoutSeconds = 60;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getBaseDelayMs() {
            return Math.max(0, baseDelayMs);
        }

        public void setBaseDelayMs(int baseDelayMs) {
            this.baseDelayMs = Math.max(0, baseDelayMs);
        }

        public int getMaxDelayMs() {
            return Math.max(0, maxDelayMs);
        }

        public void setMaxDelayMs(int maxDelayMs) {
            this.maxDelayMs = Math.max(0, maxDelayMs);
        }

        public int getAttemptTimeoutSeconds() {
            return Math.max(1, attemptTimeoutSeconds);
        }

        public void setAttemptTimeoutSeconds(int attemptTimeoutSeconds) {
            this.attemptTimeoutSeconds = Math.max(1, attemptTimeoutSeconds);
        }
    }

    public static class Circuit {
        private int windowSize = 10;
        private int minimumCalls = 10;
        private double failureRateThreshold = 0.5;
        private int cooldownSeconds = 60;
        private double cooldownMultiplier = 2.0;
        private int maxCooldownSeconds = 900;

        public int getWindowSize() {
            return Math.max(1, windowSize);
        }

        public void setWindowSize(int windowSize) {
            this.windowSize = Math.max(1, windowSize);
        }

        public int getMinimumCalls() {
            return Math.max(1, Math.min(minimumCalls, getWindowSize()));
        }

        public void setMinimumCalls(int minimumCalls) {
            this.minimumCalls = Math.max(1, minimumCalls);
        }

        public double getFailureRateThreshold() {
            return Math.max(0.0, Math.min(1.0, failureRateThreshold));
        }

        public void setFailureRateThreshold(double failureRateThreshold) {
            this.failureRateThreshold = failureRateThreshold;
        }

        public int getCooldownSeconds() {
            return Math.max(1, cooldownSeconds);
        }

        public void setCooldownSeconds(int cooldownSeconds) {
            this.cooldownSeconds = Math.max(1, cooldownSeconds);
        }

        public double getCooldownMultiplier() {
            return Math.max(1.0, cooldownMultiplier);
        }

        public void setCooldownMultiplier(double cooldownMultiplier) {
            this.cooldownMultiplier = cooldownMultiplier;
        }

        public int getMaxCooldownSeconds() {
            return Math.max(getCooldownSeconds(), maxCooldownSeconds);
        }

        public void setMaxCooldownSeconds(int maxCooldownSeconds) {
            this.maxCooldownSeconds = maxCooldownSeconds;
        }
    }

    public static class Budget {
        private String zone = "UTC";
        private Map<String, BigDecimal> dailyCaps = new LinkedHashMap<>();

        public String getZone() {
            return zone == null || zone.isBlank() ? "UTC" : zone.trim();
        }

        public void setZone(String zone) {
            this.zone = zone;
        }

        public Map<String, BigDecimal> getDailyCaps() {
            return dailyCaps;
        }

        public void setDailyCaps(Map<String, BigDecimal> dailyCaps) {
            this.dailyCaps = dailyCaps == null ? new LinkedHashMap<>() : dailyCaps;
        }
    }

    public static class Provider {
        private String id;
        private String type = "http";
        private ProviderTier tier = ProviderTier.SCRAPER;
        private String costClass;
        private BigDecimal estimatedCost = BigDecimal.ZERO;
        private String endpoint;
        private String apiKey;
        private String instructions;
        private CostModel costModel = CostModel.FLAT;
        private BigDecimal flatCost = BigDecimal.ZERO;
        private BigDecimal pricePerMillionTokens = BigDecimal.ZERO;
        private boolean enabled = true;
        private QualityGate qualityGate = new QualityGate();

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public ProviderTier getTier() {
            return tier == null ? ProviderTier.SCRAPER : tier;
        }

        public void setTier(ProviderTier tier) {
            this.tier = tier;
        }

        public String getCostClass() {
            return costClass == null || costClass.isBlank() ? id : costClass.trim();
        }

        public void setCostClass(String costClass) {
            this.costClass = costClass;
        }

        public BigDecimal getEstimatedCost() {
            return nonNegative(estimatedCost);
        }

        public void setEstimatedCost(BigDecimal estimatedCost) {
            this.estimatedCost = estimatedCost;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getInstructions() {
            return instructions;
        }

        public void setInstructions(String instructions) {
            this.instructions = instructions;
        }

        public CostModel getCostModel() {
            return costModel == null ? CostModel.FLAT : costModel;
        }

        public void setCostModel(CostModel costModel) {
            this.costModel = costModel;
        }

        public BigDecimal getFlatCost() {
            return nonNegative(flatCost);
        }

        public void setFlatCost(BigDecimal flatCost) {
            this.flatCost = flatCost;
        }

        public BigDecimal getPricePerMillionTokens() {
            return nonNegative(pricePerMillionTokens);
        }

        public void setPricePerMillionTokens(BigDecimal pricePerMillionTokens) {
            this.pricePerMillionTokens = pricePerMillionTokens;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public QualityGate getQualityGate() {
            return qualityGate;
        }

        public void setQualityGate(QualityGate qualityGate) {
            this.qualityGate = qualityGate == null ? new QualityGate() : qualityGate;
        }

        private static BigDecimal nonNegative(BigDecimal value) {
            if (value == null || value.signum() < 0) {
                return BigDecimal.ZERO;
            }
            return value;
        }
    }

    public enum CostModel {
        FLAT,
        PER_TOKEN
    }

    public static class QualityGate {
        private List<String> requiredFields = new ArrayList<>();
        private int minContentLength = 0;

        public List<String> getRequiredFields() {
            return requiredFields;
        }

        public void setRequiredFields(List<String> requiredFields) {
            this.requiredFields = requiredFields == null ? new ArrayList<>() : requiredFields;
        }

        public int getMinContentLength() {
            return Math.max(0, minContentLength);
        }

        public void setMinContentLength(int minContentLength) {
            this.minContentLength = Math.max(0, minContentLength);
        }

        public boolean isConfigured() {
            return !requiredFields.isEmpty() || minContentLength > 0;
        }
    }

    public static class Delivery {
        private boolean enabled = false;
        private String webhookUrl;
        private String authToken;

        public boolean isEnabled() {
            return enabled && webhookUrl != null && !webhookUrl.isBlank();
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getWebhookUrl() {
            return webhookUrl;
        }

        public void setWebhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
        }

        public String getAuthToken() {
            return authToken;
        }

        public void setAuthToken(String authToken) {
            this.authToken = authToken;
        }
    }

    public static class Http {
        private String userAgent;
        private int globalConcurrency = 8;
        private int perHostDelayMs = 250;
        private int requestTimeoutSeconds = 30;

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getGlobalConcurrency() {
            return Math.max(1, globalConcurrency);
        }

        public void setGlobalConcurrency(int globalConcurrency) {
            this.globalConcurrency = Math.max(1, globalConcurrency);
        }

        public int getPerHostDelayMs() {
            return Math.max(0, perHostDelayMs);
        }

        public void setPerHostDelayMs(int perHostDelayMs) {
            this.perHostDelayMs = Math.max(0, perHostDelayMs);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }
    }

    public static class Cli {
        private boolean run;
        private String csvPath = "../data/companies.csv";
        private int limit = 10;
        private Integer batchSize;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getCsvPath() {
            return csvPath;
        }

        public void setCsvPath(String csvPath) {
            this.csvPath = csvPath;
        }

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }

        public Integer getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(Integer batchSize) {
            this.batchSize = batchSize;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
