package com.gtmalpha.research.orchestration.support;

import com.gtmalpha.research.orchestration.model.ProviderTier;
import com.gtmalpha.research.orchestration.provider.ProviderRequest;
import com.gtmalpha.research.orchestration.provider.ProviderResponse;
import com.gtmalpha.research.orchestration.provider.QualityGate;
import com.gtmalpha.research.orchestration.provider.ResearchProvider;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Provider double that answers from a queue of scripted steps, then from a fallback step.
 */
public class ScriptedProvider implements ResearchProvider {
    private final String id;
    private final ProviderTier tier;
    private final BigDecimal estimatedCost;
    private final Queue<Function<ProviderRequest, ProviderResponse>> script = new ConcurrentLinkedQueue<>();
    private final AtomicInteger calls = new AtomicInteger();
    private volatile Function<ProviderRequest, ProviderResponse> fallback;
    private volatile QualityGate qualityGate = QualityGate.ACCEPT_ALL;

    public ScriptedProvider(String id, ProviderTier tier, String estimatedCost) {
        this.id = id;
        this.tier = tier;
        this.estimatedCost = new BigDecimal(estimatedCost);
    }

    public ScriptedProvider then(ProviderResponse response) {
        script.add(request -> response);
        return this;
    }

    public ScriptedProvider then(Function<ProviderRequest, ProviderResponse> step) {
        script.add(step);
        return this;
    }

    public ScriptedProvider always(ProviderResponse response) {
        this.fallback = request -> response;
        return this;
    }

    public ScriptedProvider always(Function<ProviderRequest, ProviderResponse> step) {
        this.fallback = step;
        return this;
    }

    public ScriptedProvider gatedBy(QualityGate gate) {
        this.qualityGate = gate;
        return this;
    }

    public int calls() {
        return calls.get();
    }

    public static ProviderResponse success(String cost, Object... keyValues) {
        return ProviderResponse.success(content(keyValues), new BigDecimal(cost), null);
    }

    public static Map<String, Object> content(Object... keyValues) {
        Map<String, Object> content = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            content.put((String) keyValues[i], keyValues[i + 1]);
        }
        return content;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String costClass() {
        return id;
    }

    @Override
    public ProviderTier tier() {
        return tier;
    }

    @Override
    public BigDecimal estimatedCost() {
        return estimatedCost;
    }

    @Override
    public QualityGate qualityGate() {
        return qualityGate;
    }

    @Override
    public ProviderResponse attempt(ProviderRequest request) {
        calls.incrementAndGet();
        Function<ProviderRequest, ProviderResponse> step = script.poll();
        if (step == null) {
            step = fallback;
        }
        if (step == null) {
            throw new IllegalStateException("no scripted response left for " + id);
        }
        return step.apply(request);
    }
}
