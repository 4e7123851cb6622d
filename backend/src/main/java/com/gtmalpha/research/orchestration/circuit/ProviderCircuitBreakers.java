package com.gtmalpha.research.orchestration.circuit;

import com.gtmalpha.research.orchestration.model.CircuitSnapshot;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class ProviderCircuitBreakers {
    private final CircuitSettings settings;
    private final Clock clock;
    private final Map<String, ProviderCircuit> circuits = new ConcurrentHashMap<>();

    public ProviderCircuitBreakers(CircuitSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    public ProviderCircuit circuit(String providerId) {
        return circuits.computeIfAbsent(providerId, id -> new ProviderCircuit(id, settings, clock));
    }

    public Map<String, CircuitSnapshot> snapshots() {
        Map<String, CircuitSnapshot> out = new LinkedHashMap<>();
        circuits.keySet().stream()
            .sorted(Comparator.naturalOrder())
            .forEach(id -> out.put(id, circuits.get(id).snapshot()));
        return out;
    }

    public long totalTransitions() {
        return circuits.values().stream().mapToLong(circuit -> circuit.snapshot().transitions()).sum();
    }
}
