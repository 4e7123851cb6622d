package com.gtmalpha.research.orchestration.service;

import com.gtmalpha.research.orchestration.budget.BudgetLedger;
import com.gtmalpha.research.orchestration.circuit.ProviderCircuitBreakers;
import com.gtmalpha.research.orchestration.model.BudgetSnapshot;
import com.gtmalpha.research.orchestration.model.CostReport;
import com.gtmalpha.research.orchestration.model.ProgressSnapshot;
import com.gtmalpha.research.orchestration.model.ProviderTier;
import com.gtmalpha.research.orchestration.model.ResearchRunMeta;
import com.gtmalpha.research.orchestration.model.TaskState;
import com.gtmalpha.research.orchestration.persistence.ResearchJdbcRepository;
import com.gtmalpha.research.orchestration.provider.ProviderRegistry;
import com.gtmalpha.research.orchestration.provider.ResearchProvider;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Service
public class ProgressMonitorService {
    static final double CAP_WARNING_THRESHOLD = 0.8;
    private static final BigDecimal EXCELLENT_AVERAGE = new BigDecimal("0.001");
    private static final BigDecimal ESCALATION_RATIO = BigDecimal.TEN;

    private final ResearchSchedulerService scheduler;
    private final BudgetLedger budgetLedger;
    private final ProviderCircuitBreakers circuitBreakers;
    private final ProviderRegistry providerRegistry;
    private final ResearchJdbcRepository repository;
    private final Clock clock;

    public ProgressMonitorService(
        ResearchSchedulerService scheduler,
        BudgetLedger budgetLedger,
        ProviderCircuitBreakers circuitBreakers,
        ProviderRegistry providerRegistry,
        ResearchJdbcRepository repository,
        Clock clock
    ) {
        this.scheduler = scheduler;
        this.budgetLedger = budgetLedger;
        this.circuitBreakers = circuitBreakers;
        this.providerRegistry = providerRegistry;
        this.repository = repository;
        this.clock = clock;
    }

    public ProgressSnapshot snapshot() {
        Long runId = scheduler.currentRunId();
        boolean running = runId != null;
        Map<TaskState, Long> counts;
        if (running) {
            counts = scheduler.liveTaskCounts();
        } else {
            Optional<ResearchRunMeta> latest = repository.findLatestRun();
            runId = latest.map(ResearchRunMeta::runId).orElse(null);
            counts = runId == null ? emptyCounts() : withAllStates(repository.countTasksByState(runId));
        }
        Map<String, BudgetSnapshot> spend = budgetLedger.snapshots();
        long delivered = counts.getOrDefault(TaskState.DELIVERED, 0L);
        return new ProgressSnapshot(
            runId,
            running,
            scheduler.isStopRequested(),
            counts,
            spend,
            circuitBreakers.snapshots(),
            costReport(spend, delivered),
            clock.instant()
        );
    }

    CostReport costReport(Map<String, BudgetSnapshot> spend, long deliveredEntities) {
        Map<String, BigDecimal> byClass = new LinkedHashMap<>();
        BigDecimal total = BigDecimal.ZERO;
        for (BudgetSnapshot snapshot : spend.values()) {
            byClass.put(snapshot.costClass(), snapshot.committed());
            total = total.add(snapshot.committed());
        }
        Set<String> cheapClasses = cheapestTierClasses();
        BigDecimal cheapSpend = BigDecimal.ZERO;
        for (Map.Entry<String, BigDecimal> entry : byClass.entrySet()) {
            if (cheapClasses.contains(entry.getKey())) {
                cheapSpend = cheapSpend.add(entry.getValue());
            }
        }
        BigDecimal escalatedSpend = total.subtract(cheapSpend);
        BigDecimal average = deliveredEntities <= 0
            ? BigDecimal.ZERO
            : total.divide(BigDecimal.valueOf(deliveredEntities), 6, RoundingMode.HALF_UP);
        double cheapShare = total.signum() == 0 ? 0.0 : cheapSpend.doubleValue() / total.doubleValue();

        String suggestion;
        if (escalatedSpend.compareTo(cheapSpend.multiply(ESCALATION_RATIO)) > 0 && escalatedSpend.signum() > 0) {
            suggestion = "Most spend goes to escalated providers; investigate why the cheap tier ("
                + String.join(", ", cheapClasses) + ") is failing or being rejected.";
        } else if (deliveredEntities > 0 && average.compareTo(EXCELLENT_AVERAGE) < 0) {
            suggestion = "Excellent cost efficiency; the cheap tier is carrying the load.";
        } else {
            suggestion = "Good balance between cost and reliability.";
        }

        List<String> warnings = new ArrayList<>();
        for (BudgetSnapshot snapshot : spend.values()) {
            if (snapshot.dailyCap() != null && snapshot.utilization() >= CAP_WARNING_THRESHOLD) {
                warnings.add(String.format(
                    Locale.ROOT,
                    "Cost class %s at %.0f%% of its daily cap ($%s of $%s)",
                    snapshot.costClass(),
                    snapshot.utilization() * 100.0,
                    snapshot.committed().toPlainString(),
                    snapshot.dailyCap().toPlainString()
                ));
            }
        }
        return new CostReport(total, byClass, deliveredEntities, average, cheapShare, suggestion, warnings);
    }

    private Set<String> cheapestTierClasses() {
        ProviderTier cheapest = null;
        for (ResearchProvider provider : providerRegistry.providers()) {
            if (cheapest == null || provider.tier().ordinal() < cheapest.ordinal()) {
                cheapest = provider.tier();
            }
        }
        Set<String> classes = new HashSet<>();
        for (ResearchProvider provider : providerRegistry.providers()) {
            if (provider.tier() == cheapest) {
                classes.add(provider.costClass());
            }
        }
        return classes;
    }

    private Map<TaskState, Long> emptyCounts() {
        return withAllStates(Map.of());
    }

    private Map<TaskState, Long> withAllStates(Map<TaskState, Long> counts) {
        Map<TaskState, Long> out = new EnumMap<>(TaskState.class);
        for (TaskState state : TaskState.values()) {
            out.put(state, counts.getOrDefault(state, 0L));
        }
        return out;
    }
}
