package com.gtmalpha.research.orchestration.service;

import com.gtmalpha.research.config.ResearchProperties;
import com.gtmalpha.research.orchestration.budget.BudgetLedger;
import com.gtmalpha.research.orchestration.persistence.ResearchJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Map;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class BudgetLedgerBootstrap implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(BudgetLedgerBootstrap.class);

    private final ResearchJdbcRepository repository;
    private final BudgetLedger budgetLedger;
    private final ResearchProperties properties;
    private final Clock clock;

    public BudgetLedgerBootstrap(
        ResearchJdbcRepository repository,
        BudgetLedger budgetLedger,
        ResearchProperties properties,
        Clock clock
    ) {
        this.repository = repository;
        this.budgetLedger = budgetLedger;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        ZoneId zone = ZoneId.of(properties.getBudget().getZone());
        Instant startOfDay = LocalDate.now(clock.withZone(zone)).atStartOfDay(zone).toInstant();
        Map<String, BigDecimal> spent;
        try {
            spent = repository.sumCostByClassSince(startOfDay);
        } catch (DataAccessException e) {
            log.warn("Skipping budget seeding because spend could not be read: {}", e.getMessage());
            return;
        }
        spent.forEach((costClass, amount) -> {
            budgetLedger.seedCommitted(costClass, amount);
            log.info("Budget {} seeded with ${} already spent today", costClass, amount);
        });
    }
}
