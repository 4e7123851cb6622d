package com.gtmalpha.research.orchestration.budget;

import com.gtmalpha.research.orchestration.model.BudgetSnapshot;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per cost-class daily spend accounting. Reservations are taken optimistically before a provider
 * call and reconciled with {@link BudgetReservation#commit(BigDecimal)} or released afterwards.
 * Holds no I/O; restart seeding goes through {@link #seedCommitted(String, BigDecimal)}.
 */
public class BudgetLedger {
    private final Map<String, BigDecimal> dailyCaps;
    private final ZoneId zone;
    private final Clock clock;
    private final Map<String, Account> accounts = new ConcurrentHashMap<>();

    public BudgetLedger(Map<String, BigDecimal> dailyCaps, ZoneId zone, Clock clock) {
        this.dailyCaps = dailyCaps == null ? Map.of() : Map.copyOf(dailyCaps);
        this.zone = zone == null ? ZoneId.of("UTC") : zone;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public Optional<BudgetReservation> reserve(String costClass, BigDecimal estimate) {
        BigDecimal amount = nonNegative(estimate);
        Account account = account(costClass);
        synchronized (account) {
            account.rollIfNeeded(today());
            BigDecimal cap = dailyCaps.get(costClass);
            if (cap != null) {
                BigDecimal held = account.committed.add(account.reserved);
                if (held.compareTo(cap) >= 0 || held.add(amount).compareTo(cap) > 0) {
                    return Optional.empty();
                }
            }
            account.reserved = account.reserved.add(amount);
            return Optional.of(new BudgetReservation(this, costClass, amount, account.day));
        }
    }

    public BudgetSnapshot snapshot(String costClass) {
        Account account = account(costClass);
        synchronized (account) {
            account.rollIfNeeded(today());
            BigDecimal cap = dailyCaps.get(costClass);
            BigDecimal remaining = cap == null
                ? null
                : cap.subtract(account.committed).subtract(account.reserved).max(BigDecimal.ZERO);
            return new BudgetSnapshot(costClass, account.day, cap, account.committed, account.reserved, remaining);
        }
    }

    public Map<String, BudgetSnapshot> snapshots() {
        Map<String, BudgetSnapshot> out = new LinkedHashMap<>();
        accounts.keySet().stream()
            .sorted(Comparator.naturalOrder())
            .forEach(costClass -> out.put(costClass, snapshot(costClass)));
        return out;
    }

    public BigDecimal committed(String costClass) {
        return snapshot(costClass).committed();
    }

    public void seedCommitted(String costClass, BigDecimal amount) {
        Account account = account(costClass);
        synchronized (account) {
            account.rollIfNeeded(today());
            account.committed = account.committed.add(nonNegative(amount));
        }
    }

    public BigDecimal dailyCap(String costClass) {
        return dailyCaps.get(costClass);
    }

    void settle(String costClass, LocalDate reservedOn, BigDecimal reserved, BigDecimal actual) {
        Account account = account(costClass);
        synchronized (account) {
            account.rollIfNeeded(today());
            if (!account.day.equals(reservedOn)) {
                // the reservation belonged to a previous day and was dropped on rollover
                return;
            }
            account.reserved = account.reserved.subtract(reserved).max(BigDecimal.ZERO);
            if (actual != null) {
                account.committed = account.committed.add(nonNegative(actual));
            }
        }
    }

    private Account account(String costClass) {
        if (costClass == null || costClass.isBlank()) {
            throw new IllegalArgumentException("costClass is required");
        }
        return accounts.computeIfAbsent(costClass, ignored -> new Account(today()));
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(zone));
    }

    private static BigDecimal nonNegative(BigDecimal value) {
        if (value == null || value.signum() < 0) {
            return BigDecimal.ZERO;
        }
        return value;
    }

    private static final class Account {
        private LocalDate day;
        private BigDecimal committed = BigDecimal.ZERO;
        private BigDecimal reserved = BigDecimal.ZERO;

        private Account(LocalDate day) {
            this.day = day;
        }

        private void rollIfNeeded(LocalDate today) {
            if (!today.equals(day)) {
                day = today;
                committed = BigDecimal.ZERO;
                reserved = BigDecimal.ZERO;
            }
        }
    }
}
